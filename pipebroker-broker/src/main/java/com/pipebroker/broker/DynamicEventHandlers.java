package com.pipebroker.broker;

import com.pipebroker.core.Pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registrations added and removed while the broker runs. Each event type maps to an immutable list that is replaced
 * on every change, so dispatch iterates a stable snapshot.
 */
public final class DynamicEventHandlers implements PipelineRegistry {
    private final Map<Class<?>, List<Entry>> byType = new ConcurrentHashMap<>();
    private final Map<ClaimTicket, Class<?>> tickets = new ConcurrentHashMap<>();

    private record Entry(ClaimTicket ticket, EventRegistration<?> registration) {}

    public <E> ClaimTicket add(EventRegistration<E> registration) {
        Objects.requireNonNull(registration, "registration");
        ClaimTicket ticket = new ClaimTicket(UUID.randomUUID());
        Class<?> eventType = registration.eventType();
        tickets.put(ticket, eventType);
        byType.compute(eventType, (type, current) -> {
            List<Entry> next = current == null ? new ArrayList<>(1) : new ArrayList<>(current);
            next.add(new Entry(ticket, registration));
            return List.copyOf(next);
        });
        return ticket;
    }

    public <E> ClaimTicket add(Class<E> eventType, Pipeline pipeline) {
        return add(EventRegistration.pipeline(eventType, pipeline));
    }

    public <E> ClaimTicket add(Class<E> eventType, EventHandler<E> handler) {
        return add(EventRegistration.handler(eventType, handler));
    }

    /** @return {@code false} when the ticket is unknown or was already removed */
    public boolean remove(ClaimTicket ticket) {
        Objects.requireNonNull(ticket, "ticket");
        Class<?> eventType = tickets.remove(ticket);
        if (eventType == null) return false;
        byType.computeIfPresent(eventType, (type, current) -> {
            List<Entry> next = new ArrayList<>(current.size());
            for (Entry entry : current) {
                if (!entry.ticket().equals(ticket)) next.add(entry);
            }
            return next.isEmpty() ? null : List.copyOf(next);
        });
        return true;
    }

    /** @return number of tickets actually removed */
    public int removeRange(Collection<ClaimTicket> claimTickets) {
        Objects.requireNonNull(claimTickets, "claimTickets");
        int removed = 0;
        for (ClaimTicket ticket : claimTickets) {
            if (remove(ticket)) removed++;
        }
        return removed;
    }

    @Override
    public List<EventRegistration<?>> registrationsFor(Class<?> eventType) {
        List<Entry> entries = byType.get(eventType);
        if (entries == null) return List.of();
        List<EventRegistration<?>> registrations = new ArrayList<>(entries.size());
        for (Entry entry : entries) registrations.add(entry.registration());
        return registrations;
    }

    public int size() {
        return tickets.size();
    }
}
