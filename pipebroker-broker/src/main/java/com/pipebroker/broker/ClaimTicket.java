package com.pipebroker.broker;

import java.util.Objects;
import java.util.UUID;

/** Opaque handle returned by {@link DynamicEventHandlers#add}; only used to remove that registration again. */
public final class ClaimTicket {
    private final UUID id;

    ClaimTicket(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClaimTicket other && other.id.equals(id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ClaimTicket(" + id + ")";
    }
}
