package com.pipebroker.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipebroker.broker.EventBrokerSettings;
import com.pipebroker.broker.EventHandler;
import com.pipebroker.broker.EventRegistration;
import com.pipebroker.broker.PublishMode;
import com.pipebroker.broker.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Loads broker settings, named retry profiles and subscriptions from JSON:
 *
 * <pre>
 * {
 *   "broker": { "maxConcurrentHandlers": 4, "publishMode": "AWAIT_COMPLETION" },
 *   "retryProfiles": { "fast": { "type": "fixed", "maxRetries": 2, "delayMillis": 10 } },
 *   "subscriptions": [ { "event": "com.acme.OrderPlaced", "pipeline": "audit", "retry": "fast" } ]
 * }
 * </pre>
 *
 * A subscription names either a {@code pipeline} from the {@link PipelineCatalog} or a {@code handler} class with a
 * no-arg constructor. Every section is optional.
 */
public final class BrokerJsonLoader {
    private static final Logger log = LoggerFactory.getLogger(BrokerJsonLoader.class);
    private static final ObjectMapper M = new ObjectMapper();

    private BrokerJsonLoader() {}

    public static BrokerConfig load(Path file, PipelineCatalog catalog) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, catalog);
        }
    }

    public static BrokerConfig load(InputStream in, PipelineCatalog catalog) throws IOException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(catalog, "catalog");
        JsonNode root;
        try {
            root = M.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed broker configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) throw new IOException("Broker configuration must be a JSON object");

        EventBrokerSettings settings = parseSettings(root.path("broker"));
        Map<String, RetrySettings> profiles = parseProfiles(root.path("retryProfiles"));
        List<EventRegistration<?>> registrations = parseSubscriptions(root.path("subscriptions"), profiles, catalog);
        log.debug("loaded broker configuration: {} retry profiles, {} subscriptions", profiles.size(), registrations.size());
        return new BrokerConfig(settings, profiles, registrations);
    }

    static EventBrokerSettings parseSettings(JsonNode node) throws IOException {
        if (node.isMissingNode()) return EventBrokerSettings.DEFAULT;
        if (!node.isObject()) throw new IOException("'broker' must be an object");
        EventBrokerSettings defaults = EventBrokerSettings.DEFAULT;
        try {
            return EventBrokerSettings.builder()
                .maxConcurrentHandlers(intOr(node, "maxConcurrentHandlers", defaults.maxConcurrentHandlers(), "'broker'"))
                .publishMode(publishMode(node.path("publishMode"), defaults.publishMode()))
                .ringBufferSize(intOr(node, "ringBufferSize", defaults.ringBufferSize(), "'broker'"))
                .retryPollInterval(Duration.ofMillis(
                    longOr(node, "retryPollIntervalMillis", defaults.retryPollInterval().toMillis(), "'broker'")))
                .disableMissingHandlerWarningLog(
                    boolOr(node, "disableMissingHandlerWarningLog", defaults.disableMissingHandlerWarningLog(), "'broker'"))
                .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid 'broker' section: " + e.getMessage(), e);
        }
    }

    static Map<String, RetrySettings> parseProfiles(JsonNode node) throws IOException {
        Map<String, RetrySettings> profiles = new LinkedHashMap<>();
        if (node.isMissingNode()) return profiles;
        if (!node.isObject()) throw new IOException("'retryProfiles' must be an object");
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            profiles.put(field.getKey(), parseProfile(field.getKey(), field.getValue()));
        }
        return profiles;
    }

    private static RetrySettings parseProfile(String name, JsonNode p) throws IOException {
        String where = "retry profile '" + name + "'";
        String type = req(p, "type", where).asText();
        try {
            return switch (type) {
                case "none" -> RetrySettings.none();
                case "manual" -> RetrySettings.manual(reqInt(p, "maxAttempts", where));
                case "fixed" -> RetrySettings.fixed(reqInt(p, "maxRetries", where),
                    Duration.ofMillis(reqLong(p, "delayMillis", where)));
                case "exponential" -> RetrySettings.exponential(reqInt(p, "maxRetries", where),
                    Duration.ofMillis(reqLong(p, "initialDelayMillis", where)),
                    Duration.ofMillis(reqLong(p, "maxDelayMillis", where)));
                default -> throw new IOException("Unsupported retry type '" + type + "' in profile '" + name + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid retry profile '" + name + "': " + e.getMessage(), e);
        }
    }

    private static List<EventRegistration<?>> parseSubscriptions(JsonNode node, Map<String, RetrySettings> profiles,
                                                                 PipelineCatalog catalog) throws IOException {
        List<EventRegistration<?>> registrations = new ArrayList<>();
        if (node.isMissingNode()) return registrations;
        if (!node.isArray()) throw new IOException("'subscriptions' must be an array");
        int index = 0;
        for (JsonNode s : node) {
            String where = "subscription #" + index++;
            Class<?> eventType = loadClass(req(s, "event", where).asText(), where);
            EventRegistration<?> registration = registration(eventType, s, catalog, where);

            if (s.has("retry")) {
                String profile = s.get("retry").asText();
                RetrySettings retry = profiles.get(profile);
                if (retry == null) throw new IOException("Unknown retry profile '" + profile + "' in " + where);
                registration = registration.withRetry(retry);
            }
            registrations.add(registration);
        }
        return registrations;
    }

    private static <E> EventRegistration<E> registration(Class<E> eventType, JsonNode s, PipelineCatalog catalog,
                                                         String where) throws IOException {
        if (s.has("pipeline") == s.has("handler")) {
            throw new IOException(where + " must name exactly one of 'pipeline' or 'handler'");
        }
        if (s.has("pipeline")) {
            String name = s.get("pipeline").asText();
            if (!catalog.has(name)) throw new IOException("Unknown pipeline '" + name + "' in " + where);
            return EventRegistration.pipeline(eventType, catalog.get(name));
        }
        String handlerClass = s.get("handler").asText();
        Class<?> type = loadClass(handlerClass, where);
        if (!EventHandler.class.isAssignableFrom(type)) {
            throw new IOException("Class does not implement EventHandler: " + handlerClass);
        }
        Constructor<?> ctor;
        try {
            ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new IOException("Handler needs an accessible no-arg constructor: " + handlerClass, e);
        }
        return EventRegistration.handler(eventType, new ReflectiveHandlerFactory<E>(ctor, handlerClass));
    }

    private static PublishMode publishMode(JsonNode node, PublishMode fallback) throws IOException {
        if (node.isMissingNode() || node.isNull()) return fallback;
        try {
            return PublishMode.valueOf(node.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown publishMode: " + node.asText(), e);
        }
    }

    private static Class<?> loadClass(String name, String where) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = BrokerJsonLoader.class.getClassLoader();
        try {
            return Class.forName(name, false, loader);
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown class '" + name + "' in " + where, e);
        }
    }

    private static JsonNode req(JsonNode n, String field, String where) throws IOException {
        if (!n.has(field)) throw new IOException("Missing required field '" + field + "' in " + where);
        return n.get(field);
    }

    private static int reqInt(JsonNode n, String field, String where) throws IOException {
        return asInt(req(n, field, where), field, where);
    }

    private static long reqLong(JsonNode n, String field, String where) throws IOException {
        return asLong(req(n, field, where), field, where);
    }

    private static int intOr(JsonNode n, String field, int fallback, String where) throws IOException {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? fallback : asInt(v, field, where);
    }

    private static long longOr(JsonNode n, String field, long fallback, String where) throws IOException {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? fallback : asLong(v, field, where);
    }

    private static boolean boolOr(JsonNode n, String field, boolean fallback, String where) throws IOException {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return fallback;
        if (!v.isBoolean()) throw new IOException("'" + field + "' in " + where + " must be true or false, got " + v);
        return v.booleanValue();
    }

    private static int asInt(JsonNode v, String field, String where) throws IOException {
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new IOException("'" + field + "' in " + where + " must be an integer, got " + v);
        }
        return v.intValue();
    }

    private static long asLong(JsonNode v, String field, String where) throws IOException {
        if (!v.isIntegralNumber() || !v.canConvertToLong()) {
            throw new IOException("'" + field + "' in " + where + " must be an integer, got " + v);
        }
        return v.longValue();
    }
}
