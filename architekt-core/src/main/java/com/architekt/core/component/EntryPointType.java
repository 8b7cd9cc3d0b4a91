package com.architekt.core.component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Known entry point types with the protocols and methods each one accepts.
 *
 * <p>An empty list means the field does not apply to the type.
 */
public enum EntryPointType {
    HTTP("http",
        List.of("HTTP", "http/2", "HTTPS", "gRPC", "GraphQL", "WebSocket"),
        List.of("get", "post", "put", "patch", "delete", "options", "head", "connect", "trace")),
    WEBHOOK("webhook",
        List.of("HTTP", "HTTPS"),
        List.of("post", "put", "patch")),
    QUEUE("queue",
        List.of("AMQP", "Kafka", "MQTT"),
        List.of("publish", "subscribe", "listen")),
    EVENT("event",
        List.of("HTTP", "HTTPS", "WebSocket", "GraphQL"),
        List.of("subscribe", "trigger")),
    STREAM("stream",
        List.of("Kafka", "MQTT", "WebSocket"),
        List.of("listen", "subscribe")),
    CRON("cron",
        List.of(),
        List.of("schedule", "trigger")),
    FIREBASE_FUNCTION("firebase-function",
        List.of(),
        List.of());

    private final String id;
    private final List<String> allowedProtocols;
    private final List<String> allowedMethods;

    EntryPointType(String id, List<String> allowedProtocols, List<String> allowedMethods) {
        this.id = id;
        this.allowedProtocols = allowedProtocols;
        this.allowedMethods = allowedMethods;
    }

    public String id() {
        return id;
    }

    public List<String> allowedProtocols() {
        return allowedProtocols;
    }

    public List<String> allowedMethods() {
        return allowedMethods;
    }

    public boolean allowsProtocol(String protocol) {
        return containsIgnoreCase(allowedProtocols, protocol);
    }

    public boolean allowsMethod(String method) {
        return containsIgnoreCase(allowedMethods, method);
    }

    /**
     * Looks up a type by id (case-insensitive).
     *
     * @param id type id such as "http" or "firebase-function"
     * @return matching type, empty if unknown
     */
    public static Optional<EntryPointType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (EntryPointType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        String trimmed = candidate.trim();
        return values.stream().anyMatch(value -> value.equalsIgnoreCase(trimmed));
    }
}
