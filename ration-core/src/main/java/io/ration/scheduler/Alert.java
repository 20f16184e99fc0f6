package io.ration.scheduler;

import java.util.Locale;
import java.util.Map;

/** Operational alert row. {@code id} is null until stored. */
public record Alert(Long id,
                    Type type,
                    Severity severity,
                    String clientId,
                    String message,
                    Map<String, Object> details,
                    long createdAt) {

    public enum Type {
        RESOURCE_LOW, QUEUE_BACKUP, REQUEST_STARVATION, BUDGET_EXCEEDED;

        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum Severity {
        WARNING, ERROR, CRITICAL;

        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public Alert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static Alert of(Type type, Severity severity, String clientId, String message, Map<String, Object> details, long now) {
        return new Alert(null, type, severity, clientId, message, details, now);
    }
}
