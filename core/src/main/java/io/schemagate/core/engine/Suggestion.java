package io.schemagate.core.engine;

import java.util.Locale;
import java.util.Objects;

/**
 * Recommended schema change derived from a {@link UsageReport}. Suggestions
 * are advisory; acting on one means submitting a change request.
 *
 * @param kind      what to change
 * @param fieldName field concerned
 * @param reason    human-readable rationale
 * @param priority  urgency
 */
public record Suggestion(Kind kind, String fieldName, String reason, Priority priority) {

    public enum Kind {
        ADD_FIELD,
        DEPRECATE_FIELD,
        MAKE_REQUIRED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** Declared lowest first; sort descending for most urgent first. */
    public enum Priority {
        LOW,
        MEDIUM,
        HIGH;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Suggestion {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        reason = reason != null ? reason : "";
    }
}
