package io.schemagate.core.model;

import java.util.Locale;
import java.util.Optional;

/** Reviewer decision on a pending change request. */
public enum ReviewAction {
    APPROVE,
    REJECT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses {@code "approve"} or {@code "reject"}; anything else is empty. */
    public static Optional<ReviewAction> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ReviewAction action : values()) {
            if (action.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
