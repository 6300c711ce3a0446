package io.schemagate.core.model;

import java.util.Locale;
import java.util.Objects;

/** Change request status. APPROVED and REJECTED are terminal. */
public enum RequestStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RequestStatus fromWire(String value) {
        Objects.requireNonNull(value, "status must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
