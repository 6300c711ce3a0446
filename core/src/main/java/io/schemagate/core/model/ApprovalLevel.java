package io.schemagate.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Who must sign off a change request. {@link #AUTOMATIC} requests are executed
 * at creation time and never wait for a reviewer.
 */
public enum ApprovalLevel {
    AUTOMATIC,
    REVIEWER,
    ADMIN,
    COMMITTEE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ApprovalLevel fromWire(String value) {
        Objects.requireNonNull(value, "approval level must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
