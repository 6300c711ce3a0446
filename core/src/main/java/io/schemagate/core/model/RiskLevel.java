package io.schemagate.core.model;

import java.util.Locale;
import java.util.Objects;

/** Risk classification of a proposed schema change, lowest first. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromWire(String value) {
        Objects.requireNonNull(value, "risk level must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
