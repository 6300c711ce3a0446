package io.schemagate.core.model;

import java.util.Locale;

/**
 * Structural change a request proposes. {@link #RENAME_FIELD} is accepted and
 * risk-assessed but cannot be executed, so approving one always ends in
 * rejection.
 */
public enum ChangeType {
    ADD_FIELD,
    REMOVE_FIELD,
    MODIFY_FIELD,
    RENAME_FIELD;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name such as {@code "add_field"}.
     *
     * @throws IllegalArgumentException if the name is unknown or null
     */
    public static ChangeType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("change type must not be null");
        }
        for (ChangeType type : values()) {
            if (type.wireName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type '" + value + "'");
    }
}
