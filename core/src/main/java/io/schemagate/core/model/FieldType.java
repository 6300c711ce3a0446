package io.schemagate.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of value types a schema field can declare. Every validation and
 * construction site switches over this enum exhaustively, so adding a constant
 * is a compile-checked change.
 *
 * <p>
 * The wire name is what appears in {@code schemas.json} and in tool requests.
 * Two legacy aliases are accepted when parsing: {@code dict} (for {@link #MAP})
 * and {@code json} (for {@link #FREEFORM}).
 */
public enum FieldType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATETIME("datetime"),
    LIST("list"),
    MAP("map"),
    FREEFORM("freeform");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    /** The lower-case name used in persisted files and tool payloads. */
    public String wireName() {
        return wireName;
    }

    /** Returns {@code true} for {@link #INTEGER} and {@link #FLOAT}. */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Parses a wire name (case-insensitive, aliases included).
     *
     * @param value the wire name, e.g. {@code "string"} or {@code "dict"}
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown or null
     */
    public static FieldType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("field type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "dict":
                return MAP;
            case "json":
                return FREEFORM;
            default:
                for (FieldType type : values()) {
                    if (type.wireName.equals(normalized)) {
                        return type;
                    }
                }
                throw new IllegalArgumentException(
                        "Unknown field type '" + value + "', expected one of " + wireNames());
        }
    }

    /** All canonical wire names, in declaration order. */
    public static List<String> wireNames() {
        return Arrays.stream(values()).map(FieldType::wireName).toList();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
