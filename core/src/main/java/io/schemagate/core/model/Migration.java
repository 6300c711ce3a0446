package io.schemagate.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the append-only migration log. Every successful field mutation
 * appends exactly one migration.
 *
 * @param fromVersion     version the change was based on
 * @param toVersion       version the change was written to
 * @param type            kind of mutation
 * @param fieldName       field that was changed
 * @param migrationScript human-readable forward script
 * @param rollbackScript  human-readable rollback script
 * @param createdAt       when the migration was recorded
 */
public record Migration(
        SemanticVersion fromVersion,
        SemanticVersion toVersion,
        Type type,
        String fieldName,
        String migrationScript,
        String rollbackScript,
        Instant createdAt) {

    /** Mutation kind, serialized by its wire name. */
    public enum Type {
        ADD_FIELD,
        REMOVE_FIELD,
        MODIFY_FIELD;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type fromWire(String value) {
            Objects.requireNonNull(value, "migration type must not be null");
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public Migration {
        Objects.requireNonNull(fromVersion, "fromVersion must not be null");
        Objects.requireNonNull(toVersion, "toVersion must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        migrationScript = migrationScript != null ? migrationScript : "";
        rollbackScript = rollbackScript != null ? rollbackScript : "";
    }

    /**
     * Whether {@code target} shows this change: added and modified fields are
     * present, removed fields are deprecated.
     *
     * @param target the version named by {@link #toVersion()}, or null if it does not exist
     */
    public boolean isReflectedIn(SchemaVersion target) {
        if (target == null || !target.version().equals(toVersion)) {
            return false;
        }
        Optional<SchemaField> field = target.field(fieldName);
        return switch (type) {
            case ADD_FIELD, MODIFY_FIELD -> field.isPresent();
            case REMOVE_FIELD -> field.map(SchemaField::deprecated).orElse(false);
        };
    }
}
