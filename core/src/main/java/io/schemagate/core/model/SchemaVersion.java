package io.schemagate.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named snapshot of the field set. Immutable: the registry replaces a version
 * with the copy returned by {@link #withField(SchemaField)} rather than editing
 * it in place.
 *
 * @param version            semantic version, unique within the registry
 * @param description        what changed in this version
 * @param createdAt          creation time
 * @param active             whether this version is eligible to be "current"
 * @param backwardCompatible false once a change requires existing records to
 *                           be migrated
 * @param fields             fields keyed by name, in insertion order
 */
public record SchemaVersion(
        SemanticVersion version,
        String description,
        Instant createdAt,
        boolean active,
        boolean backwardCompatible,
        Map<String, SchemaField> fields) {

    public SchemaVersion {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        description = description != null ? description : "";
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields != null ? fields : Map.of()));
    }

    /** Creates the bootstrap version holding the core fields. */
    public static SchemaVersion bootstrap(Instant createdAt) {
        return new SchemaVersion(
                SemanticVersion.INITIAL,
                "Base schema with core fields",
                createdAt,
                true,
                true,
                CoreFields.definitions());
    }

    public Optional<SchemaField> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /** Copy of this version with {@code field} inserted or replaced. */
    public SchemaVersion withField(SchemaField field) {
        Map<String, SchemaField> updated = new LinkedHashMap<>(fields);
        updated.put(field.name(), field);
        return new SchemaVersion(version, description, createdAt, active, backwardCompatible, updated);
    }

    public SchemaVersion withBackwardCompatible(boolean compatible) {
        return compatible == backwardCompatible
                ? this
                : new SchemaVersion(version, description, createdAt, active, compatible, fields);
    }

    public SchemaVersion withActive(boolean newActive) {
        return newActive == active
                ? this
                : new SchemaVersion(version, description, createdAt, newActive, backwardCompatible, fields);
    }

    /**
     * Clones this version's fields into a new active, backward-compatible
     * version.
     */
    public SchemaVersion cloneAs(SemanticVersion newVersion, String newDescription, Instant newCreatedAt) {
        return new SchemaVersion(newVersion, newDescription, newCreatedAt, true, true, fields);
    }

    public long coreFieldCount() {
        return fields.values().stream().filter(SchemaField::core).count();
    }

    public long deprecatedFieldCount() {
        return fields.values().stream().filter(SchemaField::deprecated).count();
    }
}
