package io.schemagate.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable field descriptor within a {@link SchemaVersion}.
 *
 * <p>
 * Changes never mutate an instance: the {@code with*} methods return copies,
 * which is what lets a new schema version clone its base's field map without
 * sharing mutable state.
 *
 * @param name           identifier, unique within a version
 * @param type           declared value type
 * @param description    human-readable description, never null
 * @param validation     constraint set, never null
 * @param core           true for the fixed identity/timestamp fields
 * @param status         active or deprecated
 * @param addedInVersion version the field first appeared in; null until the
 *                       field is inserted into a version
 */
public record SchemaField(
        String name,
        FieldType type,
        String description,
        FieldValidation validation,
        boolean core,
        FieldStatus status,
        SemanticVersion addedInVersion) {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    /** Canonical constructor: validates the name and fills defaults. */
    public SchemaField {
        Objects.requireNonNull(name, "field name must not be null");
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Field name '" + name + "' is not a valid identifier");
        }
        Objects.requireNonNull(type, "field type must not be null");
        description = description != null ? description : "";
        validation = validation != null ? validation : FieldValidation.optional();
        status = status != null ? status : FieldStatus.ACTIVE;
    }

    /**
     * Creates a non-core, active field whose version is assigned on insertion.
     */
    public static SchemaField of(String name, FieldType type, String description, FieldValidation validation) {
        return new SchemaField(name, type, description, validation, false, FieldStatus.ACTIVE, null);
    }

    /** Returns {@code true} if {@code name} is a valid field identifier. */
    public static boolean isValidName(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public boolean required() {
        return validation.required();
    }

    public boolean deprecated() {
        return status.isDeprecated();
    }

    public SchemaField withStatus(FieldStatus newStatus) {
        return new SchemaField(name, type, description, validation, core, newStatus, addedInVersion);
    }

    public SchemaField withAddedInVersion(SemanticVersion version) {
        return new SchemaField(name, type, description, validation, core, status, version);
    }

    /**
     * Replaces type, description and validation while keeping name, core flag,
     * status and {@code addedInVersion}.
     */
    public SchemaField withDefinition(FieldType newType, String newDescription, FieldValidation newValidation) {
        return new SchemaField(name, newType, newDescription, newValidation, core, status, addedInVersion);
    }
}
