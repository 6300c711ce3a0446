package io.schemagate.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The identity and timestamp fields every knowledge record carries. They are
 * part of the bootstrap version and can never be removed.
 */
public final class CoreFields {

    public static final String CONTENT_ID = "content_id";
    public static final String TITLE = "title";
    public static final String CONTENT_TYPE = "content_type";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private static final Set<String> NAMES = Set.of(CONTENT_ID, TITLE, CONTENT_TYPE, CREATED_AT, UPDATED_AT);

    private CoreFields() {
        // constants
    }

    /** Returns {@code true} if {@code fieldName} names a core field. */
    public static boolean isCore(String fieldName) {
        return fieldName != null && NAMES.contains(fieldName);
    }

    public static Set<String> names() {
        return NAMES;
    }

    /** Core field definitions in declaration order, all added in 1.0.0. */
    public static Map<String, SchemaField> definitions() {
        Map<String, SchemaField> fields = new LinkedHashMap<>();
        put(fields, CONTENT_ID, FieldType.STRING, "Unique content identifier", FieldValidation.requiredOnly());
        put(
                fields,
                TITLE,
                FieldType.STRING,
                "Content title",
                FieldValidation.builder().required(true).maxLength(200).build());
        put(fields, CONTENT_TYPE, FieldType.STRING, "Content type", FieldValidation.requiredOnly());
        put(fields, CREATED_AT, FieldType.DATETIME, "Creation time", FieldValidation.requiredOnly());
        put(fields, UPDATED_AT, FieldType.DATETIME, "Last update time", FieldValidation.requiredOnly());
        return fields;
    }

    private static void put(
            Map<String, SchemaField> fields,
            String name,
            FieldType type,
            String description,
            FieldValidation validation) {
        fields.put(
                name,
                new SchemaField(
                        name, type, description, validation, true, FieldStatus.ACTIVE, SemanticVersion.INITIAL));
    }
}
