package io.schemagate.core.model;

/**
 * Payload of a change request. Every component is optional; a {@code null}
 * means the request does not touch that aspect of the field. Risk assessment
 * relies on that distinction: a modify request that leaves {@code fieldType}
 * and {@code required} null is low risk.
 *
 * @param fieldType   new or initial field type
 * @param description new or initial description
 * @param required    new or initial required flag
 * @param validation  new or initial constraint set; its own {@code required}
 *                    flag is never applied: an add uses {@code required}, a
 *                    modify uses {@code required} or else keeps the field's
 *                    current flag
 */
public record ChangeDetails(FieldType fieldType, String description, Boolean required, FieldValidation validation) {

    private static final ChangeDetails EMPTY = new ChangeDetails(null, null, null, null);

    public static ChangeDetails empty() {
        return EMPTY;
    }

    public static ChangeDetails forNewField(FieldType type, String description, boolean required) {
        return new ChangeDetails(type, description, required, null);
    }

    public boolean touchesType() {
        return fieldType != null;
    }

    public boolean touchesRequired() {
        return required != null;
    }

    public boolean requiresValue() {
        return Boolean.TRUE.equals(required);
    }
}
