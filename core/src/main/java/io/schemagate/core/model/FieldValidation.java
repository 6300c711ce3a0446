package io.schemagate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Constraint set attached to a {@link SchemaField}. Every bound is optional
 * ({@code null} means "not constrained").
 *
 * <p>
 * Length bounds and {@code pattern} apply to string fields only; value bounds
 * apply to integer and float fields only; {@code allowedValues} applies to any
 * type. {@code defaultValue} is informational and never injected into records.
 *
 * @param required      whether the field must be present in a record
 * @param minLength     minimum string length, inclusive
 * @param maxLength     maximum string length, inclusive
 * @param pattern       regular expression the value must match at its start
 * @param minValue      minimum numeric value, inclusive
 * @param maxValue      maximum numeric value, inclusive
 * @param allowedValues closed set of permitted values; null or empty permits any value
 * @param defaultValue  documented default, or null
 */
public record FieldValidation(
        boolean required,
        Integer minLength,
        Integer maxLength,
        String pattern,
        Double minValue,
        Double maxValue,
        List<Object> allowedValues,
        Object defaultValue) {

    private static final FieldValidation OPTIONAL =
            new FieldValidation(false, null, null, null, null, null, null, null);
    private static final FieldValidation REQUIRED = new FieldValidation(true, null, null, null, null, null, null, null);

    /** Canonical constructor. Copies {@code allowedValues} (null elements allowed). */
    public FieldValidation {
        allowedValues = allowedValues != null ? Collections.unmodifiableList(new ArrayList<>(allowedValues)) : null;
    }

    /** No constraints, not required. */
    public static FieldValidation optional() {
        return OPTIONAL;
    }

    /** Required, with no further constraints. */
    public static FieldValidation requiredOnly() {
        return REQUIRED;
    }

    /** Returns a fresh builder with every constraint unset. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this instance's constraints. */
    public Builder toBuilder() {
        return new Builder()
                .required(required)
                .minLength(minLength)
                .maxLength(maxLength)
                .pattern(pattern)
                .minValue(minValue)
                .maxValue(maxValue)
                .allowedValues(allowedValues)
                .defaultValue(defaultValue);
    }

    /** Copy of this validation with a different {@code required} flag. */
    public FieldValidation withRequired(boolean newRequired) {
        return newRequired == required ? this : toBuilder().required(newRequired).build();
    }

    /** Builder for {@link FieldValidation}. */
    public static final class Builder {
        private boolean required;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private Double minValue;
        private Double maxValue;
        private List<Object> allowedValues;
        private Object defaultValue;

        Builder() {}

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder minValue(Double minValue) {
            this.minValue = minValue;
            return this;
        }

        public Builder maxValue(Double maxValue) {
            this.maxValue = maxValue;
            return this;
        }

        public Builder allowedValues(List<?> allowedValues) {
            this.allowedValues = allowedValues != null ? new ArrayList<>(allowedValues) : null;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public FieldValidation build() {
            return new FieldValidation(
                    required, minLength, maxLength, pattern, minValue, maxValue, allowedValues, defaultValue);
        }
    }
}
