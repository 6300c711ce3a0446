package io.schemagate.core.engine;

/**
 * Usage statistics of one schema field over a sample set.
 *
 * @param fieldName    field name
 * @param usageCount   samples containing the field
 * @param usageRate    {@code usageCount / totalSamples}
 * @param missingCount samples lacking the field
 * @param required     whether the field is required
 * @param core         whether the field is a core field
 * @param deprecated   whether the field is deprecated
 */
public record FieldUsage(
        String fieldName,
        int usageCount,
        double usageRate,
        int missingCount,
        boolean required,
        boolean core,
        boolean deprecated) {}
