package io.schemagate.core.engine;

import io.schemagate.core.model.SemanticVersion;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field usage over a set of sample records, measured against the current
 * schema version.
 *
 * @param totalSamples   number of samples analyzed
 * @param schemaVersion  version the samples were measured against
 * @param fieldUsage     per-field statistics in schema field order
 * @param unknownFields  keys absent from the schema, in first-seen order, with
 *                       the number of samples containing each
 * @param complianceRate fraction of schema fields with a usage rate above 0.8
 */
public record UsageReport(
        int totalSamples,
        SemanticVersion schemaVersion,
        Map<String, FieldUsage> fieldUsage,
        Map<String, Integer> unknownFields,
        double complianceRate) {

    public UsageReport {
        fieldUsage = Collections.unmodifiableMap(new LinkedHashMap<>(fieldUsage != null ? fieldUsage : Map.of()));
        unknownFields =
                Collections.unmodifiableMap(new LinkedHashMap<>(unknownFields != null ? unknownFields : Map.of()));
    }

    /** Report for an empty sample set: no statistics, zero compliance. */
    public static UsageReport empty(SemanticVersion schemaVersion) {
        return new UsageReport(0, schemaVersion, Map.of(), Map.of(), 0.0);
    }

    public boolean isEmpty() {
        return totalSamples == 0;
    }
}
