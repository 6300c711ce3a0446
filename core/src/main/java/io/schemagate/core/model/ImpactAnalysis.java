package io.schemagate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Estimated consequences of a change request, computed once at creation.
 *
 * @param breakingChange     existing consumers may break (removal or type change)
 * @param migrationRequired  stored records need rewriting
 * @param affectedFields     fields the change touches
 * @param riskLevel          risk classification of the request
 * @param estimatedEffort    {@code minimal}, {@code moderate} or {@code significant}
 * @param estimatedDowntime  free-form downtime estimate
 * @param rollbackComplexity {@code simple}, {@code moderate} or {@code complex}
 */
public record ImpactAnalysis(
        boolean breakingChange,
        boolean migrationRequired,
        List<String> affectedFields,
        RiskLevel riskLevel,
        String estimatedEffort,
        String estimatedDowntime,
        String rollbackComplexity) {

    public ImpactAnalysis {
        affectedFields = affectedFields != null ? List.copyOf(affectedFields) : List.of();
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
    }
}
