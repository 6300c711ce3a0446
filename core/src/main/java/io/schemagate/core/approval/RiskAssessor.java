package io.schemagate.core.approval;

import io.schemagate.core.model.ApprovalLevel;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.CoreFields;
import io.schemagate.core.model.ImpactAnalysis;
import io.schemagate.core.model.RiskLevel;
import java.util.List;
import java.util.Objects;

/**
 * Classifies proposed changes. Every method is a pure function of its
 * arguments.
 *
 * <p>
 * Risk rules, first match wins:
 * <ol>
 * <li>the field is a core field: {@code critical}</li>
 * <li>remove or rename: {@code high}</li>
 * <li>add: {@code medium} if the new field is required, else {@code low}</li>
 * <li>modify: {@code medium} if it touches the type or the required flag,
 * else {@code low}</li>
 * </ol>
 */
public final class RiskAssessor {

    public RiskLevel assessRisk(ChangeType changeType, String fieldName, ChangeDetails details) {
        Objects.requireNonNull(changeType, "changeType must not be null");
        ChangeDetails d = details != null ? details : ChangeDetails.empty();
        if (CoreFields.isCore(fieldName)) {
            return RiskLevel.CRITICAL;
        }
        return switch (changeType) {
            case REMOVE_FIELD, RENAME_FIELD -> RiskLevel.HIGH;
            case ADD_FIELD -> d.requiresValue() ? RiskLevel.MEDIUM : RiskLevel.LOW;
            case MODIFY_FIELD -> d.touchesType() || d.touchesRequired() ? RiskLevel.MEDIUM : RiskLevel.LOW;
        };
    }

    public ApprovalLevel approvalLevelFor(RiskLevel risk) {
        return switch (risk) {
            case LOW -> ApprovalLevel.AUTOMATIC;
            case MEDIUM -> ApprovalLevel.REVIEWER;
            case HIGH -> ApprovalLevel.ADMIN;
            case CRITICAL -> ApprovalLevel.COMMITTEE;
        };
    }

    /**
     * Estimates the consequences of a change.
     *
     * <p>
     * Removal and type changes break consumers. Those two, and adding a
     * required field, need existing records migrated. Effort follows: breaking
     * changes are significant, other migrations moderate, the rest minimal.
     */
    public ImpactAnalysis analyzeImpact(ChangeType changeType, String fieldName, ChangeDetails details) {
        ChangeDetails d = details != null ? details : ChangeDetails.empty();
        boolean typeChange = changeType == ChangeType.MODIFY_FIELD && d.touchesType();
        boolean newlyRequired = changeType == ChangeType.ADD_FIELD && d.requiresValue();
        boolean breaking = changeType == ChangeType.REMOVE_FIELD || typeChange;
        boolean migration = breaking || newlyRequired;

        String effort = breaking ? "significant" : (migration ? "moderate" : "minimal");
        String downtime = newlyRequired ? "5-10 minutes" : "0 minutes";
        String rollback;
        if (changeType == ChangeType.REMOVE_FIELD) {
            rollback = "complex";
        } else if (typeChange) {
            rollback = "moderate";
        } else {
            rollback = "simple";
        }
        return new ImpactAnalysis(
                breaking,
                migration,
                List.of(fieldName),
                assessRisk(changeType, fieldName, d),
                effort,
                downtime,
                rollback);
    }
}
