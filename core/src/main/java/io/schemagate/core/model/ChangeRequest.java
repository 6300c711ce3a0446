package io.schemagate.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Proposed structural change awaiting (or having received) a decision.
 *
 * <p>
 * Immutable. A pending request is finalized by {@link #finalized} which
 * returns a new instance with a terminal status; the approval gate then moves
 * that instance into its history, where it is never replaced.
 *
 * @param id                    request identifier (UUID string)
 * @param changeType            kind of change
 * @param fieldName             field the change targets
 * @param details               change payload
 * @param riskLevel             assessed risk
 * @param requiredApprovalLevel who must approve
 * @param proposedBy            proposer identity
 * @param proposedAt            creation time
 * @param justification         proposer's rationale
 * @param status                pending, approved or rejected
 * @param reviewedBy            reviewer identity, null while pending
 * @param reviewedAt            decision time, null while pending
 * @param reviewComments        reviewer comments plus any execution note
 * @param impactAnalysis        estimated consequences
 */
public record ChangeRequest(
        String id,
        ChangeType changeType,
        String fieldName,
        ChangeDetails details,
        RiskLevel riskLevel,
        ApprovalLevel requiredApprovalLevel,
        String proposedBy,
        Instant proposedAt,
        String justification,
        RequestStatus status,
        String reviewedBy,
        Instant reviewedAt,
        String reviewComments,
        ImpactAnalysis impactAnalysis) {

    public ChangeRequest {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(changeType, "changeType must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        Objects.requireNonNull(requiredApprovalLevel, "requiredApprovalLevel must not be null");
        Objects.requireNonNull(proposedAt, "proposedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(impactAnalysis, "impactAnalysis must not be null");
        details = details != null ? details : ChangeDetails.empty();
        proposedBy = proposedBy != null ? proposedBy : "system";
        justification = justification != null ? justification : "";
        reviewComments = reviewComments != null ? reviewComments : "";
    }

    /**
     * Returns a copy carrying a terminal decision.
     *
     * @throws IllegalArgumentException if {@code terminalStatus} is PENDING
     */
    public ChangeRequest finalized(RequestStatus terminalStatus, String reviewer, Instant at, String comments) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("finalized status must be APPROVED or REJECTED");
        }
        return new ChangeRequest(
                id,
                changeType,
                fieldName,
                details,
                riskLevel,
                requiredApprovalLevel,
                proposedBy,
                proposedAt,
                justification,
                terminalStatus,
                reviewer,
                at,
                comments,
                impactAnalysis);
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }
}
