package io.schemagate.core.spi;

import io.schemagate.core.model.ApprovalLevel;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.RequestStatus;
import io.schemagate.core.model.RiskLevel;
import io.schemagate.core.model.SemanticVersion;

/**
 * SPI for observing schema governance: applied and refused field mutations,
 * and change requests moving through the approval workflow.
 *
 * <p>
 * Hosts plug in implementations that forward to audit trails, metrics or
 * notifications. Events are immutable. Implementations must be thread-safe and
 * should return quickly, since callbacks run while the caller holds its lock.
 * Exceptions thrown by listeners are caught and logged by the caller; they never
 * change the outcome of the operation being reported.
 */
public interface GovernanceListener {

    /** No-op listener. */
    GovernanceListener NONE = new GovernanceListener() {};

    /**
     * Called after a field mutation has been persisted.
     *
     * @param event contains mutation type, field name, base and target versions
     */
    default void onFieldMutated(FieldMutatedEvent event) {}

    /**
     * Called when the evolution engine refuses a mutation.
     *
     * @param event contains mutation type, field name and the reason
     */
    default void onMutationRejected(MutationRejectedEvent event) {}

    /**
     * Called once a change request has been assessed and recorded.
     *
     * @param event contains request id, change type, risk and approval level
     */
    default void onRequestCreated(RequestCreatedEvent event) {}

    /**
     * Called when a request reaches a terminal status, automatically or by review.
     *
     * @param event contains request id, final status, reviewer and comments
     */
    default void onRequestFinalized(RequestFinalizedEvent event) {}

    // --- Event records ---

    /** A field mutation was applied. */
    record FieldMutatedEvent(
            Migration.Type type, String fieldName, SemanticVersion fromVersion, SemanticVersion toVersion) {}

    /** A field mutation was refused; state is unchanged. */
    record MutationRejectedEvent(Migration.Type type, String fieldName, String reason) {}

    /** A change request was created. */
    record RequestCreatedEvent(
            String requestId,
            ChangeType changeType,
            String fieldName,
            RiskLevel riskLevel,
            ApprovalLevel approvalLevel,
            String proposedBy) {}

    /** A change request was approved or rejected. */
    record RequestFinalizedEvent(String requestId, RequestStatus status, String reviewer, String comments) {}
}
