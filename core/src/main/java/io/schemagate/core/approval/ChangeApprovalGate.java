package io.schemagate.core.approval;

import io.schemagate.core.engine.MutationResult;
import io.schemagate.core.engine.SchemaEvolutionEngine;
import io.schemagate.core.error.SchemagateException;
import io.schemagate.core.model.ApprovalLevel;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeRequest;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.FieldValidation;
import io.schemagate.core.model.ImpactAnalysis;
import io.schemagate.core.model.RequestStatus;
import io.schemagate.core.model.ReviewAction;
import io.schemagate.core.model.RiskLevel;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.spi.GovernanceListener;
import io.schemagate.core.store.ApprovalState;
import io.schemagate.core.store.ApprovalStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Risk-based approval workflow in front of the evolution engine. It is the
 * only component that applies field mutations on behalf of change requests.
 *
 * <p>
 * Lifecycle: a request is assessed when created. Low-risk requests
 * (approval level {@code automatic}) are executed immediately and go
 * straight to history as {@code approved}, or {@code rejected} if execution
 * fails. All others wait in the pending set until an authorized reviewer
 * approves (which executes the change) or rejects them. A decided request
 * moves to history, where it is never modified again. Execution failures are
 * folded into the request's comments; they never leave a request pending.
 *
 * <p>
 * Thread-safe. Create and review are serialized by one lock, held while
 * calling into the engine (lock order gate, then registry). State is saved
 * to the {@link ApprovalStore} after every transition. A failed save after a
 * decision is logged and does not undo the decision.
 */
public final class ChangeApprovalGate {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeApprovalGate.class);

    static final String SYSTEM_REVIEWER = "system";
    static final String AUTO_APPROVED_COMMENT = "Automatically approved (low-risk change)";

    private final SchemaEvolutionEngine engine;
    private final ReviewerDirectory directory;
    private final ApprovalStore store;
    private final Clock clock;
    private final RiskAssessor riskAssessor = new RiskAssessor();
    private final GovernanceListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, ChangeRequest> pending = new LinkedHashMap<>();
    private final List<ChangeRequest> history = new ArrayList<>();

    /**
     * Creates a gate and loads any previously saved requests from {@code store}.
     *
     * @param engine    engine that executes approved changes
     * @param directory reviewer and admin sets
     * @param store     persistence for pending requests and history
     * @param clock     time source for proposal and review timestamps
     * @param listener  governance observer, may be {@link GovernanceListener#NONE}
     */
    public ChangeApprovalGate(
            SchemaEvolutionEngine engine,
            ReviewerDirectory directory,
            ApprovalStore store,
            Clock clock,
            GovernanceListener listener) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener != null ? listener : GovernanceListener.NONE;

        ApprovalState saved = store.load();
        saved.pending().forEach(r -> pending.put(r.id(), r));
        history.addAll(saved.history());
        if (!pending.isEmpty() || !history.isEmpty()) {
            LOG.info("Loaded approval state: pending={}, history={}", pending.size(), history.size());
        }
    }

    public ReviewerDirectory directory() {
        return directory;
    }

    // --- Assessment ---

    public RiskLevel assessRisk(ChangeType changeType, String fieldName, ChangeDetails details) {
        return riskAssessor.assessRisk(changeType, fieldName, details);
    }

    public ApprovalLevel approvalLevelFor(RiskLevel risk) {
        return riskAssessor.approvalLevelFor(risk);
    }

    // --- Lifecycle ---

    /**
     * Records a change request, executing it at once if it is low risk.
     *
     * @return the request id; look the request up with {@link #findRequest} to
     *         learn whether it was executed, rejected or left pending
     * @throws io.schemagate.core.error.SchemaStoreException if a request that
     *                                                       needs review cannot be saved; the request is dropped
     */
    public String createChangeRequest(
            ChangeType changeType, String fieldName, ChangeDetails details, String proposedBy, String justification) {
        Objects.requireNonNull(changeType, "changeType must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        ChangeDetails d = details != null ? details : ChangeDetails.empty();

        lock.lock();
        try {
            RiskLevel risk = riskAssessor.assessRisk(changeType, fieldName, d);
            ApprovalLevel level = riskAssessor.approvalLevelFor(risk);
            ImpactAnalysis impact = riskAssessor.analyzeImpact(changeType, fieldName, d);
            ChangeRequest request = new ChangeRequest(
                    UUID.randomUUID().toString(),
                    changeType,
                    fieldName,
                    d,
                    risk,
                    level,
                    proposedBy,
                    clock.instant(),
                    justification,
                    RequestStatus.PENDING,
                    null,
                    null,
                    null,
                    impact);
            LOG.info(
                    "Created change request {}: {} '{}', risk={}, approval={}",
                    request.id(),
                    changeType.wireName(),
                    fieldName,
                    risk.wireName(),
                    level.wireName());
            notifyCreated(request);

            if (level != ApprovalLevel.AUTOMATIC) {
                pending.put(request.id(), request);
                try {
                    persist();
                } catch (RuntimeException e) {
                    pending.remove(request.id());
                    throw e;
                }
                return request.id();
            }

            MutationResult outcome = execute(request);
            ChangeRequest decided = outcome.applied()
                    ? request.finalized(RequestStatus.APPROVED, SYSTEM_REVIEWER, clock.instant(), AUTO_APPROVED_COMMENT)
                    : request.finalized(
                            RequestStatus.REJECTED,
                            SYSTEM_REVIEWER,
                            clock.instant(),
                            "Execution failed: " + outcome.reason());
            history.add(decided);
            persistDecision(decided);
            LOG.info("Auto-decided change request {}: {}", decided.id(), decided.status().wireName());
            notifyFinalized(decided);
            return request.id();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decides a pending request.
     *
     * @param requestId id of a pending request
     * @param reviewer  reviewer identity; must be authorized for the request's level
     * @param action    approve (executes the change) or reject
     * @param comments  reviewer comments, may be null
     * @return {@code false} with no state change if the request is not pending
     *         or the reviewer is not authorized; {@code true} once the request is
     *         in history, whatever its final status
     */
    public boolean reviewRequest(String requestId, String reviewer, ReviewAction action, String comments) {
        Objects.requireNonNull(action, "action must not be null");
        lock.lock();
        try {
            ChangeRequest request = requestId != null ? pending.get(requestId) : null;
            if (request == null) {
                LOG.warn("Review refused: no pending request with id {}", requestId);
                return false;
            }
            if (!directory.canReview(reviewer, request.requiredApprovalLevel())) {
                LOG.warn(
                        "Review refused: '{}' may not review {} requests (request {})",
                        reviewer,
                        request.requiredApprovalLevel().wireName(),
                        requestId);
                return false;
            }

            String note = comments != null ? comments : "";
            ChangeRequest decided;
            if (action == ReviewAction.APPROVE) {
                MutationResult outcome = execute(request);
                decided = outcome.applied()
                        ? request.finalized(RequestStatus.APPROVED, reviewer, clock.instant(), note)
                        : request.finalized(
                                RequestStatus.REJECTED,
                                reviewer,
                                clock.instant(),
                                appendNote(note, "(execution failed: " + outcome.reason() + ")"));
            } else {
                decided = request.finalized(RequestStatus.REJECTED, reviewer, clock.instant(), note);
            }

            pending.remove(requestId);
            history.add(decided);
            persistDecision(decided);
            LOG.info(
                    "Reviewed change request {}: {} by {} -> {}",
                    requestId,
                    action.wireName(),
                    reviewer,
                    decided.status().wireName());
            notifyFinalized(decided);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // --- Queries ---

    /**
     * Pending requests in creation order.
     *
     * @param reviewer when non-null, only requests this reviewer may decide
     */
    public List<ChangeRequest> getPendingRequests(String reviewer) {
        lock.lock();
        try {
            return pending.values().stream()
                    .filter(r -> reviewer == null || directory.canReview(reviewer, r.requiredApprovalLevel()))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<ChangeRequest> getPendingRequests() {
        return getPendingRequests(null);
    }

    /**
     * The most recent {@code limit} decided requests, oldest first. A
     * non-positive limit yields an empty list.
     */
    public List<ChangeRequest> getApprovalHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            int from = Math.max(0, history.size() - limit);
            return List.copyOf(history.subList(from, history.size()));
        } finally {
            lock.unlock();
        }
    }

    /** Finds a request by id, pending or decided. */
    public Optional<ChangeRequest> findRequest(String requestId) {
        lock.lock();
        try {
            ChangeRequest p = pending.get(requestId);
            if (p != null) {
                return Optional.of(p);
            }
            for (int i = history.size() - 1; i >= 0; i--) {
                if (history.get(i).id().equals(requestId)) {
                    return Optional.of(history.get(i));
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    // --- Execution ---

    /** Applies the request's change; never throws. */
    private MutationResult execute(ChangeRequest request) {
        try {
            ChangeDetails d = request.details();
            return switch (request.changeType()) {
                case ADD_FIELD -> executeAdd(request.fieldName(), d);
                case REMOVE_FIELD -> engine.applyRemove(request.fieldName(), null);
                case MODIFY_FIELD -> executeModify(request.fieldName(), d);
                case RENAME_FIELD -> MutationResult.rejected("Renaming fields is not supported");
            };
        } catch (RuntimeException e) {
            LOG.warn("Execution of change request {} failed", request.id(), e);
            return MutationResult.rejected(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private MutationResult executeAdd(String fieldName, ChangeDetails d) {
        if (d.fieldType() == null) {
            return MutationResult.rejected("Field type is required to add field '" + fieldName + "'");
        }
        FieldValidation validation = d.validation() != null ? d.validation() : FieldValidation.optional();
        validation = validation.withRequired(d.requiresValue());
        return engine.applyAdd(SchemaField.of(fieldName, d.fieldType(), d.description(), validation), null);
    }

    private MutationResult executeModify(String fieldName, ChangeDetails d) {
        SchemaVersion current = engine.currentSchema();
        Optional<SchemaField> existing = current.field(fieldName);
        if (existing.isEmpty()) {
            return MutationResult.rejected(
                    "Field '" + fieldName + "' does not exist in version " + current.version());
        }
        SchemaField old = existing.get();
        FieldType type = d.fieldType() != null ? d.fieldType() : old.type();
        String description = d.description() != null ? d.description() : old.description();
        FieldValidation validation = d.validation() != null ? d.validation() : old.validation();
        // only the explicit flag changes required-ness
        validation = validation.withRequired(d.required() != null ? d.required() : old.required());
        return engine.applyModify(fieldName, SchemaField.of(fieldName, type, description, validation), null);
    }

    private static String appendNote(String comments, String note) {
        return comments.isEmpty() ? note : comments + " " + note;
    }

    private void persist() {
        store.save(new ApprovalState(new ArrayList<>(pending.values()), history));
    }

    /**
     * Saves after a decision. The decision may already be applied to the
     * schema, so it stays in memory even when the save fails; every save
     * writes the full state, so the next successful one records it.
     */
    private void persistDecision(ChangeRequest decided) {
        try {
            persist();
        } catch (SchemagateException e) {
            LOG.error(
                    "Failed to save approval state after deciding request {} ({}); it will be written by the next save",
                    decided.id(),
                    decided.status().wireName(),
                    e);
        }
    }

    // --- Listener notification ---

    private void notifyCreated(ChangeRequest r) {
        try {
            listener.onRequestCreated(new GovernanceListener.RequestCreatedEvent(
                    r.id(), r.changeType(), r.fieldName(), r.riskLevel(), r.requiredApprovalLevel(), r.proposedBy()));
        } catch (Exception e) {
            LOG.warn("GovernanceListener.onRequestCreated failed", e);
        }
    }

    private void notifyFinalized(ChangeRequest r) {
        try {
            listener.onRequestFinalized(new GovernanceListener.RequestFinalizedEvent(
                    r.id(), r.status(), r.reviewedBy(), r.reviewComments()));
        } catch (Exception e) {
            LOG.warn("GovernanceListener.onRequestFinalized failed", e);
        }
    }
}
