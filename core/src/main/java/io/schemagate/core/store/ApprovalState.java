package io.schemagate.core.store;

import io.schemagate.core.model.ChangeRequest;
import java.util.List;

/**
 * Persisted view of the approval gate: requests awaiting review, and the
 * finalized requests in the order they were decided.
 *
 * @param pending pending requests in creation order
 * @param history finalized requests, oldest first
 */
public record ApprovalState(List<ChangeRequest> pending, List<ChangeRequest> history) {

    public ApprovalState {
        pending = pending != null ? List.copyOf(pending) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static ApprovalState empty() {
        return new ApprovalState(List.of(), List.of());
    }
}
