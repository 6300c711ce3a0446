package io.schemagate.core.store;

import java.util.Objects;

/** Keeps approval state in memory only; used when no storage directory is configured and in tests. */
public final class InMemoryApprovalStore implements ApprovalStore {

    private volatile ApprovalState state = ApprovalState.empty();

    @Override
    public ApprovalState load() {
        return state;
    }

    @Override
    public void save(ApprovalState newState) {
        this.state = Objects.requireNonNull(newState, "state must not be null");
    }
}
