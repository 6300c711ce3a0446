package io.schemagate.core.store;

/**
 * Persistence seam for change requests. The approval gate loads once at
 * construction and saves the full state after every transition, while holding
 * its own lock.
 */
public interface ApprovalStore {

    /**
     * Returns the last saved state, or {@link ApprovalState#empty()} if nothing
     * was saved yet.
     */
    ApprovalState load();

    /**
     * Replaces the stored state.
     *
     * @throws io.schemagate.core.error.SchemaStoreException if the state cannot be written
     */
    void save(ApprovalState state);
}
