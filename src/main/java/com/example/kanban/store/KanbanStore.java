package com.example.kanban.store;

/**
 * The persistent board store as seen by the transaction layer.
 * 
 * The store only offers local transactions: one begin/commit/rollback envelope per call,
 * bound to the calling thread. Anything spanning several of those is the saga layer's job.
 */
public interface KanbanStore {

    /**
     * Run {@code callback} inside a store transaction. The transaction commits when the callback
     * returns and rolls back when it throws; the callback's exception is rethrown unchanged.
     */
    <T> T transaction(StoreCallback<T> callback) throws Exception;

    /**
     * Execute a raw store directive (for example a pragma) inside the current transaction.
     */
    void execute(String directive);
}
