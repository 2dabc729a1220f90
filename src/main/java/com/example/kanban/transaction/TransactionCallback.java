package com.example.kanban.transaction;

/**
 * Work executed inside a managed transaction.
 * 
 * @param <T> The return type of the work
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    /**
     * Execute business logic within a transaction context.
     * 
     * @param context The live context of the current transaction
     * @return The result handed back to the caller once the transaction commits
     * @throws Exception if the work fails (triggers rollback)
     */
    T doInTransaction(TransactionContext context) throws Exception;
}
