package com.example.kanban.transaction;

/**
 * Per-item work for {@link KanbanTransactionManager#executeInBatches}.
 *
 * @param <I> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface BatchOperation<I, R> {

    /**
     * @param item The item to process
     * @param index Position of the item in the full input list
     * @param context The transaction of the batch the item belongs to
     */
    R apply(I item, int index, TransactionContext context) throws Exception;
}
