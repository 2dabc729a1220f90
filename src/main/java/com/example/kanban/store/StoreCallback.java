package com.example.kanban.store;

/**
 * Work run inside a store transaction envelope.
 * 
 * @param <T> The return type of the callback
 */
@FunctionalInterface
public interface StoreCallback<T> {

    T doInStoreTransaction() throws Exception;
}
