package com.example.kanban.saga;

/**
 * Forward effect of a {@link ServiceOperation}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ServiceCall<T> {

    T call() throws Exception;
}
