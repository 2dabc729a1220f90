package com.example.kanban.transaction;

/**
 * Compensating callback reversing the effect of one completed operation.
 * 
 * Implementations must tolerate running when the forward effect was only partly applied
 * (or not applied at all).
 */
@FunctionalInterface
public interface RollbackAction {

    void rollback() throws Exception;
}
