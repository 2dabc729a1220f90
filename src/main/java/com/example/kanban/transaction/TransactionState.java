package com.example.kanban.transaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single managed transaction.
 * 
 * PENDING → RUNNING → COMMITTING → CLOSED on success, RUNNING → FAILING → ROLLING_BACK → CLOSED
 * on failure and RUNNING → TIMED_OUT → ROLLING_BACK → CLOSED when the deadline fires first.
 * CLOSED is terminal.
 */
public enum TransactionState {
    PENDING,
    RUNNING,
    COMMITTING,
    FAILING,
    TIMED_OUT,
    ROLLING_BACK,
    CLOSED;

    private Set<TransactionState> successors;

    static {
        PENDING.successors = EnumSet.of(RUNNING, FAILING, TIMED_OUT);
        RUNNING.successors = EnumSet.of(COMMITTING, FAILING, TIMED_OUT);
        COMMITTING.successors = EnumSet.of(CLOSED, FAILING);
        FAILING.successors = EnumSet.of(ROLLING_BACK, CLOSED);
        TIMED_OUT.successors = EnumSet.of(ROLLING_BACK, CLOSED);
        ROLLING_BACK.successors = EnumSet.of(CLOSED);
        CLOSED.successors = EnumSet.noneOf(TransactionState.class);
    }

    public boolean canTransitionTo(TransactionState next) {
        return successors.contains(next);
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
