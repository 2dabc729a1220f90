package com.example.kanban.transaction;

/**
 * A compensating action failed while a transaction was being rolled back.
 * 
 * Instances are logged and attached to the surfaced {@link TransactionFailureException} as
 * suppressed exceptions; they never replace the original failure.
 */
public class RollbackActionException extends TransactionException {

    private final String transactionId;
    private final int actionIndex;

    public RollbackActionException(String transactionId, int actionIndex, Throwable cause) {
        super("Rollback action " + actionIndex + " failed for transaction " + transactionId
                + ": " + cause.getMessage(), cause);
        this.transactionId = transactionId;
        this.actionIndex = actionIndex;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public int getActionIndex() {
        return actionIndex;
    }
}
