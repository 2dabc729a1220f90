package com.example.kanban.transaction;

import java.util.List;

/**
 * The failure a caller observes when a transaction does not commit.
 * 
 * {@link #getCause()} is always the error raised by the work itself (or the
 * {@link TransactionTimeoutException} when the deadline fired first). Compensations that failed
 * during rollback are available through {@link #getSuppressed()}.
 */
public class TransactionFailureException extends TransactionException {

    private final String transactionId;
    private final List<OperationRecord> operations;

    public TransactionFailureException(String transactionId, List<OperationRecord> operations, Throwable cause) {
        super(describe(transactionId, cause), cause);
        this.transactionId = transactionId;
        this.operations = List.copyOf(operations);
    }

    public String getTransactionId() {
        return transactionId;
    }

    /**
     * Operations recorded by the transaction before it failed, in recording order.
     */
    public List<OperationRecord> getOperations() {
        return operations;
    }

    public boolean isTimeout() {
        return getCause() instanceof TransactionTimeoutException;
    }

    private static String describe(String transactionId, Throwable cause) {
        if (cause instanceof TransactionTimeoutException) {
            return "Transaction " + transactionId + " timed out: " + cause.getMessage();
        }
        return "Transaction " + transactionId + " failed: " + cause.getMessage();
    }
}
