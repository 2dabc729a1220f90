package com.example.kanban.transaction;

import java.time.Duration;

/**
 * Signals that a transaction's deadline elapsed before its work completed.
 */
public class TransactionTimeoutException extends TransactionException {

    private final String transactionId;
    private final Duration timeout;

    public TransactionTimeoutException(String transactionId, Duration timeout) {
        super("Transaction timeout: " + transactionId + " exceeded " + timeout.toMillis() + "ms");
        this.transactionId = transactionId;
        this.timeout = timeout;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
