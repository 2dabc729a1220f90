package com.example.kanban.transaction;

import java.time.Duration;
import java.util.Optional;

/**
 * Transaction options record containing configuration parameters.
 * 
 * @param isolationLevel Isolation level to request from the store, {@code null} for the store default
 * @param timeout Deadline for the work, {@code null} for no deadline
 * @param autoRollback Whether registered rollback actions run when the transaction fails
 * @param retryAttempts Extra attempts granted to {@code executeTransactionWithRetry} for transient failures
 */
public record TransactionOptions(
    IsolationLevel isolationLevel,
    Duration timeout,
    boolean autoRollback,
    int retryAttempts
) {

    public TransactionOptions {
        if (retryAttempts < 0) {
            throw new TransactionValidationException("retryAttempts must not be negative: " + retryAttempts);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new TransactionValidationException("timeout must be positive: " + timeout);
        }
    }

    /**
     * Create default transaction options: no isolation directive, no deadline, automatic
     * rollback and no retries.
     */
    public static TransactionOptions defaultOptions() {
        return new TransactionOptions(null, null, true, 0);
    }

    public Optional<IsolationLevel> isolation() {
        return Optional.ofNullable(isolationLevel);
    }

    public Optional<Duration> deadline() {
        return Optional.ofNullable(timeout);
    }

    public TransactionOptions withIsolationLevel(IsolationLevel level) {
        return new TransactionOptions(level, timeout, autoRollback, retryAttempts);
    }

    public TransactionOptions withTimeout(Duration newTimeout) {
        return new TransactionOptions(isolationLevel, newTimeout, autoRollback, retryAttempts);
    }

    public TransactionOptions withTimeoutMillis(long timeoutMs) {
        return withTimeout(Duration.ofMillis(timeoutMs));
    }

    public TransactionOptions withAutoRollback(boolean enabled) {
        return new TransactionOptions(isolationLevel, timeout, enabled, retryAttempts);
    }

    public TransactionOptions withRetryAttempts(int attempts) {
        return new TransactionOptions(isolationLevel, timeout, autoRollback, attempts);
    }
}
