package com.example.kanban.transaction;

/**
 * Raised when the transaction layer is misused, for example when an operation is recorded
 * against a context that is no longer active or when options are out of range.
 * 
 * Validation failures are never retried.
 */
public class TransactionValidationException extends TransactionException {

    public TransactionValidationException(String message) {
        super(message);
    }
}
