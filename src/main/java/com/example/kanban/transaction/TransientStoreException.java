package com.example.kanban.transaction;

/**
 * Store contention that is expected to clear up if the same work is attempted again shortly,
 * such as a busy or locked database.
 */
public class TransientStoreException extends TransactionException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
