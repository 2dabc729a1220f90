package com.example.kanban.transaction;

/**
 * Base exception for the transaction coordination layer.
 * 
 * Every failure raised by the manager, the coordinator or the decorator extends this
 * runtime exception so callers can handle the whole layer with one catch clause.
 */
public class TransactionException extends RuntimeException {
    
    /**
     * Constructs a new transaction exception with the specified detail message.
     * 
     * @param message the detail message
     */
    public TransactionException(String message) {
        super(message);
    }
    
    /**
     * Constructs a new transaction exception with the specified detail message and cause.
     * 
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
