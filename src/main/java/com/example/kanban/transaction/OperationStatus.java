package com.example.kanban.transaction;

/**
 * Status of a recorded operation inside a transaction.
 */
public enum OperationStatus {
    /** Recorded, not yet resolved */
    PENDING,
    /** The owning transaction committed */
    COMPLETED,
    /** The owning transaction failed */
    FAILED
}
