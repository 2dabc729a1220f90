package com.example.kanban.saga;

/**
 * Point-in-time view of the active transactions.
 */
public record TransactionMetrics(int activeTransactions, int totalOperations, double averageOperationsPerTransaction) {
}
