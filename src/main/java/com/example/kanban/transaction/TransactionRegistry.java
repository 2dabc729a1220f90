package com.example.kanban.transaction;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of transactions whose store transaction is currently open.
 * 
 * Only {@link KanbanTransactionManager} registers and removes entries; everybody else sees
 * {@link TransactionSnapshot} copies.
 */
public class TransactionRegistry {

    private final Map<String, TransactionContext> activeTransactions = new ConcurrentHashMap<>();

    void register(TransactionContext context) {
        TransactionContext existing = activeTransactions.putIfAbsent(context.getId(), context);
        if (existing != null) {
            throw new IllegalStateException("Transaction id already registered: " + context.getId());
        }
    }

    void remove(TransactionContext context) {
        activeTransactions.remove(context.getId(), context);
    }

    /**
     * Whether this exact context instance is the registered one for its id.
     */
    boolean isRegistered(TransactionContext context) {
        return context != null && activeTransactions.get(context.getId()) == context;
    }

    public boolean contains(String transactionId) {
        return activeTransactions.containsKey(transactionId);
    }

    public int size() {
        return activeTransactions.size();
    }

    public Optional<TransactionSnapshot> find(String transactionId) {
        TransactionContext context = activeTransactions.get(transactionId);
        return context != null ? Optional.of(context.snapshot()) : Optional.empty();
    }

    public List<TransactionSnapshot> snapshots() {
        return activeTransactions.values().stream()
            .map(TransactionContext::snapshot)
            .toList();
    }
}
