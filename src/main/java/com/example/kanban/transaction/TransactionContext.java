package com.example.kanban.transaction;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live state of one managed transaction.
 * 
 * A context is created by {@link KanbanTransactionManager} when a transaction starts, is
 * registered for exactly as long as its store transaction is open and is never reused once it
 * reaches {@link TransactionState#CLOSED}. Operation and rollback lists are append-only.
 */
public final class TransactionContext {

    private final String id;
    private final Instant startTime;
    private final Instant deadline;
    private final List<OperationRecord> operations = new CopyOnWriteArrayList<>();
    private final List<RollbackAction> rollbackActions = new CopyOnWriteArrayList<>();
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private final AtomicReference<TransactionState> state = new AtomicReference<>(TransactionState.PENDING);

    TransactionContext(String id, Instant startTime, Duration timeout) {
        this.id = id;
        this.startTime = startTime;
        this.deadline = timeout != null ? startTime.plus(timeout) : null;
    }

    public String getId() {
        return id;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public TransactionState getState() {
        return state.get();
    }

    public boolean isTimedOut() {
        return state.get() == TransactionState.TIMED_OUT;
    }

    public boolean isActive() {
        TransactionState current = state.get();
        return current == TransactionState.PENDING || current == TransactionState.RUNNING;
    }

    /**
     * Detached copies of the operations recorded so far, in recording order.
     */
    public List<OperationRecord> getOperations() {
        return operations.stream().map(OperationRecord::snapshot).toList();
    }

    public int getOperationCount() {
        return operations.size();
    }

    public int getRollbackActionCount() {
        return rollbackActions.size();
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public void putMetadata(String key, Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    List<OperationRecord> operations() {
        return operations;
    }

    List<RollbackAction> rollbackActions() {
        return rollbackActions;
    }

    OperationRecord appendOperation(String serviceName, String methodName) {
        OperationRecord record = new OperationRecord(serviceName, methodName, Instant.now());
        operations.add(record);
        return record;
    }

    void appendRollbackAction(RollbackAction action) {
        rollbackActions.add(action);
    }

    /**
     * Atomically move to {@code next} if the current state allows it.
     * 
     * @return false when the transition is not allowed from the state observed
     */
    boolean transitionTo(TransactionState next) {
        while (true) {
            TransactionState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    TransactionSnapshot snapshot() {
        return new TransactionSnapshot(id, startTime, getDeadline(), state.get(),
            getOperations(), rollbackActions.size(), getMetadata());
    }

    @Override
    public String toString() {
        return "TransactionContext[" + id + ", " + state.get() + ", operations=" + operations.size() + "]";
    }
}
