package com.example.kanban.transaction;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of a registered transaction, safe to hand out to introspection callers.
 * 
 * @param id Transaction identifier
 * @param startTime When the transaction was opened
 * @param deadline When the transaction times out, if it has a timeout
 * @param state Lifecycle state at the moment the copy was taken
 * @param operations Recorded operations, in recording order
 * @param rollbackActionCount Number of compensations registered so far
 * @param metadata Copy of the context metadata
 */
public record TransactionSnapshot(
    String id,
    Instant startTime,
    Optional<Instant> deadline,
    TransactionState state,
    List<OperationRecord> operations,
    int rollbackActionCount,
    Map<String, Object> metadata
) {
    public TransactionSnapshot {
        operations = List.copyOf(operations);
        metadata = Map.copyOf(metadata);
    }
}
