package com.example.kanban.transaction;

import java.time.Instant;

/**
 * Audit entry for one service call made inside a transaction.
 * 
 * Records are informational only; the manager never reads them back to decide what to do.
 */
public final class OperationRecord {

    private final String serviceName;
    private final String methodName;
    private final Instant timestamp;
    private volatile OperationStatus status;
    private volatile String errorMessage;

    OperationRecord(String serviceName, String methodName, Instant timestamp) {
        this(serviceName, methodName, timestamp, OperationStatus.PENDING, null);
    }

    private OperationRecord(String serviceName, String methodName, Instant timestamp,
                            OperationStatus status, String errorMessage) {
        this.serviceName = serviceName;
        this.methodName = methodName;
        this.timestamp = timestamp;
        this.status = status;
        this.errorMessage = errorMessage;
    }

    public String getServiceName() { return serviceName; }
    public String getMethodName() { return methodName; }
    public Instant getTimestamp() { return timestamp; }
    public OperationStatus getStatus() { return status; }
    public String getErrorMessage() { return errorMessage; }

    void markCompleted() {
        if (status == OperationStatus.PENDING) {
            status = OperationStatus.COMPLETED;
        }
    }

    void markFailed(Throwable error) {
        if (status == OperationStatus.PENDING) {
            status = OperationStatus.FAILED;
            errorMessage = error.getMessage();
        }
    }

    /**
     * Detached copy that no longer follows status changes of this record.
     */
    public OperationRecord snapshot() {
        return new OperationRecord(serviceName, methodName, timestamp, status, errorMessage);
    }

    @Override
    public String toString() {
        return serviceName + "." + methodName + "[" + status + "]";
    }
}
