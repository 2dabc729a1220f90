package com.example.kanban.saga;

import com.example.kanban.transaction.RollbackAction;

import java.util.Objects;

/**
 * One named step of a coordinated operation.
 * 
 * @param serviceName Service the step calls, for the audit trail
 * @param methodName Method the step calls, for the audit trail
 * @param execute The forward effect
 * @param rollbackAction Compensation of the forward effect, {@code null} when the step has none;
 *        it may run after a partial forward effect
 * @param <T> result type of the step
 */
public record ServiceOperation<T>(
    String serviceName,
    String methodName,
    ServiceCall<T> execute,
    RollbackAction rollbackAction
) {

    public ServiceOperation {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(execute, "execute");
    }

    public static <T> ServiceOperation<T> of(String serviceName, String methodName, ServiceCall<T> execute) {
        return new ServiceOperation<>(serviceName, methodName, execute, null);
    }

    public static <T> ServiceOperation<T> of(String serviceName, String methodName, ServiceCall<T> execute,
                                             RollbackAction rollbackAction) {
        return new ServiceOperation<>(serviceName, methodName, execute, rollbackAction);
    }

    public boolean hasRollback() {
        return rollbackAction != null;
    }
}
