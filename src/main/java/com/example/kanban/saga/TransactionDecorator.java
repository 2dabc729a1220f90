package com.example.kanban.saga;

import com.example.kanban.transaction.TransactionContext;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Objects;

/**
 * Makes service methods transactional unless their caller already is.
 * 
 * A method takes part when its last parameter is a {@link TransactionContext}. Calls passing a
 * context there run unchanged inside the caller's transaction; calls passing {@code null} open a
 * new transaction through the coordinator and get its context as the last argument. Only that
 * last argument is inspected. Other methods are forwarded unchanged.
 */
public final class TransactionDecorator {

    private final ServiceTransactionCoordinator coordinator;

    private TransactionDecorator(ServiceTransactionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public static TransactionDecorator createTransactionDecorator(ServiceTransactionCoordinator coordinator) {
        return new TransactionDecorator(Objects.requireNonNull(coordinator, "coordinator"));
    }

    /**
     * Wrap {@code target} behind {@code contract}. The target stays the receiver of every call.
     * 
     * @param contract Interface implemented by the target
     */
    public <T> T decorate(Class<T> contract, T target) {
        Objects.requireNonNull(target, "target");
        if (!contract.isInterface()) {
            throw new IllegalArgumentException("Only interfaces can be decorated: " + contract.getName());
        }
        Object proxy = Proxy.newProxyInstance(contract.getClassLoader(), new Class<?>[] {contract},
            new TransactionalInvocationHandler(target));
        return contract.cast(proxy);
    }

    /**
     * Whether calls to the method are wrapped in a transaction when no context is passed.
     */
    public static boolean isTransactional(Method method) {
        Class<?>[] parameterTypes = method.getParameterTypes();
        return parameterTypes.length > 0 && parameterTypes[parameterTypes.length - 1] == TransactionContext.class;
    }

    private final class TransactionalInvocationHandler implements InvocationHandler {

        private final Object target;

        private TransactionalInvocationHandler(Object target) {
            this.target = target;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return invokeObjectMethod(proxy, method, args);
            }
            if (!isTransactional(method)) {
                return invokeTarget(method, args);
            }

            int contextIndex = args.length - 1;
            if (args[contextIndex] instanceof TransactionContext) {
                return invokeTarget(method, args);
            }

            return coordinator.runInTransaction(context -> {
                Object[] withContext = args.clone();
                withContext[contextIndex] = context;
                return invokeTarget(method, withContext);
            });
        }

        private Object invokeTarget(Method method, Object[] args) throws Exception {
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw e;
            }
        }

        private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Exception {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "Transactional[" + target + "]";
                default:
                    return invokeTarget(method, args);
            }
        }
    }
}
