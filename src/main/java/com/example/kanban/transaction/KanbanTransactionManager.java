package com.example.kanban.transaction;

import com.example.kanban.store.KanbanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs units of work inside one store transaction each and compensates them when they fail.
 * 
 * This class provides:
 * - Transaction lifecycle management (register, run, commit or compensate, evict)
 * - Isolation directives issued before the work starts
 * - Deadline enforcement for work with a timeout
 * - Retry of transient store failures with exponential backoff
 * - Read-only introspection of the active transaction registry
 * 
 * Work with a timeout runs on a worker thread together with its store transaction, while the
 * caller waits for at most the timeout. Work abandoned by a fired deadline is never interrupted
 * but can no longer commit: its store transaction is rolled back when it eventually returns,
 * and only then are its rollback actions run, on the worker thread.
 */
public class KanbanTransactionManager {

    private static final Logger logger = LoggerFactory.getLogger(KanbanTransactionManager.class);
    
    private static final int DEFAULT_BATCH_SIZE = 100;
    
    private final KanbanStore store;
    private final TransactionRegistry registry;
    private final ExecutorService workerExecutor;
    private final RetryBackoff retryBackoff;
    private final TransactionMonitor transactionMonitor;
    private final TransactionOptions defaultOptions;
    private final int defaultBatchSize;
    
    public KanbanTransactionManager(KanbanStore store,
                                    TransactionRegistry registry,
                                    ExecutorService workerExecutor,
                                    RetryBackoff retryBackoff,
                                    TransactionMonitor transactionMonitor) {
        this(store, registry, workerExecutor, retryBackoff, transactionMonitor,
             TransactionOptions.defaultOptions(), DEFAULT_BATCH_SIZE);
    }
    
    /**
     * @param transactionMonitor Optional monitor, {@code null} disables metrics and audit events
     * @param defaultOptions Options used when a caller passes none
     * @param defaultBatchSize Batch size used by {@link #executeInBatches(List, BatchOperation)}
     */
    public KanbanTransactionManager(KanbanStore store,
                                    TransactionRegistry registry,
                                    ExecutorService workerExecutor,
                                    RetryBackoff retryBackoff,
                                    TransactionMonitor transactionMonitor,
                                    TransactionOptions defaultOptions,
                                    int defaultBatchSize) {
        if (defaultBatchSize <= 0) {
            throw new TransactionValidationException("Batch size must be positive: " + defaultBatchSize);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        this.transactionMonitor = transactionMonitor;
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.defaultBatchSize = defaultBatchSize;
        
        logger.info("KanbanTransactionManager initialized (defaultOptions={}, batchSize={})",
                   defaultOptions, defaultBatchSize);
    }
    
    public TransactionOptions getDefaultOptions() {
        return defaultOptions;
    }
    
    public <T> T executeTransaction(TransactionCallback<T> work) {
        return executeTransaction(work, defaultOptions);
    }
    
    /**
     * Run the work inside a new store transaction.
     * 
     * {@link TransactionOptions#retryAttempts()} is ignored here, see
     * {@link #executeTransactionWithRetry(TransactionCallback, TransactionOptions)}.
     * 
     * @param work The work to run, receives the live context
     * @param options Transaction options, {@code null} for the manager defaults
     * @return The work's result once the store transaction committed
     * @throws TransactionFailureException if the work failed or timed out; its cause is the
     *         original error
     */
    public <T> T executeTransaction(TransactionCallback<T> work, TransactionOptions options) {
        Objects.requireNonNull(work, "work");
        TransactionOptions effective = options != null ? options : defaultOptions;
        
        TransactionContext context = new TransactionContext(
            UUID.randomUUID().toString(), Instant.now(), effective.timeout());
        context.putMetadata("isolationLevel", effective.isolationLevel());
        context.putMetadata("timeoutMs", effective.deadline().map(Duration::toMillis).orElse(null));
        context.putMetadata("autoRollback", effective.autoRollback());
        
        registry.register(context);
        long startNanos = System.nanoTime();
        
        logger.info("Transaction started: transactionId={}, isolation={}, timeoutMs={}",
                   context.getId(), effective.isolationLevel(),
                   effective.deadline().map(Duration::toMillis).orElse(null));
        if (transactionMonitor != null) {
            transactionMonitor.recordTransactionStarted(context.getId(), effective);
        }
        
        try {
            T result = effective.deadline().isPresent()
                ? runWithDeadline(context, work, effective)
                : runInStore(context, work, effective);
            
            for (OperationRecord operation : context.operations()) {
                operation.markCompleted();
            }
            context.transitionTo(TransactionState.CLOSED);
            
            Duration duration = elapsedSince(startNanos);
            logger.info("Transaction committed: transactionId={}, durationMs={}, operationCount={}",
                       context.getId(), duration.toMillis(), context.getOperationCount());
            if (transactionMonitor != null) {
                transactionMonitor.recordTransactionCommitted(context.getId(), duration, context.getOperationCount());
            }
            return result;
            
        } catch (Exception e) {
            throw fail(context, effective, e, startNanos);
        } finally {
            registry.remove(context);
        }
    }
    
    /**
     * Run the work in up to {@code retryAttempts + 1} fresh transactions, retrying only while
     * the failure is transient.
     * 
     * @throws TransactionFailureException of the last attempt
     */
    public <T> T executeTransactionWithRetry(TransactionCallback<T> work, TransactionOptions options) {
        TransactionOptions effective = options != null ? options : defaultOptions;
        int maxAttempts = effective.retryAttempts() + 1;
        
        for (int attempt = 1; ; attempt++) {
            try {
                return executeTransaction(work, effective);
            } catch (TransactionFailureException e) {
                if (attempt >= maxAttempts || !ErrorClassifier.isTransient(e.getCause())) {
                    if (attempt > 1) {
                        logger.error("Transaction failed after {} attempts: {}", attempt,
                                    ErrorClassifier.describe(e.getCause(), e.getTransactionId()));
                    }
                    throw e;
                }
                
                long delayMs = retryBackoff.delayAfterAttempt(attempt);
                logger.warn("Transaction retry: attempt={}, maxAttempts={}, delayMs={}, error={}",
                           attempt, maxAttempts, delayMs, e.getCause().getMessage());
                if (transactionMonitor != null) {
                    transactionMonitor.recordRetry(attempt, maxAttempts, delayMs, e.getCause());
                }
                
                if (!sleep(delayMs)) {
                    logger.warn("Retry of transaction {} interrupted", e.getTransactionId());
                    throw e;
                }
            }
        }
    }
    
    /**
     * Record a service call made inside an active transaction.
     * 
     * @return The live record, still {@link OperationStatus#PENDING}
     * @throws TransactionValidationException if the context is not active
     */
    public OperationRecord addOperation(TransactionContext context, String serviceName, String methodName) {
        requireActive(context);
        OperationRecord record = context.appendOperation(serviceName, methodName);
        logger.debug("Operation recorded: transactionId={}, service={}, method={}",
                    context.getId(), serviceName, methodName);
        return record;
    }
    
    /**
     * Register a compensation to run, in reverse registration order, if the transaction fails.
     * 
     * @throws TransactionValidationException if the context is not active
     */
    public void addRollbackAction(TransactionContext context, RollbackAction action) {
        Objects.requireNonNull(action, "action");
        requireActive(context);
        context.appendRollbackAction(action);
    }
    
    /**
     * Mark a recorded operation as completed ahead of the commit.
     */
    public void completeOperation(OperationRecord record) {
        record.markCompleted();
    }
    
    public int getActiveTransactionCount() {
        return registry.size();
    }
    
    public Optional<TransactionSnapshot> getTransaction(String transactionId) {
        return registry.find(transactionId);
    }
    
    public List<TransactionSnapshot> getActiveTransactions() {
        return registry.snapshots();
    }
    
    public <I, R> List<R> executeInBatches(List<I> items, BatchOperation<I, R> operation) {
        return executeInBatches(items, operation, defaultBatchSize, defaultOptions);
    }
    
    /**
     * Process items in consecutive transactions of at most {@code batchSize} items each.
     * 
     * Batches that already committed stay committed when a later batch fails.
     * 
     * @return Results of all items, in input order
     */
    public <I, R> List<R> executeInBatches(List<I> items, BatchOperation<I, R> operation,
                                           int batchSize, TransactionOptions options) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(operation, "operation");
        if (batchSize <= 0) {
            throw new TransactionValidationException("Batch size must be positive: " + batchSize);
        }
        
        List<R> results = new ArrayList<>(items.size());
        for (int from = 0; from < items.size(); from += batchSize) {
            int offset = from;
            List<I> batch = items.subList(from, Math.min(from + batchSize, items.size()));
            List<R> batchResults = executeTransaction(context -> {
                List<R> processed = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    processed.add(operation.apply(batch.get(i), offset + i, context));
                }
                return processed;
            }, options);
            results.addAll(batchResults);
            logger.debug("Batch processed: offset={}, size={}", offset, batch.size());
        }
        return results;
    }
    
    /**
     * Stop the worker pool used for transactions with a deadline.
     */
    public void shutdown() {
        logger.info("Shutting down KanbanTransactionManager");
        
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        
        logger.info("KanbanTransactionManager shutdown completed");
    }
    
    private <T> T runInStore(TransactionContext context, TransactionCallback<T> work,
                             TransactionOptions options) throws Exception {
        return store.transaction(() -> {
            if (!context.transitionTo(TransactionState.RUNNING)) {
                throw new TransactionValidationException(
                    "Transaction " + context.getId() + " is no longer active: " + context.getState());
            }
            
            options.isolation()
                .flatMap(IsolationLevel::directive)
                .ifPresent(store::execute);
            
            T result = work.doInTransaction(context);
            
            // An abandoned transaction must not commit
            if (!context.transitionTo(TransactionState.COMMITTING)) {
                if (context.isTimedOut()) {
                    throw new TransactionTimeoutException(context.getId(), options.timeout());
                }
                throw new TransactionValidationException(
                    "Transaction " + context.getId() + " was abandoned before commit: " + context.getState());
            }
            return result;
        });
    }
    
    /**
     * Worker side of {@link #runWithDeadline}. A failing worker claims its context with a CAS to
     * FAILING, so exactly one thread compensates: the caller when the claim succeeds, this worker
     * when the deadline already moved the context to TIMED_OUT.
     */
    private <T> T runAbandonable(TransactionContext context, TransactionCallback<T> work,
                                 TransactionOptions options) throws Exception {
        try {
            return runInStore(context, work, options);
        } catch (Exception e) {
            if (!context.transitionTo(TransactionState.FAILING) && context.isTimedOut()) {
                compensateAbandoned(context, options);
            }
            throw e;
        }
    }
    
    private void compensateAbandoned(TransactionContext context, TransactionOptions options) {
        if (options.autoRollback()) {
            int failedActions = executeRollbackActions(context).size();
            logger.info("Abandoned transaction compensated: transactionId={}, failedActions={}",
                       context.getId(), failedActions);
        } else if (context.getRollbackActionCount() > 0) {
            logger.warn("Auto rollback disabled, skipping {} rollback actions for transaction {}",
                       context.getRollbackActionCount(), context.getId());
        }
        context.transitionTo(TransactionState.CLOSED);
    }
    
    private <T> T runWithDeadline(TransactionContext context, TransactionCallback<T> work,
                                  TransactionOptions options) throws Exception {
        Duration timeout = options.timeout();
        Future<T> future = workerExecutor.submit(() -> runAbandonable(context, work, options));
        
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (TimeoutException e) {
            if (context.transitionTo(TransactionState.TIMED_OUT)) {
                Duration actual = Duration.between(context.getStartTime(), Instant.now());
                logger.warn("Transaction timed out: transactionId={}, timeoutMs={}, operationCount={}",
                           context.getId(), timeout.toMillis(), context.getOperationCount());
                if (transactionMonitor != null) {
                    transactionMonitor.recordTimeoutOccurred(context.getId(), timeout, actual);
                }
                throw new TransactionTimeoutException(context.getId(), timeout);
            }
            
            // The worker finished just in time, committing or failing
            logger.debug("Transaction {} reached {} at its deadline, awaiting worker",
                        context.getId(), context.getState());
            try {
                return future.get();
            } catch (ExecutionException committingFailure) {
                throw unwrap(committingFailure);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionException("Interrupted while waiting for transaction " + context.getId(), e);
        }
    }
    
    private TransactionFailureException fail(TransactionContext context, TransactionOptions options,
                                             Exception error, long startNanos) {
        // After a fired deadline the worker still owns the context and compensates it
        boolean abandoned = error instanceof TransactionTimeoutException;
        context.transitionTo(TransactionState.FAILING);
        for (OperationRecord operation : context.operations()) {
            operation.markFailed(error);
        }
        
        TransactionFailureException failure =
            new TransactionFailureException(context.getId(), context.getOperations(), error);
        
        if (abandoned) {
            if (options.autoRollback() && context.getRollbackActionCount() > 0) {
                logger.info("Rollback deferred until abandoned work returns: transactionId={}, actionCount={}",
                           context.getId(), context.getRollbackActionCount());
            }
        } else {
            if (options.autoRollback()) {
                executeRollbackActions(context).forEach(failure::addSuppressed);
            } else if (context.getRollbackActionCount() > 0) {
                logger.warn("Auto rollback disabled, skipping {} rollback actions for transaction {}",
                           context.getRollbackActionCount(), context.getId());
            }
            context.transitionTo(TransactionState.CLOSED);
        }
        
        Duration duration = elapsedSince(startNanos);
        logger.error("Transaction failed: transactionId={}, durationMs={}, error={}, operations={}",
                    context.getId(), duration.toMillis(), error.getMessage(), failure.getOperations());
        if (transactionMonitor != null) {
            transactionMonitor.recordTransactionFailed(context.getId(), duration, error);
        }
        return failure;
    }
    
    /**
     * Run the registered rollback actions in reverse order, continuing past failures.
     * 
     * @return One exception per failed action
     */
    private List<RollbackActionException> executeRollbackActions(TransactionContext context) {
        context.transitionTo(TransactionState.ROLLING_BACK);
        List<RollbackAction> actions = List.copyOf(context.rollbackActions());
        List<RollbackActionException> failures = new ArrayList<>();
        if (actions.isEmpty()) {
            return failures;
        }
        
        logger.info("Executing rollback: transactionId={}, actionCount={}", context.getId(), actions.size());
        long startNanos = System.nanoTime();
        
        for (int index = actions.size() - 1; index >= 0; index--) {
            try {
                actions.get(index).rollback();
            } catch (Exception e) {
                logger.error("Rollback action failed: transactionId={}, actionIndex={}, error={}",
                            context.getId(), index, e.getMessage(), e);
                if (transactionMonitor != null) {
                    transactionMonitor.recordRollbackActionFailed(context.getId(), index, e);
                }
                failures.add(new RollbackActionException(context.getId(), index, e));
            }
        }
        
        if (transactionMonitor != null) {
            transactionMonitor.recordTransactionRolledBack(context.getId(), elapsedSince(startNanos),
                                                           actions.size(), failures.size());
        }
        return failures;
    }
    
    private void requireActive(TransactionContext context) {
        if (context == null) {
            throw new TransactionValidationException("Transaction context is required");
        }
        if (!registry.isRegistered(context) || !context.isActive()) {
            throw new TransactionValidationException(
                "Transaction " + context.getId() + " is not active (state " + context.getState() + ")");
        }
    }
    
    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
    
    private static boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
