package com.example.kanban.transaction;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics, audit trail and health reporting for managed transactions.
 * 
 * This component provides:
 * - Micrometer counters, timers and gauges for the transaction lifecycle
 * - One audit line per lifecycle event on the {@code transaction.audit} logger
 * - A Spring Boot Actuator health contribution based on load and success rate
 */
public class TransactionMonitor implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(TransactionMonitor.class);
    private static final Logger auditLogger = LoggerFactory.getLogger("transaction.audit");
    
    private final long maxActiveTransactions;
    private final double minSuccessRate;
    
    // Metrics counters
    private final Counter transactionsStarted;
    private final Counter transactionsCommitted;
    private final Counter transactionsRolledBack;
    private final Counter transactionsFailed;
    private final Counter timeoutsOccurred;
    private final Counter retriesAttempted;
    private final Counter rollbackActionsFailed;
    
    // Timing metrics
    private final Timer transactionDuration;
    
    // Gauges for current state
    private final AtomicLong activeTransactionsCount = new AtomicLong(0);
    private final AtomicLong completedTransactions = new AtomicLong(0);
    private final AtomicLong failedTransactions = new AtomicLong(0);
    
    private final Map<String, TransactionAuditEntry> activeTransactions = new ConcurrentHashMap<>();
    
    private volatile Duration lastTransactionDuration = Duration.ZERO;
    private volatile double successRate = 100.0;
    
    public TransactionMonitor(MeterRegistry meterRegistry, long maxActiveTransactions, double minSuccessRate) {
        this.maxActiveTransactions = maxActiveTransactions;
        this.minSuccessRate = minSuccessRate;
        
        this.transactionsStarted = Counter.builder("kanban.transactions.started")
            .description("Total number of transactions started")
            .register(meterRegistry);
            
        this.transactionsCommitted = Counter.builder("kanban.transactions.committed")
            .description("Total number of transactions committed successfully")
            .register(meterRegistry);
            
        this.transactionsRolledBack = Counter.builder("kanban.transactions.rolled_back")
            .description("Total number of transactions whose compensations were executed")
            .register(meterRegistry);
            
        this.transactionsFailed = Counter.builder("kanban.transactions.failed")
            .description("Total number of transactions that failed")
            .register(meterRegistry);
            
        this.timeoutsOccurred = Counter.builder("kanban.transactions.timeouts")
            .description("Total number of transaction timeouts")
            .register(meterRegistry);
        
        this.retriesAttempted = Counter.builder("kanban.transactions.retries")
            .description("Total number of transaction retry attempts")
            .register(meterRegistry);
        
        this.rollbackActionsFailed = Counter.builder("kanban.transactions.rollback_actions.failed")
            .description("Total number of compensating actions that failed")
            .register(meterRegistry);
        
        this.transactionDuration = Timer.builder("kanban.transactions.duration")
            .description("Transaction execution time")
            .register(meterRegistry);
        
        Gauge.builder("kanban.transactions.active", this, monitor -> monitor.activeTransactionsCount.get())
            .description("Number of currently active transactions")
            .register(meterRegistry);
            
        Gauge.builder("kanban.transactions.success_rate", this, monitor -> monitor.successRate)
            .description("Transaction success rate percentage")
            .register(meterRegistry);
            
        Gauge.builder("kanban.transactions.last_duration_ms", this, monitor -> (double) monitor.lastTransactionDuration.toMillis())
            .description("Duration of the last completed transaction in milliseconds")
            .register(meterRegistry);
        
        logger.info("TransactionMonitor initialized (maxActive={}, minSuccessRate={}%)",
                    maxActiveTransactions, minSuccessRate);
    }
    
    /**
     * Record the start of a new transaction.
     */
    public void recordTransactionStarted(String transactionId, TransactionOptions options) {
        transactionsStarted.increment();
        activeTransactionsCount.incrementAndGet();
        
        TransactionAuditEntry auditEntry = new TransactionAuditEntry(transactionId, options, Instant.now());
        activeTransactions.put(transactionId, auditEntry);
        
        auditLogger.info("TRANSACTION_STARTED: id={}, isolation={}, timeoutMs={}, autoRollback={}, timestamp={}",
                         transactionId, options.isolationLevel(),
                         options.deadline().map(Duration::toMillis).orElse(null),
                         options.autoRollback(), auditEntry.getStartTime());
    }
    
    /**
     * Record a successful transaction commit.
     */
    public void recordTransactionCommitted(String transactionId, Duration executionTime, int operationCount) {
        transactionsCommitted.increment();
        transactionDuration.record(executionTime);
        lastTransactionDuration = executionTime;
        completedTransactions.incrementAndGet();
        updateSuccessRate();
        
        TransactionAuditEntry auditEntry = finish(transactionId, TransactionState.CLOSED, executionTime, null);
        
        auditLogger.info("TRANSACTION_COMMITTED: id={}, executionTime={}ms, totalOperations={}, timestamp={}",
                         transactionId, executionTime.toMillis(), operationCount,
                         auditEntry != null ? auditEntry.getEndTime() : Instant.now());
    }
    
    /**
     * Record that the compensations of a failed transaction were executed.
     */
    public void recordTransactionRolledBack(String transactionId, Duration rollbackTime, int actionCount, int failedActions) {
        transactionsRolledBack.increment();
        
        auditLogger.warn("TRANSACTION_ROLLED_BACK: id={}, rollbackTime={}ms, actions={}, failedActions={}, timestamp={}",
                         transactionId, rollbackTime.toMillis(), actionCount, failedActions, Instant.now());
    }
    
    /**
     * Record a transaction failure.
     */
    public void recordTransactionFailed(String transactionId, Duration executionTime, Throwable error) {
        transactionsFailed.increment();
        transactionDuration.record(executionTime);
        lastTransactionDuration = executionTime;
        completedTransactions.incrementAndGet();
        failedTransactions.incrementAndGet();
        updateSuccessRate();
        
        finish(transactionId, TransactionState.CLOSED, executionTime, error.getMessage());
        
        auditLogger.error("TRANSACTION_FAILED: id={}, executionTime={}ms, error={}, timestamp={}",
                          transactionId, executionTime.toMillis(), error.getMessage(), Instant.now());
    }
    
    /**
     * Record a timeout event.
     */
    public void recordTimeoutOccurred(String transactionId, Duration configuredTimeout, Duration actualDuration) {
        timeoutsOccurred.increment();
        
        auditLogger.warn("TRANSACTION_TIMEOUT: id={}, configuredTimeout={}ms, actualDuration={}ms, timestamp={}",
                         transactionId, configuredTimeout.toMillis(), actualDuration.toMillis(), Instant.now());
    }
    
    /**
     * Record a retry attempt scheduled after a transient failure.
     */
    public void recordRetry(int attempt, int maxAttempts, long delayMs, Throwable error) {
        retriesAttempted.increment();
        
        auditLogger.info("TRANSACTION_RETRY: attempt={}, maxAttempts={}, delayMs={}, error={}, timestamp={}",
                         attempt, maxAttempts, delayMs, error.getMessage(), Instant.now());
    }
    
    /**
     * Record a compensating action that failed.
     */
    public void recordRollbackActionFailed(String transactionId, int actionIndex, Throwable error) {
        rollbackActionsFailed.increment();
        
        auditLogger.error("ROLLBACK_ACTION_FAILED: id={}, actionIndex={}, error={}, timestamp={}",
                          transactionId, actionIndex, error.getMessage(), Instant.now());
    }
    
    /**
     * Get current transaction statistics.
     */
    public TransactionStatistics getTransactionStatistics() {
        return new TransactionStatistics(
            (long) transactionsStarted.count(),
            (long) transactionsCommitted.count(),
            (long) transactionsRolledBack.count(),
            (long) transactionsFailed.count(),
            activeTransactionsCount.get(),
            successRate,
            lastTransactionDuration,
            (long) timeoutsOccurred.count(),
            (long) retriesAttempted.count(),
            (long) rollbackActionsFailed.count()
        );
    }
    
    /**
     * Get audit trail for a transaction that is still running.
     */
    public Optional<TransactionAuditEntry> getTransactionAudit(String transactionId) {
        return Optional.ofNullable(activeTransactions.get(transactionId));
    }
    
    public List<TransactionAuditEntry> getActiveTransactions() {
        return new ArrayList<>(activeTransactions.values());
    }
    
    /**
     * Health check implementation for Spring Boot Actuator.
     */
    @Override
    public Health health() {
        Health.Builder health = Health.up();
        
        long activeCount = activeTransactionsCount.get();
        
        if (activeCount > maxActiveTransactions) {
            health.down().withDetail("reason", "Too many active transactions: " + activeCount);
        }
        
        if (successRate < minSuccessRate) {
            health.down().withDetail("reason", "Low success rate: " + String.format("%.2f%%", successRate));
        }
        
        health.withDetail("activeTransactions", activeCount)
              .withDetail("successRate", String.format("%.2f%%", successRate))
              .withDetail("totalProcessed", completedTransactions.get())
              .withDetail("lastTransactionDuration", lastTransactionDuration.toMillis() + "ms")
              .withDetail("timeoutsOccurred", (long) timeoutsOccurred.count())
              .withDetail("rollbackActionsFailed", (long) rollbackActionsFailed.count());
        
        return health.build();
    }
    
    private TransactionAuditEntry finish(String transactionId, TransactionState state, Duration executionTime, String errorReason) {
        TransactionAuditEntry auditEntry = activeTransactions.remove(transactionId);
        if (auditEntry == null) {
            return null;
        }
        activeTransactionsCount.decrementAndGet();
        auditEntry.setEndTime(Instant.now());
        auditEntry.setState(state);
        auditEntry.setExecutionTime(executionTime);
        auditEntry.setErrorReason(errorReason);
        return auditEntry;
    }
    
    private void updateSuccessRate() {
        long total = completedTransactions.get();
        if (total > 0) {
            successRate = ((double) (total - failedTransactions.get()) / total) * 100.0;
        }
    }
    
    public static class TransactionAuditEntry {
        private final String transactionId;
        private final TransactionOptions options;
        private final Instant startTime;
        private volatile Instant endTime;
        private volatile TransactionState state = TransactionState.RUNNING;
        private volatile Duration executionTime = Duration.ZERO;
        private volatile String errorReason;
        
        public TransactionAuditEntry(String transactionId, TransactionOptions options, Instant startTime) {
            this.transactionId = transactionId;
            this.options = options;
            this.startTime = startTime;
        }
        
        public String getTransactionId() { return transactionId; }
        public TransactionOptions getOptions() { return options; }
        public Instant getStartTime() { return startTime; }
        public Instant getEndTime() { return endTime; }
        public TransactionState getState() { return state; }
        public Duration getExecutionTime() { return executionTime; }
        public String getErrorReason() { return errorReason; }
        
        public void setEndTime(Instant endTime) { this.endTime = endTime; }
        public void setState(TransactionState state) { this.state = state; }
        public void setExecutionTime(Duration executionTime) { this.executionTime = executionTime; }
        public void setErrorReason(String errorReason) { this.errorReason = errorReason; }
    }
    
    public static class TransactionStatistics {
        private final long transactionsStarted;
        private final long transactionsCommitted;
        private final long transactionsRolledBack;
        private final long transactionsFailed;
        private final long activeTransactions;
        private final double successRate;
        private final Duration lastTransactionDuration;
        private final long timeoutsOccurred;
        private final long retriesAttempted;
        private final long rollbackActionsFailed;
        
        public TransactionStatistics(long started, long committed, long rolledBack, long failed,
                                   long active, double successRate, Duration lastDuration,
                                   long timeouts, long retries, long rollbackFailures) {
            this.transactionsStarted = started;
            this.transactionsCommitted = committed;
            this.transactionsRolledBack = rolledBack;
            this.transactionsFailed = failed;
            this.activeTransactions = active;
            this.successRate = successRate;
            this.lastTransactionDuration = lastDuration;
            this.timeoutsOccurred = timeouts;
            this.retriesAttempted = retries;
            this.rollbackActionsFailed = rollbackFailures;
        }
        
        public long getTransactionsStarted() { return transactionsStarted; }
        public long getTransactionsCommitted() { return transactionsCommitted; }
        public long getTransactionsRolledBack() { return transactionsRolledBack; }
        public long getTransactionsFailed() { return transactionsFailed; }
        public long getActiveTransactions() { return activeTransactions; }
        public double getSuccessRate() { return successRate; }
        public Duration getLastTransactionDuration() { return lastTransactionDuration; }
        public long getTimeoutsOccurred() { return timeoutsOccurred; }
        public long getRetriesAttempted() { return retriesAttempted; }
        public long getRollbackActionsFailed() { return rollbackActionsFailed; }
    }
}
