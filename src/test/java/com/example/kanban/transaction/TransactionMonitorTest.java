package com.example.kanban.transaction;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionMonitorTest {

    private SimpleMeterRegistry meterRegistry;
    private TransactionMonitor monitor;
    
    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        monitor = new TransactionMonitor(meterRegistry, 2, 50.0);
    }
    
    @Test
    public void testLifecycleCounters() {
        monitor.recordTransactionStarted("tx-1", TransactionOptions.defaultOptions());
        monitor.recordTransactionStarted("tx-2", TransactionOptions.defaultOptions());
        assertEquals(2.0, meterRegistry.get("kanban.transactions.active").gauge().value());
        
        monitor.recordTransactionCommitted("tx-1", Duration.ofMillis(12), 3);
        monitor.recordTransactionRolledBack("tx-2", Duration.ofMillis(1), 2, 0);
        monitor.recordTransactionFailed("tx-2", Duration.ofMillis(20), new IllegalStateException("boom"));
        
        TransactionMonitor.TransactionStatistics statistics = monitor.getTransactionStatistics();
        assertEquals(2, statistics.getTransactionsStarted());
        assertEquals(1, statistics.getTransactionsCommitted());
        assertEquals(1, statistics.getTransactionsRolledBack());
        assertEquals(1, statistics.getTransactionsFailed());
        assertEquals(0, statistics.getActiveTransactions());
        assertEquals(50.0, statistics.getSuccessRate(), 0.001);
        assertEquals(2, meterRegistry.get("kanban.transactions.duration").timer().count());
    }
    
    @Test
    public void testAuditEntryTracksActiveTransaction() {
        monitor.recordTransactionStarted("tx-1", TransactionOptions.defaultOptions().withTimeoutMillis(500));
        
        assertTrue(monitor.getTransactionAudit("tx-1").isPresent());
        assertEquals(1, monitor.getActiveTransactions().size());
        
        monitor.recordTransactionCommitted("tx-1", Duration.ofMillis(5), 0);
        assertTrue(monitor.getTransactionAudit("tx-1").isEmpty(), "Finished transactions leave the audit map");
    }
    
    @Test
    public void testTimeoutRetryAndRollbackFailureCounters() {
        monitor.recordTimeoutOccurred("tx-1", Duration.ofMillis(100), Duration.ofMillis(101));
        monitor.recordRetry(1, 3, 100, new TransientStoreException("database is locked"));
        monitor.recordRollbackActionFailed("tx-1", 0, new IllegalStateException("undo failed"));
        
        assertEquals(1.0, meterRegistry.get("kanban.transactions.timeouts").counter().count());
        assertEquals(1.0, meterRegistry.get("kanban.transactions.retries").counter().count());
        assertEquals(1.0, meterRegistry.get("kanban.transactions.rollback_actions.failed").counter().count());
    }
    
    @Test
    public void testHealth_UpThenDownOnLoad() {
        assertEquals(Status.UP, monitor.health().getStatus());
        
        monitor.recordTransactionStarted("tx-1", TransactionOptions.defaultOptions());
        monitor.recordTransactionStarted("tx-2", TransactionOptions.defaultOptions());
        monitor.recordTransactionStarted("tx-3", TransactionOptions.defaultOptions());
        
        Health health = monitor.health();
        assertEquals(Status.DOWN, health.getStatus(), "Too many active transactions should report DOWN");
        assertEquals(3L, health.getDetails().get("activeTransactions"));
    }
    
    @Test
    public void testHealth_DownOnLowSuccessRate() {
        monitor.recordTransactionStarted("tx-1", TransactionOptions.defaultOptions());
        monitor.recordTransactionFailed("tx-1", Duration.ofMillis(3), new IllegalStateException("boom"));
        
        assertEquals(Status.DOWN, monitor.health().getStatus());
    }
    
    @Test
    public void testManagerReportsToMonitor() throws Exception {
        java.util.concurrent.ExecutorService executor = java.util.concurrent.Executors.newSingleThreadExecutor();
        try {
            KanbanTransactionManager manager = new KanbanTransactionManager(
                new InlineStore(), new TransactionRegistry(), executor, RetryBackoff.none(), monitor);
            
            manager.executeTransaction(context -> "ok");
            assertThrows(TransactionFailureException.class, () -> manager.executeTransaction(context -> {
                manager.addRollbackAction(context, () -> { });
                throw new IllegalStateException("boom");
            }));
            
            TransactionMonitor.TransactionStatistics statistics = monitor.getTransactionStatistics();
            assertEquals(2, statistics.getTransactionsStarted());
            assertEquals(1, statistics.getTransactionsCommitted());
            assertEquals(1, statistics.getTransactionsFailed());
            assertEquals(1, statistics.getTransactionsRolledBack());
        } finally {
            executor.shutdownNow();
        }
    }
    
    private static final class InlineStore implements com.example.kanban.store.KanbanStore {
        @Override
        public <T> T transaction(com.example.kanban.store.StoreCallback<T> callback) throws Exception {
            return callback.doInStoreTransaction();
        }
        
        @Override
        public void execute(String directive) {
        }
    }
}
