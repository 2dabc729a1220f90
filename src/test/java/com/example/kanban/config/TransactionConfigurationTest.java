package com.example.kanban.config;

import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TransactionDecorator;
import com.example.kanban.store.KanbanStore;
import com.example.kanban.transaction.IsolationLevel;
import com.example.kanban.transaction.KanbanTransactionManager;
import com.example.kanban.transaction.RetryBackoff;
import com.example.kanban.transaction.TransactionMonitor;
import com.example.kanban.transaction.TransactionOptions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the transaction bean setup and the mapping of configuration onto default options.
 */
@SpringBootTest
@ActiveProfiles("test")
public class TransactionConfigurationTest {

    @Autowired
    private ApplicationContext applicationContext;
    
    @Autowired
    private KanbanTransactionManager kanbanTransactionManager;
    
    @Autowired
    private KanbanStoreHealthIndicator kanbanStoreHealthIndicator;
    
    @Test
    public void testTransactionBeansConfigured() {
        assertNotNull(kanbanTransactionManager, "Transaction manager should be configured");
        assertNotNull(applicationContext.getBean(KanbanStore.class), "Store should be configured");
        assertNotNull(applicationContext.getBean(TransactionMonitor.class), "Monitor should be configured");
        assertNotNull(applicationContext.getBean(ServiceTransactionCoordinator.class), "Coordinator should be configured");
        assertNotNull(applicationContext.getBean(TransactionDecorator.class), "Decorator should be configured");
        assertEquals(0L, applicationContext.getBean(RetryBackoff.class).delayAfterAttempt(3),
                    "Test profile retry settings should produce an immediate backoff");
    }
    
    @Test
    public void testManagerUsesConfiguredDefaults() {
        TransactionOptions defaults = kanbanTransactionManager.getDefaultOptions();
        
        assertTrue(defaults.isolation().isEmpty());
        assertTrue(defaults.deadline().isEmpty());
        assertTrue(defaults.autoRollback());
        assertEquals(0, defaults.retryAttempts());
    }
    
    @Test
    public void testTransactionRunsAgainstStore() {
        String result = kanbanTransactionManager.executeTransaction(context -> context.getId());
        
        assertNotNull(result);
        assertEquals(0, kanbanTransactionManager.getActiveTransactionCount());
    }
    
    @Test
    public void testStoreHealthIndicator() {
        assertEquals(Status.UP, kanbanStoreHealthIndicator.health().getStatus(),
                    "All store tables should exist once the schema is initialized");
    }
    
    @Test
    public void testDefaultOptionsMapping() {
        KanbanProperties.Transaction transaction = new KanbanProperties.Transaction();
        transaction.setDefaultTimeoutMs(1500);
        transaction.setDefaultIsolation("read committed");
        transaction.setAutoRollback(false);
        transaction.setRetryAttempts(2);
        
        TransactionOptions options = TransactionAutoConfiguration.defaultOptions(transaction);
        
        assertEquals(IsolationLevel.READ_COMMITTED, options.isolationLevel());
        assertEquals(Duration.ofMillis(1500), options.timeout());
        assertFalse(options.autoRollback());
        assertEquals(2, options.retryAttempts());
    }
    
    @Test
    public void testDefaultOptionsMapping_UnknownIsolationFallsBack() {
        KanbanProperties.Transaction transaction = new KanbanProperties.Transaction();
        transaction.setDefaultIsolation("SNAPSHOT");
        
        TransactionOptions options = TransactionAutoConfiguration.defaultOptions(transaction);
        
        assertNull(options.isolationLevel(), "Unknown names should fall back to the store default");
        assertNull(options.timeout(), "A zero timeout means no deadline");
    }
}
