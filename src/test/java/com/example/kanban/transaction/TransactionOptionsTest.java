package com.example.kanban.transaction;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionOptionsTest {

    @Test
    public void testDefaultOptions() {
        TransactionOptions options = TransactionOptions.defaultOptions();
        
        assertTrue(options.isolation().isEmpty(), "No isolation directive by default");
        assertTrue(options.deadline().isEmpty(), "No deadline by default");
        assertTrue(options.autoRollback(), "Rollback should be automatic by default");
        assertEquals(0, options.retryAttempts(), "No retries by default");
    }

    @Test
    public void testWithers() {
        TransactionOptions options = TransactionOptions.defaultOptions()
            .withIsolationLevel(IsolationLevel.READ_COMMITTED)
            .withTimeoutMillis(250)
            .withAutoRollback(false)
            .withRetryAttempts(2);
        
        assertEquals(IsolationLevel.READ_COMMITTED, options.isolationLevel());
        assertEquals(Duration.ofMillis(250), options.timeout());
        assertFalse(options.autoRollback());
        assertEquals(2, options.retryAttempts());
    }

    @Test
    public void testInvalidOptions() {
        assertThrows(TransactionValidationException.class,
            () -> TransactionOptions.defaultOptions().withRetryAttempts(-1));
        assertThrows(TransactionValidationException.class,
            () -> TransactionOptions.defaultOptions().withTimeout(Duration.ZERO));
    }

    @Test
    public void testIsolationDirectives() {
        assertEquals("PRAGMA read_uncommitted = 1", IsolationLevel.READ_UNCOMMITTED.directive().orElseThrow());
        assertEquals("PRAGMA read_uncommitted = 0", IsolationLevel.READ_COMMITTED.directive().orElseThrow());
        assertTrue(IsolationLevel.SERIALIZABLE.directive().isEmpty(), "SERIALIZABLE is a no-op");
        assertTrue(IsolationLevel.REPEATABLE_READ.directive().isEmpty());
    }

    @Test
    public void testIsolationFromName() {
        assertEquals(IsolationLevel.READ_UNCOMMITTED, IsolationLevel.fromName("read-uncommitted").orElseThrow());
        assertEquals(IsolationLevel.SERIALIZABLE, IsolationLevel.fromName(" serializable ").orElseThrow());
        assertTrue(IsolationLevel.fromName("SNAPSHOT").isEmpty());
        assertTrue(IsolationLevel.fromName("").isEmpty());
    }

    @Test
    public void testRetryBackoff() {
        RetryBackoff backoff = new RetryBackoff(100, 1000, 2.0, 0.0);
        
        assertEquals(100, backoff.delayAfterAttempt(1));
        assertEquals(200, backoff.delayAfterAttempt(2));
        assertEquals(400, backoff.delayAfterAttempt(3));
        assertEquals(1000, backoff.delayAfterAttempt(10), "Delay should be capped");
        assertEquals(0, RetryBackoff.none().delayAfterAttempt(5));
        
        long jittered = RetryBackoff.defaults().delayAfterAttempt(1);
        assertTrue(jittered >= 90 && jittered <= 110, "Jitter should stay within 10%: " + jittered);
    }
}
