package com.example.kanban.transaction;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionStateTest {

    @Test
    public void testCommitPath() {
        TransactionContext context = new TransactionContext("tx-1", Instant.now(), null);
        
        assertTrue(context.isActive());
        assertTrue(context.transitionTo(TransactionState.RUNNING));
        assertTrue(context.transitionTo(TransactionState.COMMITTING));
        assertFalse(context.isActive(), "A committing transaction no longer accepts operations");
        assertTrue(context.transitionTo(TransactionState.CLOSED));
        assertTrue(context.getState().isTerminal());
    }

    @Test
    public void testTimeoutPath() {
        TransactionContext context = new TransactionContext("tx-2", Instant.now(), null);
        context.transitionTo(TransactionState.RUNNING);
        
        assertTrue(context.transitionTo(TransactionState.TIMED_OUT));
        assertTrue(context.isTimedOut());
        assertFalse(context.transitionTo(TransactionState.COMMITTING), "A timed out transaction must not commit");
        assertFalse(context.transitionTo(TransactionState.FAILING));
        assertTrue(context.transitionTo(TransactionState.ROLLING_BACK));
        assertTrue(context.transitionTo(TransactionState.CLOSED));
    }

    @Test
    public void testClosedIsTerminal() {
        for (TransactionState next : TransactionState.values()) {
            assertFalse(TransactionState.CLOSED.canTransitionTo(next), "CLOSED should not lead to " + next);
        }
    }

    @Test
    public void testDeadlineFollowsTimeout() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        TransactionContext context = new TransactionContext("tx-3", start, java.time.Duration.ofSeconds(2));
        
        assertEquals(Instant.parse("2024-01-01T00:00:02Z"), context.getDeadline().orElseThrow());
        assertTrue(new TransactionContext("tx-4", start, null).getDeadline().isEmpty());
    }

    @Test
    public void testMetadataIsCopied() {
        TransactionContext context = new TransactionContext("tx-5", Instant.now(), null);
        context.putMetadata("autoRollback", true);
        context.putMetadata("timeoutMs", null);
        
        assertEquals(1, context.getMetadata().size(), "Null values should remove keys");
        assertThrows(UnsupportedOperationException.class, () -> context.getMetadata().put("x", 1));
    }
}
