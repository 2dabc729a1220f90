package com.example.kanban.transaction;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failure is transient store contention worth retrying or a permanent error.
 * 
 * The whole cause chain is inspected because the store's errors usually arrive wrapped, first
 * by Spring's data access translation and then by the transaction layer itself. Timeouts of
 * the transaction deadline and validation errors are never transient.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<String> TRANSIENT_SIGNATURES = List.of(
        "database is locked",
        "database table is locked",
        "sqlite_busy",
        "sqlite_locked",
        "deadlock",
        "lock timeout",
        "lock wait timeout",
        "temporarily unavailable"
    );

    private ErrorClassifier() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Determine if an exception represents a transient failure that should be retried.
     * 
     * @param error The exception to check, may be {@code null}
     * @return true if the failure is transient, false otherwise
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof TransactionTimeoutException
                    || current instanceof TransactionValidationException) {
                return false;
            }
            if (current instanceof TransientStoreException
                    || current instanceof TransientDataAccessException
                    || current instanceof SQLTransientException) {
                return true;
            }
            if (current instanceof SQLiteException sqliteException && isBusyOrLocked(sqliteException)) {
                return true;
            }
            if (isStoreError(current) && hasTransientSignature(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Determine if a store error in the cause chain reports a deadlock or lock timeout.
     */
    public static boolean isDeadlock(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            String message = current.getMessage();
            if (message != null && isStoreError(current)) {
                String lowerMessage = message.toLowerCase(Locale.ROOT);
                if (lowerMessage.contains("deadlock") || lowerMessage.contains("lock timeout")) {
                    return true;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    /**
     * Format exception information for logging with transaction context.
     * 
     * @param error The exception to format
     * @param transactionId Optional transaction id
     * @return Formatted exception message
     */
    public static String describe(Throwable error, String transactionId) {
        StringBuilder sb = new StringBuilder();
        
        if (transactionId != null) {
            sb.append("[Transaction ").append(transactionId).append("] ");
        }
        
        sb.append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
        
        if (isDeadlock(error)) {
            sb.append(" (DEADLOCK DETECTED)");
        } else if (isTransient(error)) {
            sb.append(" (RETRYABLE)");
        }
        
        return sb.toString();
    }

    private static boolean isStoreError(Throwable error) {
        return error instanceof SQLException || error instanceof DataAccessException;
    }

    private static boolean isBusyOrLocked(SQLiteException exception) {
        SQLiteErrorCode resultCode = exception.getResultCode();
        if (resultCode == null) {
            return false;
        }
        int primaryCode = resultCode.code & 0xFF;
        return primaryCode == SQLiteErrorCode.SQLITE_BUSY.code
            || primaryCode == SQLiteErrorCode.SQLITE_LOCKED.code;
    }

    private static boolean hasTransientSignature(String message) {
        if (message == null) {
            return false;
        }
        String lowerMessage = message.toLowerCase(Locale.ROOT);
        for (String signature : TRANSIENT_SIGNATURES) {
            if (lowerMessage.contains(signature)) {
                return true;
            }
        }
        return false;
    }
}
