package com.example.kanban.transaction;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between transaction retry attempts.
 * 
 * @param initialDelayMs Delay before the second attempt
 * @param maxDelayMs Upper bound for any single delay
 * @param multiplier Growth factor applied per attempt
 * @param jitterFactor Relative jitter applied to each delay (0.0 disables jitter)
 */
public record RetryBackoff(long initialDelayMs, long maxDelayMs, double multiplier, double jitterFactor) {

    private static final long DEFAULT_INITIAL_DELAY_MS = 100L;
    private static final long DEFAULT_MAX_DELAY_MS = 5000L;
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    public RetryBackoff {
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new TransactionValidationException("Retry delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new TransactionValidationException("Retry multiplier must be at least 1.0: " + multiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new TransactionValidationException("Jitter factor must be within [0, 1]: " + jitterFactor);
        }
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS,
            DEFAULT_BACKOFF_MULTIPLIER, DEFAULT_JITTER_FACTOR);
    }

    /**
     * No waiting between attempts.
     */
    public static RetryBackoff none() {
        return new RetryBackoff(0L, 0L, 1.0, 0.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public long delayAfterAttempt(int attempt) {
        double base = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(base, (double) maxDelayMs);
        if (jitterFactor == 0.0 || capped == 0L) {
            return capped;
        }
        double jitter = (ThreadLocalRandom.current().nextDouble() - 0.5) * 2 * jitterFactor;
        return Math.max(0L, Math.min(maxDelayMs, Math.round(capped * (1 + jitter))));
    }
}
