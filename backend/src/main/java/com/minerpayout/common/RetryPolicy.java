package com.minerpayout.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff schedule for ledger reads: base delay doubled per attempt, capped, then spread by a jitter factor.
 */
public final class RetryPolicy {

    private static final long NO_CAP = Long.MAX_VALUE;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, NO_CAP);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = Math.max(0.0, jitterFactor);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Wait before the retry that follows zero-based {@code attempt}.
     */
    public long delayMs(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), 20);
        long backoff = Math.min(maxDelayMs, baseDelayMs << shift);
        if (jitterFactor == 0.0 || backoff == 0) {
            return backoff;
        }
        double spread = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Math.max(0L, Math.round(backoff * (1.0 + spread)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 1s base, 20% jitter, 5 attempts, no cap.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }
}
