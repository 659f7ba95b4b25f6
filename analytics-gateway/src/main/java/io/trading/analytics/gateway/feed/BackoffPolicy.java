package io.trading.analytics.gateway.feed;

import java.util.Random;

/**
 * Capped exponential backoff with additive uniform jitter:
 * {@code min(base * 2^attempt, max) + uniform(0, jitter)}.
 */
public final class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;
    private final long maxJitterMs;
    private final Random random;

    public BackoffPolicy(long baseMs, long maxMs, long maxJitterMs) {
        this(baseMs, maxMs, maxJitterMs, new Random());
    }

    public BackoffPolicy(long baseMs, long maxMs, long maxJitterMs, Random random) {
        if (baseMs <= 0) {
            throw new IllegalArgumentException("baseMs must be positive");
        }
        if (maxMs < baseMs) {
            throw new IllegalArgumentException("maxMs cannot be less than baseMs");
        }
        if (maxJitterMs < 0) {
            throw new IllegalArgumentException("maxJitterMs cannot be negative");
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.maxJitterMs = maxJitterMs;
        this.random = random;
    }

    /**
     * Delay without jitter for the given zero-based attempt.
     */
    public long baseDelayMs(int attempt) {
        if (attempt <= 0) {
            return baseMs;
        }
        if (attempt >= Long.numberOfLeadingZeros(baseMs) - 1) {
            return maxMs;
        }
        return Math.min(baseMs << attempt, maxMs);
    }

    /**
     * Delay including jitter for the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        long jitter = maxJitterMs == 0 ? 0 : (long) (random.nextDouble() * maxJitterMs);
        return baseDelayMs(attempt) + jitter;
    }

    public long getBaseMs() {
        return baseMs;
    }

    public long getMaxMs() {
        return maxMs;
    }

    public long getMaxJitterMs() {
        return maxJitterMs;
    }
}
