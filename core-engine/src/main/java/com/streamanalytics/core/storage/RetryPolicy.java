package com.streamanalytics.core.storage;

import com.streamanalytics.core.config.StorageConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with capped exponential backoff and jitter.
 *
 * <p>
 * The delay before retry {@code n} (1-based) is drawn uniformly from
 * {@code [base, 2 × base)} where {@code base = initialBackoff × 2^(n-1)},
 * then capped at {@code maxBackoff}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    }

    public static RetryPolicy from(StorageConfig config) {
        return new RetryPolicy(config.getRetryMaxAttempts(),
                Duration.ofMillis(config.getRetryInitialBackoffMillis()),
                Duration.ofMillis(config.getRetryMaxBackoffMillis()));
    }

    /**
     * A policy that tries once and never waits.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * @param retry 1-based retry number
     * @return delay to wait before that retry
     */
    public Duration backoffFor(int retry) {
        long initial = initialBackoff.toMillis();
        if (initial <= 0) {
            return Duration.ZERO;
        }
        long base = initial << Math.min(retry - 1, 20);
        long jittered = ThreadLocalRandom.current().nextLong(base, base * 2);
        return Duration.ofMillis(Math.min(jittered, maxBackoff.toMillis()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", initialBackoff=" + initialBackoff
                + ", maxBackoff=" + maxBackoff + '}';
    }
}
