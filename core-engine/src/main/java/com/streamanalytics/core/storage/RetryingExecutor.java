package com.streamanalytics.core.storage;

import com.streamanalytics.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs storage operations under a {@link RetryPolicy}.
 *
 * <p>
 * Only a {@link StorageException} flagged {@linkplain StorageException#isRetryable()
 * retryable} is retried. Any other exception, or the last failed attempt, is
 * rethrown unchanged. Interruption during backoff aborts with a
 * non-retryable {@link StorageException} and restores the interrupt flag.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryingExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingExecutor.class);

    private final RetryPolicy policy;

    public RetryingExecutor(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "RetryPolicy must not be null");
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T execute(String operation, Supplier<T> action) {
        Objects.requireNonNull(action, "action must not be null");
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (StorageException e) {
                if (!e.isRetryable() || attempt >= policy.getMaxAttempts()) {
                    if (attempt > 1) {
                        LOG.error("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    }
                    throw e;
                }
                Duration backoff = policy.backoffFor(attempt);
                LOG.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, policy.getMaxAttempts(), backoff.toMillis(), e.getMessage());
                sleep(operation, backoff, e);
            }
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private static void sleep(String operation, Duration backoff, StorageException cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StorageException(operation + " interrupted during retry backoff", cause, false);
        }
    }
}
