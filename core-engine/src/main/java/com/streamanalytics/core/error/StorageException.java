package com.streamanalytics.core.error;

/**
 * Thrown by the storage layer when a read or write fails.
 *
 * <p>
 * The {@link #isRetryable()} flag separates transient failures (connectivity,
 * pool exhaustion, timeouts) from permanent ones (constraint violations,
 * serialization errors, cancellation). Only retryable failures are retried by
 * {@link com.streamanalytics.core.storage.RetryingExecutor}.
 * </p>
 *
 * @since 1.0.0
 */
public class StorageException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    public StorageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StorageException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
