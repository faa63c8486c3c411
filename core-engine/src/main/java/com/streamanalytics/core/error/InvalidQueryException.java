package com.streamanalytics.core.error;

/**
 * Thrown when a query range is malformed, e.g. {@code end} before {@code start}.
 *
 * @since 1.0.0
 */
public class InvalidQueryException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public InvalidQueryException(String message) {
        super(message);
    }
}
