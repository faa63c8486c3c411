package com.streamanalytics.core.error;

/**
 * Root of the engine's exception hierarchy.
 *
 * <p>
 * All engine errors are unchecked. Callers that want to handle every engine
 * failure in one place catch this type; callers that care about a specific
 * condition catch the subclass.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
