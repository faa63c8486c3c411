package com.streamanalytics.core.error;

/**
 * Thrown when a statistic or detection method needs more data points than it
 * was given.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    public InsufficientDataException(String operation, int required, int actual) {
        super(operation + " requires at least " + required + " data point(s), got: " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
