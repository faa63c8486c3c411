package com.streamanalytics.core.error;

/**
 * Thrown when an input is malformed: a blank metric name, a non-finite value,
 * a missing timestamp, or two sequences of different lengths.
 *
 * <p>
 * Observations that fail validation are rejected at ingestion and never enter
 * the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
