package com.streamanalytics.core.error;

/**
 * Thrown by the metrics collector when its buffer stays full for longer than
 * the configured offer timeout and the overflow policy is {@code REJECT}.
 *
 * @since 1.0.0
 */
public class BackpressureException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public BackpressureException(String message) {
        super(message);
    }
}
