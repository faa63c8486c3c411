package com.streamanalytics.core.error;

/**
 * Thrown when a query names a metric the engine has never recorded and the
 * store does not contain.
 *
 * @since 1.0.0
 */
public class UnknownMetricException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final String metricName;

    public UnknownMetricException(String metricName) {
        super("Unknown metric: '" + metricName + "'");
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
