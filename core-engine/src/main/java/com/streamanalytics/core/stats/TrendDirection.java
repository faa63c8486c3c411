package com.streamanalytics.core.stats;

/**
 * Direction of a linear trend.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
