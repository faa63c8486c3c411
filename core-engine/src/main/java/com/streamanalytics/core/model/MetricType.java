package com.streamanalytics.core.model;

/**
 * Kind of measurement an {@link Observation} carries.
 *
 * <p>
 * The type is informational: aggregation treats every value as a sample.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricType {
    GAUGE,
    COUNTER,
    HISTOGRAM,
    SUMMARY
}
