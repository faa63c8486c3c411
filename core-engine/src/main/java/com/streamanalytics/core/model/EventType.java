package com.streamanalytics.core.model;

/**
 * Topics carried by the event bus.
 *
 * @since 1.0.0
 */
public enum EventType {

    /** A validated observation was accepted; payload {@link Observation}. */
    METRIC_COLLECTED,

    /** A stream window was sealed; payload {@link Window}. */
    WINDOW_CLOSED,

    /** An aggregate was computed and persisted; payload {@link AggregateResult}. */
    AGGREGATE_COMPUTED,

    /** The detector flagged a point; payload {@link AnomalyResult}. */
    ANOMALY_DETECTED,

    /** A background task failed; payload {@link FailureNotice}. */
    PROCESSING_FAILED
}
