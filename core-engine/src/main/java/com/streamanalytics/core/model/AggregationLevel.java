package com.streamanalytics.core.model;

/**
 * Origin of an {@link AggregateResult}.
 *
 * @since 1.0.0
 */
public enum AggregationLevel {

    /** Computed from a sealed stream window. */
    WINDOW,

    /** Computed from one collector flush batch. */
    BATCH
}
