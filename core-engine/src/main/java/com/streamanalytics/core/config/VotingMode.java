package com.streamanalytics.core.config;

/**
 * How per-method evidence is combined into a single anomaly verdict.
 *
 * @since 1.0.0
 */
public enum VotingMode {

    /** Anomalous when a strict majority of effective methods flag the point. */
    MAJORITY,

    /** Anomalous when the weighted confidence reaches the configured threshold. */
    WEIGHTED
}
