package com.streamanalytics.core.config;

/**
 * What the metrics collector does when its buffer stays full past the offer
 * timeout.
 *
 * @since 1.0.0
 */
public enum OverflowPolicy {

    /** Evict the oldest buffered observation and accept the new one. */
    DROP_OLDEST,

    /** Refuse the new observation with a {@code BackpressureException}. */
    REJECT
}
