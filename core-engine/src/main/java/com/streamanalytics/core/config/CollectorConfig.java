package com.streamanalytics.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Metrics collector settings. A flush happens when {@code batchSize}
 * observations are buffered or {@code flushIntervalMillis} elapses,
 * whichever comes first.
 *
 * @since 1.0.0
 */
public class CollectorConfig {

    private int batchSize = 100;
    private long flushIntervalMillis = 5_000;
    private int bufferCapacity = 10_000;
    private long offerTimeoutMillis = 100;
    private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
    private boolean auditRawObservations = false;

    public Duration flushInterval() {
        return Duration.ofMillis(flushIntervalMillis);
    }

    public Duration offerTimeout() {
        return Duration.ofMillis(offerTimeoutMillis);
    }

    void collectErrors(List<String> errors) {
        if (batchSize < 1) {
            errors.add("collector.batchSize must be >= 1, got: " + batchSize);
        }
        if (flushIntervalMillis < 1) {
            errors.add("collector.flushIntervalMillis must be >= 1, got: " + flushIntervalMillis);
        }
        if (bufferCapacity < batchSize) {
            errors.add("collector.bufferCapacity must be >= batchSize (" + batchSize
                    + "), got: " + bufferCapacity);
        }
        if (offerTimeoutMillis < 0) {
            errors.add("collector.offerTimeoutMillis must be >= 0, got: " + offerTimeoutMillis);
        }
        if (overflowPolicy == null) {
            errors.add("collector.overflowPolicy is required");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getFlushIntervalMillis() {
        return flushIntervalMillis;
    }

    public void setFlushIntervalMillis(long flushIntervalMillis) {
        this.flushIntervalMillis = flushIntervalMillis;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
        this.bufferCapacity = bufferCapacity;
    }

    public long getOfferTimeoutMillis() {
        return offerTimeoutMillis;
    }

    public void setOfferTimeoutMillis(long offerTimeoutMillis) {
        this.offerTimeoutMillis = offerTimeoutMillis;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
    }

    public boolean isAuditRawObservations() {
        return auditRawObservations;
    }

    public void setAuditRawObservations(boolean auditRawObservations) {
        this.auditRawObservations = auditRawObservations;
    }

    @Override
    public String toString() {
        return "CollectorConfig{batchSize=" + batchSize
                + ", flushIntervalMillis=" + flushIntervalMillis
                + ", bufferCapacity=" + bufferCapacity
                + ", overflowPolicy=" + overflowPolicy + '}';
    }
}
