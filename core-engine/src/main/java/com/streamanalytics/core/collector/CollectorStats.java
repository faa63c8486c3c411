package com.streamanalytics.core.collector;

/**
 * Point-in-time snapshot of collector counters.
 *
 * @since 1.0.0
 */
public final class CollectorStats {

    private final long collected;
    private final long batchesFlushed;
    private final long flushErrors;
    private final long dropped;
    private final int buffered;
    private final long windowsAggregated;

    CollectorStats(long collected, long batchesFlushed, long flushErrors, long dropped, int buffered,
            long windowsAggregated) {
        this.collected = collected;
        this.batchesFlushed = batchesFlushed;
        this.flushErrors = flushErrors;
        this.dropped = dropped;
        this.buffered = buffered;
        this.windowsAggregated = windowsAggregated;
    }

    public long getCollected() {
        return collected;
    }

    public long getBatchesFlushed() {
        return batchesFlushed;
    }

    public long getFlushErrors() {
        return flushErrors;
    }

    /** Observations evicted under the {@code DROP_OLDEST} policy. */
    public long getDropped() {
        return dropped;
    }

    public int getBuffered() {
        return buffered;
    }

    public long getWindowsAggregated() {
        return windowsAggregated;
    }

    @Override
    public String toString() {
        return "CollectorStats{collected=" + collected
                + ", batchesFlushed=" + batchesFlushed
                + ", flushErrors=" + flushErrors
                + ", dropped=" + dropped
                + ", buffered=" + buffered
                + ", windowsAggregated=" + windowsAggregated + '}';
    }
}
