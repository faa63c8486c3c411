package com.streamanalytics.core.bus;

/**
 * Point-in-time snapshot of event bus counters.
 *
 * @since 1.0.0
 */
public final class EventBusStats {

    private final long published;
    private final long duplicates;
    private final long dispatched;
    private final long handlerErrors;
    private final long rejected;
    private final int activeSubscriptions;
    private final int queueDepth;

    EventBusStats(long published, long duplicates, long dispatched, long handlerErrors,
            long rejected, int activeSubscriptions, int queueDepth) {
        this.published = published;
        this.duplicates = duplicates;
        this.dispatched = dispatched;
        this.handlerErrors = handlerErrors;
        this.rejected = rejected;
        this.activeSubscriptions = activeSubscriptions;
        this.queueDepth = queueDepth;
    }

    /** Events accepted for dispatch. */
    public long getPublished() {
        return published;
    }

    /** Events dropped because their id had already been seen. */
    public long getDuplicates() {
        return duplicates;
    }

    /** Handler invocations that completed normally. */
    public long getDispatched() {
        return dispatched;
    }

    public long getHandlerErrors() {
        return handlerErrors;
    }

    /** Handler invocations refused because the dispatch queue was full. */
    public long getRejected() {
        return rejected;
    }

    public int getActiveSubscriptions() {
        return activeSubscriptions;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    @Override
    public String toString() {
        return "EventBusStats{published=" + published
                + ", duplicates=" + duplicates
                + ", dispatched=" + dispatched
                + ", handlerErrors=" + handlerErrors
                + ", rejected=" + rejected
                + ", activeSubscriptions=" + activeSubscriptions
                + ", queueDepth=" + queueDepth + '}';
    }
}
