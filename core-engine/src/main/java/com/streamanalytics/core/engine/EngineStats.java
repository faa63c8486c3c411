package com.streamanalytics.core.engine;

import com.streamanalytics.core.bus.EventBusStats;
import com.streamanalytics.core.collector.CollectorStats;
import com.streamanalytics.core.stream.StreamStats;

import java.util.Objects;

/**
 * Composite snapshot of every engine component's counters.
 *
 * @since 1.0.0
 */
public final class EngineStats {

    private final EventBusStats bus;
    private final CollectorStats collector;
    private final StreamStats stream;
    private final long anomaliesDetected;
    private final long retentionDeleted;

    public EngineStats(EventBusStats bus, CollectorStats collector, StreamStats stream,
            long anomaliesDetected, long retentionDeleted) {
        this.bus = Objects.requireNonNull(bus, "bus stats must not be null");
        this.collector = Objects.requireNonNull(collector, "collector stats must not be null");
        this.stream = Objects.requireNonNull(stream, "stream stats must not be null");
        this.anomaliesDetected = anomaliesDetected;
        this.retentionDeleted = retentionDeleted;
    }

    public EventBusStats getBus() {
        return bus;
    }

    public CollectorStats getCollector() {
        return collector;
    }

    public StreamStats getStream() {
        return stream;
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    public long getRetentionDeleted() {
        return retentionDeleted;
    }

    @Override
    public String toString() {
        return "EngineStats{bus=" + bus
                + ", collector=" + collector
                + ", stream=" + stream
                + ", anomaliesDetected=" + anomaliesDetected
                + ", retentionDeleted=" + retentionDeleted + '}';
    }
}
