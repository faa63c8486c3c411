package com.streamanalytics.core.detection;

import com.streamanalytics.core.bus.EventBus;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.storage.MetricStore;
import com.streamanalytics.core.storage.RetryingExecutor;
import com.streamanalytics.core.storage.StorageRecord;
import com.streamanalytics.core.stream.WindowListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs anomaly detection on every sealed window.
 *
 * <p>
 * Every flagged point is persisted as an {@code ANOMALY} record keyed by the
 * window that produced it, so overlapping windows and points sharing a
 * millisecond keep separate records. A later revision of the same window
 * replaces its earlier results. Only the points the vote marked as anomalous
 * are published as {@link EventType#ANOMALY_DETECTED}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyMonitor implements WindowListener {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyMonitor.class);
    private static final String SOURCE = "anomaly-detector";

    private final AnomalyDetector detector;
    private final MetricStore store;
    private final EventBus bus;
    private final RetryingExecutor retrying;

    private final AtomicLong windowsScanned = new AtomicLong();
    private final AtomicLong resultsStored = new AtomicLong();
    private final AtomicLong anomaliesPublished = new AtomicLong();

    public AnomalyMonitor(AnomalyDetector detector, MetricStore store, EventBus bus, RetryingExecutor retrying) {
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
        this.store = Objects.requireNonNull(store, "MetricStore must not be null");
        this.bus = Objects.requireNonNull(bus, "EventBus must not be null");
        this.retrying = Objects.requireNonNull(retrying, "RetryingExecutor must not be null");
    }

    @Override
    public void onWindowClosed(Window window) {
        if (window.size() == 0) {
            return;
        }
        windowsScanned.incrementAndGet();
        List<AnomalyResult> results = detector.detectWindow(window);
        if (results.isEmpty()) {
            return;
        }

        List<StorageRecord> records = new ArrayList<>(results.size());
        Map<Instant, Integer> perInstant = new HashMap<>();
        for (AnomalyResult result : results) {
            int n = perInstant.merge(result.getTimestamp(), 1, Integer::sum) - 1;
            records.add(StorageRecord.of(result, window.getId() + "#" + n));
        }
        retrying.run("store anomalies " + window.getId(), () -> store.insertBatch(records));
        resultsStored.addAndGet(results.size());

        for (AnomalyResult result : results) {
            if (result.isAnomaly()) {
                anomaliesPublished.incrementAndGet();
                LOG.info("Anomaly in {} at {}: value={} confidence={} severity={}", result.seriesKey(),
                        result.getTimestamp(), result.getValue(), result.getCombinedConfidence(),
                        result.maxSeverity());
                bus.publish(Event.of(EventType.ANOMALY_DETECTED, SOURCE, result));
            }
        }
    }

    public long getWindowsScanned() {
        return windowsScanned.get();
    }

    public long getResultsStored() {
        return resultsStored.get();
    }

    public long getAnomaliesPublished() {
        return anomaliesPublished.get();
    }
}
