package com.streamanalytics.core.detection;

import com.streamanalytics.core.bus.RecordingEventBus;
import com.streamanalytics.core.config.DetectionConfig;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Severity;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.model.WindowType;
import com.streamanalytics.core.storage.InMemoryMetricStore;
import com.streamanalytics.core.storage.RecordKind;
import com.streamanalytics.core.storage.RetryPolicy;
import com.streamanalytics.core.storage.RetryingExecutor;
import com.streamanalytics.core.storage.StorageRecord;
import com.streamanalytics.core.stats.TimedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.streamanalytics.core.detection.DetectionFixtures.SPIKE;
import static com.streamanalytics.core.detection.DetectionFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

class AnomalyMonitorTest {

    private static final MetricKey KEY = MetricKey.of("latency", Map.of("host", "web-1"));

    private InMemoryMetricStore store;
    private RecordingEventBus bus;
    private AnomalyMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricStore(100);
        bus = new RecordingEventBus();
        monitor = new AnomalyMonitor(new AnomalyDetector(new DetectionConfig()), store, bus,
                new RetryingExecutor(RetryPolicy.noRetry()));
    }

    @Test
    @DisplayName("Should persist and publish anomalies found in a closed window")
    void shouldPersistAndPublishAnomalies() {
        monitor.onWindowClosed(window(SPIKE));

        assertThat(store.queryRange(RecordKind.ANOMALY, "latency", T0, T0.plusSeconds(60))).singleElement()
                .satisfies(r -> assertThat(r.payloadAs(AnomalyResult.class).orElseThrow().getValue())
                        .isEqualTo(500.0));
        assertThat(bus.published(EventType.ANOMALY_DETECTED)).singleElement()
                .satisfies(e -> assertThat(e.getSource()).isEqualTo("anomaly-detector"));
        assertThat(monitor.getWindowsScanned()).isEqualTo(1);
        assertThat(monitor.getResultsStored()).isEqualTo(1);
        assertThat(monitor.getAnomaliesPublished()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stay quiet for a window without anomalies")
    void shouldIgnoreQuietWindow() {
        monitor.onWindowClosed(window(10, 11, 10, 11));
        monitor.onWindowClosed(window());

        assertThat(store.size()).isZero();
        assertThat(bus.published()).isEmpty();
        assertThat(monitor.getWindowsScanned()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep separate records for flagged points sharing a millisecond")
    void shouldKeepPointsSharingATimestamp() {
        AnomalyMonitor aboveHundred = new AnomalyMonitor(
                new AnomalyDetector(Map.of(DetectionMethod.ZSCORE, above(100.0)), VotingPolicy.majority(),
                        EnumSet.of(DetectionMethod.ZSCORE), Duration.ZERO),
                store, bus, new RetryingExecutor(RetryPolicy.noRetry()));
        List<Observation> sameInstant = List.of(
                Observation.of("latency", 10.0, KEY.getTags(), T0),
                Observation.of("latency", 500.0, KEY.getTags(), T0),
                Observation.of("latency", 700.0, KEY.getTags(), T0));

        aboveHundred.onWindowClosed(new Window(WindowType.TUMBLING, KEY, T0, T0.plusSeconds(60), 0, sameInstant));

        assertThat(store.queryRange(RecordKind.ANOMALY, "latency", T0, T0))
                .extracting(r -> r.payloadAs(AnomalyResult.class).orElseThrow().getValue())
                .containsExactlyInAnyOrder(500.0, 700.0);
        assertThat(bus.published(EventType.ANOMALY_DETECTED)).hasSize(2);
    }

    @Test
    @DisplayName("Should keep the results of overlapping windows for the same point")
    void shouldKeepResultsOfOverlappingWindows() {
        monitor.onWindowClosed(window(WindowType.SLIDING, T0.minusSeconds(30), 0, SPIKE));
        monitor.onWindowClosed(window(WindowType.SLIDING, T0, 0, SPIKE));

        assertThat(store.queryRange(RecordKind.ANOMALY, "latency", T0, T0.plusSeconds(60)))
                .hasSize(2)
                .extracting(StorageRecord::getTimestamp)
                .containsOnly(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("Should replace earlier results when a window is revised")
    void shouldReplaceResultsOfRevisedWindow() {
        monitor.onWindowClosed(window(WindowType.TUMBLING, T0, 0, SPIKE));
        monitor.onWindowClosed(window(WindowType.TUMBLING, T0, 1, SPIKE));

        assertThat(store.queryRange(RecordKind.ANOMALY, "latency", T0, T0.plusSeconds(60))).hasSize(1);
    }

    private static Window window(double... values) {
        return window(WindowType.TUMBLING, T0, 0, values);
    }

    private static Window window(WindowType type, Instant start, int revision, double... values) {
        List<Observation> elements = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            elements.add(Observation.of("latency", values[i], KEY.getTags(), T0.plusSeconds(i)));
        }
        return new Window(type, KEY, start, start.plusSeconds(60), revision, elements);
    }

    private static DetectionMethodStrategy above(double limit) {
        return new DetectionMethodStrategy() {
            @Override
            public DetectionMethod method() {
                return DetectionMethod.ZSCORE;
            }

            @Override
            public List<MethodFinding> apply(DetectionInput input) {
                List<MethodFinding> findings = new ArrayList<>();
                List<TimedValue> points = input.getPoints();
                for (int i = 0; i < points.size(); i++) {
                    TimedValue point = points.get(i);
                    if (point.getValue() > limit) {
                        findings.add(new MethodFinding(i, point.getTimestamp(), point.getValue(),
                                new AnomalyEvidence(DetectionMethod.ZSCORE, 0.9, true, Severity.HIGH,
                                        point.getValue() / limit, "above " + limit)));
                    }
                }
                return findings;
            }
        };
    }
}
