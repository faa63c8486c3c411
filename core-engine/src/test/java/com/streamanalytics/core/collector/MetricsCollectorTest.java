package com.streamanalytics.core.collector;

import com.streamanalytics.core.bus.RecordingEventBus;
import com.streamanalytics.core.config.CollectorConfig;
import com.streamanalytics.core.config.OverflowPolicy;
import com.streamanalytics.core.error.BackpressureException;
import com.streamanalytics.core.error.StorageException;
import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.model.WindowType;
import com.streamanalytics.core.storage.InMemoryMetricStore;
import com.streamanalytics.core.storage.RecordKind;
import com.streamanalytics.core.storage.RetryPolicy;
import com.streamanalytics.core.storage.RetryingExecutor;
import com.streamanalytics.core.storage.StorageRecord;
import com.streamanalytics.core.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link MetricsCollector}.
 */
class MetricsCollectorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = T0.plus(Duration.ofDays(1));

    private CollectorConfig config;
    private FlakyStore store;
    private RecordingEventBus bus;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        config = new CollectorConfig();
        config.setBatchSize(100);
        config.setBufferCapacity(1000);
        config.setOfferTimeoutMillis(0);
        store = new FlakyStore();
        bus = new RecordingEventBus();
    }

    @AfterEach
    void tearDown() {
        if (collector != null) {
            collector.close();
        }
    }

    @Test
    @DisplayName("Should flush buffered observations as one batch aggregate per series")
    void shouldFlushBatchAggregatesPerSeries() {
        collector = newCollector();
        record("latency", "a", 1, 2, 3);
        record("latency", "b", 10, 20);

        int flushed = collector.flush();

        assertThat(flushed).isEqualTo(5);
        List<AggregateResult> aggregates = aggregates("latency");
        assertThat(aggregates).hasSize(2)
                .allSatisfy(a -> assertThat(a.getLevel()).isEqualTo(AggregationLevel.BATCH));
        assertThat(aggregates).extracting(AggregateResult::getCount).containsExactlyInAnyOrder(3L, 2L);
        assertThat(bus.published(EventType.AGGREGATE_COMPUTED)).hasSize(2);
        assertThat(collector.stats().getBatchesFlushed()).isEqualTo(1);
        assertThat(collector.stats().getBuffered()).isZero();
    }

    @Test
    @DisplayName("Should flush in the background once a full batch is buffered")
    void shouldFlushWhenBatchIsFull() {
        config.setBatchSize(10);
        collector = newCollector();

        for (int i = 0; i < 10; i++) {
            record("latency", "a", i);
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> store.containsMetric("latency"));
        assertThat(aggregates("latency")).singleElement()
                .satisfies(a -> assertThat(a.getCount()).isEqualTo(10));
    }

    @Test
    @DisplayName("Should evict the oldest observation when the buffer overflows")
    void shouldDropOldestOnOverflow() {
        config.setBufferCapacity(3);
        config.setOverflowPolicy(OverflowPolicy.DROP_OLDEST);
        collector = newCollector();

        record("latency", "a", 1, 2, 3, 4, 5);

        assertThat(collector.stats().getDropped()).isEqualTo(2);
        assertThat(collector.stats().getBuffered()).isEqualTo(3);
        collector.flush();
        assertThat(aggregates("latency")).singleElement()
                .satisfies(a -> assertThat(a.getMin()).isEqualTo(3.0));
    }

    @Test
    @DisplayName("Should signal backpressure when the buffer is full under REJECT")
    void shouldRejectOnOverflow() {
        config.setBufferCapacity(2);
        config.setOverflowPolicy(OverflowPolicy.REJECT);
        collector = newCollector();
        record("latency", "a", 1, 2);

        assertThatThrownBy(() -> record("latency", "a", 3))
                .isInstanceOf(BackpressureException.class);
        assertThat(collector.stats().getBuffered()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should put a failed batch back and persist it on the next flush")
    void shouldRequeueFailedBatch() {
        collector = newCollector();
        record("latency", "a", 1, 2, 3);
        store.failNext(1);

        assertThatThrownBy(() -> collector.flush()).isInstanceOf(StorageException.class);
        assertThat(collector.stats().getBuffered()).isEqualTo(3);
        assertThat(collector.stats().getFlushErrors()).isEqualTo(1);
        assertThat(store.containsMetric("latency")).isFalse();

        assertThat(collector.flush()).isEqualTo(3);
        assertThat(aggregates("latency")).singleElement()
                .satisfies(a -> assertThat(a.getCount()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should persist and publish a window aggregate when a window closes")
    void shouldAggregateClosedWindows() {
        collector = newCollector();
        MetricKey key = MetricKey.of("latency", Map.of("host", "a"));
        Window window = new Window(WindowType.TUMBLING, key, T0, T0.plusSeconds(60), 0, List.of(
                Observation.of("latency", 4.0, Map.of("host", "a"), T0.plusSeconds(1)),
                Observation.of("latency", 6.0, Map.of("host", "a"), T0.plusSeconds(2))));

        collector.onWindowClosed(window);
        collector.onWindowClosed(new Window(WindowType.TUMBLING, key, T0.plusSeconds(60),
                T0.plusSeconds(120), 0, List.of()));

        assertThat(aggregates("latency")).singleElement().satisfies(a -> {
            assertThat(a.getLevel()).isEqualTo(AggregationLevel.WINDOW);
            assertThat(a.getMean()).isEqualTo(5.0);
        });
        assertThat(collector.stats().getWindowsAggregated()).isEqualTo(1);
        assertThat(bus.published(EventType.AGGREGATE_COMPUTED)).hasSize(1);
    }

    @Test
    @DisplayName("Should stamp observations with the collector clock and track running statistics")
    void shouldTrackRunningStats() {
        collector = newCollector();

        Observation recorded = collector.record("latency", 2.0, Map.of("host", "a"));
        collector.record("latency", 4.0, Map.of("host", "a"));

        assertThat(recorded.getTimestamp()).isEqualTo(T0);
        assertThat(collector.runningStats(recorded.seriesKey())).hasValueSatisfying(s -> {
            assertThat(s.getCount()).isEqualTo(2);
            assertThat(s.getMean()).isEqualTo(3.0);
        });
        assertThat(collector.runningStats(MetricKey.of("other", Map.of()))).isEmpty();
        assertThat(collector.stats().getCollected()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should store raw observations when auditing is enabled")
    void shouldAuditRawObservations() {
        config.setAuditRawObservations(true);
        collector = newCollector();
        record("latency", "a", 1, 2);

        collector.flush();

        assertThat(store.queryRange(RecordKind.OBSERVATION, "latency", T0, END)).hasSize(2);
    }

    @Test
    @DisplayName("Should audit every observation even when several share a millisecond")
    void shouldAuditObservationsSharingATimestamp() {
        config.setAuditRawObservations(true);
        collector = newCollector();
        for (double v : new double[] { 1, 2, 3 }) {
            collector.record(Observation.of("m", v, Map.of(), T0));
        }

        collector.flush();

        assertThat(store.queryRange(RecordKind.OBSERVATION, "m", T0, T0))
                .extracting(r -> r.payloadAs(Observation.class).orElseThrow().getValue())
                .containsExactlyInAnyOrder(1.0, 2.0, 3.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private MetricsCollector newCollector() {
        return new MetricsCollector(config, store, bus, new RetryingExecutor(RetryPolicy.noRetry()),
                new MutableClock(T0));
    }

    private void record(String metric, String host, double... values) {
        for (double v : values) {
            collector.record(Observation.of(metric, v, Map.of("host", host), T0.plusMillis((long) v)));
        }
    }

    private List<AggregateResult> aggregates(String metric) {
        return store.queryRange(RecordKind.AGGREGATE, metric, T0, END).stream()
                .map(r -> r.payloadAs(AggregateResult.class).orElseThrow())
                .toList();
    }

    /**
     * In-memory store that can be told to fail its next inserts.
     */
    private static final class FlakyStore extends InMemoryMetricStore {

        private final AtomicInteger failures = new AtomicInteger();

        FlakyStore() {
            super(10_000);
        }

        void failNext(int count) {
            failures.set(count);
        }

        @Override
        public void insertBatch(List<StorageRecord> records) {
            if (failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new StorageException("store unavailable", false);
            }
            super.insertBatch(records);
        }
    }
}
