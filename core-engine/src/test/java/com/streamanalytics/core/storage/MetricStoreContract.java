package com.streamanalytics.core.storage;

import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every {@link MetricStore} must share. Subclasses supply the
 * store under test.
 */
abstract class MetricStoreContract {

    protected static final Instant T0 = Instant.parse("2024-03-10T12:00:00Z");

    protected MetricStore store;

    protected abstract MetricStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @AfterEach
    void tearDownStore() {
        store.close();
    }

    @Test
    @DisplayName("Should return records on both range bounds in time order")
    void shouldQueryRangeInclusiveOfBothEnds() {
        store.insertBatch(List.of(
                aggregate("latency", T0.plusSeconds(180), 4.0),
                aggregate("latency", T0.plusSeconds(120), 3.0),
                aggregate("latency", T0, 1.0),
                aggregate("latency", T0.plusSeconds(60), 2.0)));

        List<StorageRecord> records = store.queryRange(RecordKind.AGGREGATE, "latency",
                T0, T0.plusSeconds(120));

        assertThat(records).extracting(StorageRecord::getTimestamp)
                .containsExactly(T0, T0.plusSeconds(60), T0.plusSeconds(120));
    }

    @Test
    @DisplayName("Should return exactly the two records a covering range spans")
    void shouldReturnBothEndpointRecords() {
        StorageRecord first = observation("latency", T0, 1.0);
        StorageRecord second = observation("latency", T0.plusSeconds(60), 2.0);
        store.insertBatch(List.of(first, second));

        assertThat(store.queryRange(RecordKind.OBSERVATION, "latency", T0, T0.plusSeconds(60)))
                .containsExactly(first, second);
    }

    @Test
    @DisplayName("Should match a single instant and nothing for an inverted range")
    void shouldHandleDegenerateRanges() {
        store.insertBatch(List.of(aggregate("latency", T0, 1.0)));

        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency", T0, T0)).hasSize(1);
        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency", T0.plusSeconds(1), T0.plusSeconds(1)))
                .isEmpty();
        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency", T0.plusSeconds(1), T0)).isEmpty();
    }

    @Test
    @DisplayName("Should keep metrics and record kinds apart")
    void shouldFilterByMetricAndKind() {
        store.insertBatch(List.of(
                aggregate("latency", T0, 1.0),
                aggregate("throughput", T0, 5.0),
                observation("latency", T0.plusSeconds(1), 7.0)));

        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency", T0, T0.plusSeconds(60)))
                .hasSize(1);
        assertThat(store.queryRange(RecordKind.OBSERVATION, "latency", T0, T0.plusSeconds(60)))
                .singleElement()
                .satisfies(r -> assertThat(r.payloadAs(Observation.class))
                        .hasValueSatisfying(o -> assertThat(o.getValue()).isEqualTo(7.0)));
        assertThat(store.queryRange("latency", T0, T0.plusSeconds(60))).hasSize(2);
    }

    @Test
    @DisplayName("Should replace a record whose key already exists")
    void shouldUpsertByKey() {
        store.insertBatch(List.of(aggregate("latency", T0, 1.0)));
        store.insertBatch(List.of(aggregate("latency", T0, 9.0)));

        List<StorageRecord> records = store.queryRange(RecordKind.AGGREGATE, "latency",
                T0, T0.plusSeconds(60));

        assertThat(records).singleElement()
                .satisfies(r -> assertThat(r.payloadAs(AggregateResult.class).orElseThrow().getMean())
                        .isEqualTo(9.0));
    }

    @Test
    @DisplayName("Should find a record by key and preserve its payload")
    void shouldFindByKey() {
        StorageRecord anomaly = anomaly("latency", T0.plusSeconds(5));
        store.insertBatch(List.of(anomaly));

        assertThat(store.find(anomaly.getKey())).hasValueSatisfying(found -> {
            AnomalyResult result = found.payloadAs(AnomalyResult.class).orElseThrow();
            assertThat(result.getValue()).isEqualTo(500.0);
            assertThat(result.getTags()).containsEntry("host", "web-1");
            assertThat(result.getEvidence()).hasSize(1);
        });
        assertThat(store.find(aggregate("latency", T0, 1.0).getKey())).isEmpty();
    }

    @Test
    @DisplayName("Should delete records older than the cutoff")
    void shouldDeleteBeforeCutoff() {
        store.insertBatch(List.of(
                aggregate("latency", T0.minus(Duration.ofDays(2)), 1.0),
                aggregate("latency", T0.minusSeconds(1), 2.0),
                aggregate("latency", T0, 3.0)));

        long removed = store.deleteBefore(T0);

        assertThat(removed).isEqualTo(2);
        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency", T0.minus(Duration.ofDays(3)),
                T0.plusSeconds(60))).extracting(StorageRecord::getTimestamp).containsExactly(T0);
    }

    @Test
    @DisplayName("Should report whether a metric has any records")
    void shouldReportContainedMetrics() {
        assertThat(store.containsMetric("latency")).isFalse();

        store.insertBatch(List.of(observation("latency", T0, 1.0)));

        assertThat(store.containsMetric("latency")).isTrue();
        assertThat(store.containsMetric("throughput")).isFalse();
    }

    @Test
    @DisplayName("Should treat an empty batch as a no-op")
    void shouldIgnoreEmptyBatch() {
        store.insertBatch(new ArrayList<>());

        assertThat(store.containsMetric("latency")).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    protected static StorageRecord aggregate(String metric, Instant start, double mean) {
        return StorageRecord.of(AggregateResult.builder()
                .metricName(metric)
                .tags(Map.of("host", "web-1"))
                .level(AggregationLevel.WINDOW)
                .windowId("w-" + start.toEpochMilli())
                .windowStart(start)
                .windowEnd(start.plusSeconds(60))
                .count(1)
                .min(mean).max(mean).mean(mean).median(mean)
                .stddev(0.0).p95(mean).p99(mean).sum(mean)
                .build());
    }

    protected static StorageRecord observation(String metric, Instant ts, double value) {
        return StorageRecord.of(Observation.of(metric, value, Map.of("host", "web-1"), ts));
    }

    protected static StorageRecord anomaly(String metric, Instant ts) {
        return StorageRecord.of(AnomalyResult.builder()
                .metricName(metric)
                .tags(Map.of("host", "web-1"))
                .windowId("w-1")
                .timestamp(ts)
                .value(500.0)
                .addEvidence(new AnomalyEvidence(DetectionMethod.ZSCORE, 0.45, true, Severity.LOW,
                        2.24, "z=2.24"))
                .combinedConfidence(1.0)
                .anomaly(true)
                .build());
    }
}
