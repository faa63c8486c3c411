package com.streamanalytics.core.engine;

import com.streamanalytics.core.config.EngineConfig;
import com.streamanalytics.core.config.EngineConfigLoader;
import com.streamanalytics.core.error.ConfigurationException;
import com.streamanalytics.core.error.InvalidQueryException;
import com.streamanalytics.core.error.UnknownMetricException;
import com.streamanalytics.core.error.ValidationException;
import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests of {@link AnalyticsEngine} over the in-memory store.
 * Event time is driven by a fixed clock and explicit watermarks.
 */
class AnalyticsEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Map<String, String> TAGS = Map.of("service", "checkout");

    private MutableClock clock;
    private AnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plusSeconds(10));
        engine = AnalyticsEngine.builder(new EngineConfig()).clock(clock).build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should aggregate every recorded observation into its window")
    void shouldAggregateRecordedObservations() {
        for (int i = 0; i < 1000; i++) {
            engine.recordMetric("api.latency", 100 + (i % 10), TAGS);
        }

        engine.advanceWatermark(T0.plusSeconds(60));

        List<AggregateResult> aggregates = engine.getMetrics("api.latency", T0, T0.plusSeconds(60));
        assertThat(aggregates).singleElement().satisfies(a -> {
            assertThat(a.getCount()).isEqualTo(1000);
            assertThat(a.getMin()).isEqualTo(100.0);
            assertThat(a.getMax()).isEqualTo(109.0);
            assertThat(a.getMean()).isEqualTo(104.5);
            assertThat(a.getLevel()).isEqualTo(AggregationLevel.WINDOW);
            assertThat(a.getTags()).isEqualTo(TAGS);
        });
        assertThat(engine.stats().getCollector().getCollected()).isEqualTo(1000);
        assertThat(engine.stats().getStream().getWindowsClosed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return the same result for repeated queries")
    void shouldAnswerQueriesIdempotently() {
        engine.recordMetric("api.latency", 12.0, TAGS);
        engine.flush();

        List<AggregateResult> first = engine.getMetrics("api.latency", T0, T0.plusSeconds(60));
        List<AggregateResult> second = engine.getMetrics("api.latency", T0, T0.plusSeconds(60));

        assertThat(first).hasSize(1).isEqualTo(second);
        assertThat(engine.getMetrics("api.latency", T0, T0.plusSeconds(60), AggregationLevel.BATCH))
                .singleElement()
                .satisfies(a -> assertThat(a.getCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("Should detect, store and publish a spike")
    void shouldDetectAndPublishSpike() {
        List<Event> anomalies = new CopyOnWriteArrayList<>();
        engine.subscribe(EventType.ANOMALY_DETECTED, anomalies::add);
        double[] values = { 10, 12, 11, 9, 10, 500 };
        for (int i = 0; i < values.length; i++) {
            engine.recordMetric(Observation.of("api.latency", values[i], TAGS, T0.plusSeconds(i + 1)));
        }

        engine.advanceWatermark(T0.plusSeconds(60));

        await().atMost(Duration.ofSeconds(5)).until(() -> anomalies.size() == 1);
        AnomalyResult published = anomalies.get(0).payloadAs(AnomalyResult.class).orElseThrow();
        assertThat(published.getValue()).isEqualTo(500.0);
        assertThat(published.getTimestamp()).isEqualTo(T0.plusSeconds(6));
        assertThat(engine.getAnomalies("api.latency", T0, T0.plusSeconds(60)))
                .singleElement()
                .satisfies(r -> assertThat(r.getEvidence()).hasSizeGreaterThanOrEqualTo(2));
        assertThat(engine.stats().getAnomaliesDetected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty list for a range with no records")
    void shouldReturnEmptyForEmptyRange() {
        engine.recordMetric("api.latency", 12.0, TAGS);
        engine.flush();

        assertThat(engine.getMetrics("api.latency", T0.plusSeconds(1), T0.plusSeconds(1))).isEmpty();
        assertThat(engine.getMetrics("api.latency", T0.plusSeconds(3600), T0.plusSeconds(7200))).isEmpty();
    }

    @Test
    @DisplayName("Should include aggregates that start exactly at the range end")
    void shouldIncludeRangeEnd() {
        engine.recordMetric(Observation.of("api.latency", 10.0, TAGS, T0.plusSeconds(5)));
        engine.recordMetric(Observation.of("api.latency", 20.0, TAGS, T0.plusSeconds(65)));
        engine.flush();

        assertThat(engine.getMetrics("api.latency", T0, T0.plusSeconds(60)))
                .extracting(AggregateResult::getWindowStart)
                .containsExactly(T0, T0.plusSeconds(60));
        assertThat(engine.getMetrics("api.latency", T0, T0)).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a range whose end precedes its start")
    void shouldRejectInvertedRange() {
        engine.recordMetric("api.latency", 12.0, TAGS);

        assertThatThrownBy(() -> engine.getMetrics("api.latency", T0.plusSeconds(60), T0))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> engine.getAnomalies(" ", T0, T0.plusSeconds(60)))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("Should reject queries for metrics that were never recorded")
    void shouldRejectUnknownMetric() {
        assertThatThrownBy(() -> engine.getMetrics("never.recorded", T0, T0.plusSeconds(60)))
                .isInstanceOf(UnknownMetricException.class)
                .hasMessageContaining("never.recorded");
    }

    @Test
    @DisplayName("Should reject invalid observations before they reach the pipeline")
    void shouldRejectInvalidObservations() {
        assertThatThrownBy(() -> engine.recordMetric("", 1.0, TAGS)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.recordMetric("api.latency", Double.NaN, TAGS))
                .isInstanceOf(ValidationException.class);

        assertThat(engine.stats().getCollector().getCollected()).isZero();
    }

    @Test
    @DisplayName("Should report running only between start and close")
    void shouldTrackLifecycle() {
        assertThat(engine.isRunning()).isFalse();

        engine.start();
        assertThat(engine.isRunning()).isTrue();

        engine.close();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should refuse to build from an invalid configuration")
    void shouldFailFastOnInvalidConfig() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");
        config.getCollector().setBatchSize(0);

        assertThatThrownBy(() -> AnalyticsEngine.builder(config).build())
                .isInstanceOf(ConfigurationException.class);
    }
}
