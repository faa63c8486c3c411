package com.streamanalytics.core.detection;

import com.streamanalytics.core.config.DetectionConfig;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Severity;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.model.WindowType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.streamanalytics.core.detection.DetectionFixtures.SPIKE;
import static com.streamanalytics.core.detection.DetectionFixtures.T0;
import static com.streamanalytics.core.detection.DetectionFixtures.input;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(new DetectionConfig());
    }

    @Test
    @DisplayName("Should flag the spike by majority of the ensemble")
    void shouldDetectSpikeWithEnsemble() {
        List<AnomalyResult> results = detector.detect(input(SPIKE), EnumSet.of(DetectionMethod.COMBINED));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getTimestamp()).isEqualTo(T0.plusSeconds(5));
            assertThat(r.getValue()).isEqualTo(500.0);
            assertThat(r.isAnomaly()).isTrue();
            assertThat(r.getEvidence()).extracting(AnomalyEvidence::getMethod)
                    .containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR, DetectionMethod.COMBINED);
            assertThat(r.getCombinedConfidence()).isCloseTo((2.236 / 5 + 1.4457 / 5) / 3, within(1e-3));
            assertThat(r.getMetricName()).isEqualTo("latency");
            assertThat(r.getTags()).containsEntry("host", "web-1");
            assertThat(r.getWindowId()).isEqualTo("w-1");
        });
    }

    @Test
    @DisplayName("Should describe the ensemble vote in the COMBINED evidence")
    void shouldAddCombinedEvidence() {
        AnomalyResult result = detector.detect(input(SPIKE), EnumSet.of(DetectionMethod.COMBINED)).get(0);

        assertThat(result.getEvidence()).filteredOn(e -> e.getMethod() == DetectionMethod.COMBINED)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getScore()).isEqualTo(result.getCombinedConfidence());
                    assertThat(e.getDeviation()).isEqualTo(2.0);
                    assertThat(e.getSeverity()).isEqualTo(Severity.LOW);
                    assertThat(e.getDetail()).contains("2 of 3");
                });
    }

    @Test
    @DisplayName("Should run only the requested methods")
    void shouldRunRequestedMethodsOnly() {
        List<AnomalyResult> results = detector.detect(input(SPIKE), EnumSet.of(DetectionMethod.IQR));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getEvidence()).extracting(AnomalyEvidence::getMethod).containsExactly(DetectionMethod.IQR);
            assertThat(r.isAnomaly()).isTrue();
        });
    }

    @Test
    @DisplayName("Should return nothing for an empty series or a quiet series")
    void shouldReturnEmptyWhenNothingFlagged() {
        assertThat(detector.detect(input(), EnumSet.of(DetectionMethod.COMBINED))).isEmpty();
        assertThat(detector.detect(input(10, 10, 10, 10), EnumSet.of(DetectionMethod.COMBINED))).isEmpty();
    }

    @Test
    @DisplayName("Should include the threshold method once bounds are configured")
    void shouldUseThresholdWhenConfigured() {
        DetectionConfig config = new DetectionConfig();
        config.setThresholdMax(100.0);
        AnomalyDetector bounded = new AnomalyDetector(config);

        AnomalyResult result = bounded.detect(input(SPIKE), EnumSet.of(DetectionMethod.COMBINED)).get(0);

        assertThat(result.getEvidence()).extracting(AnomalyEvidence::getMethod)
                .contains(DetectionMethod.THRESHOLD);
        assertThat(result.maxSeverity()).isEqualTo(Severity.HIGH);
        assertThat(result.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should merge findings for the same point within the tolerance")
    void shouldMergeFindingsWithinTolerance() {
        Instant t = T0.plusSeconds(2);
        Map<DetectionMethod, DetectionMethodStrategy> strategies = Map.of(
                DetectionMethod.ZSCORE, fixed(DetectionMethod.ZSCORE, 2, t, 5.0),
                DetectionMethod.IQR, fixed(DetectionMethod.IQR, 3, t.plusMillis(500), 5.0));
        Set<DetectionMethod> both = EnumSet.of(DetectionMethod.ZSCORE, DetectionMethod.IQR);

        AnomalyDetector tolerant = new AnomalyDetector(strategies, VotingPolicy.majority(), both,
                Duration.ofSeconds(1));
        AnomalyDetector strict = new AnomalyDetector(strategies, VotingPolicy.majority(), both, Duration.ZERO);
        DetectionInput series = input(1, 2, 5, 5);

        assertThat(tolerant.detect(series, both)).singleElement()
                .satisfies(r -> assertThat(r.getEvidence()).hasSize(2));
        assertThat(strict.detect(series, both)).hasSize(2)
                .allSatisfy(r -> assertThat(r.isAnomaly()).isFalse());
    }

    @Test
    @DisplayName("Should detect a closed window with the configured methods")
    void shouldDetectWindow() {
        MetricKey key = MetricKey.of("latency", Map.of("host", "web-1"));
        List<Observation> elements = new ArrayList<>();
        for (int i = 0; i < SPIKE.length; i++) {
            elements.add(Observation.of("latency", SPIKE[i], key.getTags(), T0.plusSeconds(i)));
        }
        Window window = new Window(WindowType.TUMBLING, key, T0, T0.plusSeconds(60), 0, elements);

        assertThat(detector.detectWindow(window)).singleElement()
                .satisfies(r -> assertThat(r.getWindowId()).isEqualTo(window.getId()));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionMethodStrategy fixed(DetectionMethod method, int index, Instant ts, double value) {
        return new DetectionMethodStrategy() {
            @Override
            public DetectionMethod method() {
                return method;
            }

            @Override
            public List<MethodFinding> apply(DetectionInput input) {
                return List.of(new MethodFinding(index, ts, value,
                        new AnomalyEvidence(method, 0.8, true, Severity.MEDIUM, 3.0, "fixed")));
            }
        };
    }
}
