package com.streamanalytics.core.detection;

import com.streamanalytics.core.config.VotingMode;
import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.streamanalytics.core.model.DetectionMethod.CHANGE_POINT;
import static com.streamanalytics.core.model.DetectionMethod.IQR;
import static com.streamanalytics.core.model.DetectionMethod.THRESHOLD;
import static com.streamanalytics.core.model.DetectionMethod.ZSCORE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VotingPolicyTest {

    private static final Set<DetectionMethod> ALL_FOUR = EnumSet.of(ZSCORE, IQR, CHANGE_POINT, THRESHOLD);

    @Test
    @DisplayName("Should require a strict majority of effective methods")
    void shouldRequireStrictMajority() {
        VotingPolicy policy = VotingPolicy.majority();

        assertThat(policy.evaluate(List.of(flag(ZSCORE, 1.0), flag(IQR, 1.0)), ALL_FOUR).isAnomaly())
                .isFalse();
        assertThat(policy.evaluate(List.of(flag(ZSCORE, 1.0), flag(IQR, 1.0), flag(THRESHOLD, 1.0)), ALL_FOUR)
                .isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should average scores over every effective method")
    void shouldAverageScores() {
        VotingPolicy.Verdict verdict = VotingPolicy.majority()
                .evaluate(List.of(flag(ZSCORE, 0.6), flag(IQR, 0.2)), EnumSet.of(ZSCORE, IQR, CHANGE_POINT));

        assertThat(verdict.getConfidence()).isCloseTo(0.8 / 3, within(1e-9));
        assertThat(verdict.getFlaggingMethods()).isEqualTo(2);
        assertThat(verdict.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should compare weighted confidence with the threshold")
    void shouldApplyWeights() {
        VotingPolicy policy = new VotingPolicy(VotingMode.WEIGHTED, 0.4, Map.of(ZSCORE, 2.0, IQR, 0.5));
        Set<DetectionMethod> effective = EnumSet.of(ZSCORE, IQR);

        VotingPolicy.Verdict strong = policy.evaluate(List.of(flag(ZSCORE, 0.5)), effective);
        VotingPolicy.Verdict weak = policy.evaluate(List.of(flag(IQR, 1.0)), effective);

        assertThat(strong.getConfidence()).isCloseTo(0.4, within(1e-9));
        assertThat(strong.isAnomaly()).isTrue();
        assertThat(weak.getConfidence()).isCloseTo(0.2, within(1e-9));
        assertThat(weak.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should ignore evidence from methods outside the vote")
    void shouldIgnoreIneffectiveMethods() {
        VotingPolicy.Verdict verdict = VotingPolicy.majority()
                .evaluate(List.of(flag(THRESHOLD, 1.0)), EnumSet.of(ZSCORE));

        assertThat(verdict.getFlaggingMethods()).isZero();
        assertThat(verdict.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should return a negative verdict when no method took part")
    void shouldHandleEmptyVote() {
        VotingPolicy.Verdict verdict = VotingPolicy.majority()
                .evaluate(List.of(flag(ZSCORE, 1.0)), EnumSet.noneOf(DetectionMethod.class));

        assertThat(verdict.getConfidence()).isZero();
        assertThat(verdict.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should reject a weighted threshold outside [0, 1]")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new VotingPolicy(VotingMode.WEIGHTED, 1.5, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnomalyEvidence flag(DetectionMethod method, double score) {
        return new AnomalyEvidence(method, score, true, Severity.LOW, score, "");
    }
}
