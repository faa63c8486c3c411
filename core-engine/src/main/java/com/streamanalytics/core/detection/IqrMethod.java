package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.stats.StatisticalAnalyzer;

import java.util.List;
import java.util.Locale;

/**
 * Flags points outside {@code [Q1 - k·IQR, Q3 + k·IQR]}.
 *
 * <p>
 * The deviation is the distance beyond the fence in IQR units. Severity:
 * {@code < 1.5} LOW, {@code < 3} MEDIUM, otherwise HIGH. The score is
 * {@code min(distance / 5, 1)}.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrMethod implements DetectionMethodStrategy {

    private final double multiplier;

    public IqrMethod(double multiplier) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("IQR multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }

    @Override
    public List<MethodFinding> apply(DetectionInput input) {
        return StatisticalAnalyzer.iqrOutliers(input.values(), multiplier).stream()
                .map(o -> new MethodFinding(o.getIndex(), input.getPoints().get(o.getIndex()).getTimestamp(),
                        o.getValue(), new AnomalyEvidence(DetectionMethod.IQR,
                                Severities.score(o.getDeviation(), 5.0), true,
                                Severities.classify(o.getDeviation(), 1.5, 3.0), o.getDeviation(),
                                String.format(Locale.ROOT, "%.3f IQR beyond the %.2f×IQR fence",
                                        o.getDeviation(), multiplier))))
                .toList();
    }

    public double getMultiplier() {
        return multiplier;
    }
}
