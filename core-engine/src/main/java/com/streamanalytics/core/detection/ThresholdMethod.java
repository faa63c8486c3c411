package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.model.Severity;
import com.streamanalytics.core.stats.TimedValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static bound detector.
 *
 * <p>
 * Flags values below {@code min} or above {@code max}; either bound may be
 * absent. The excursion is measured relative to the bound span
 * ({@code max - min}, or the magnitude of the single bound): {@code < 10%}
 * LOW, {@code < 50%} MEDIUM, otherwise HIGH. The score reaches {@code 1} at
 * 50%. This is a <strong>stateless</strong> detector and is skipped when no
 * bound is configured.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdMethod implements DetectionMethodStrategy {

    private final Double min;
    private final Double max;
    private final double span;

    public ThresholdMethod(Double min, Double max) {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("threshold min " + min + " must be <= max " + max);
        }
        this.min = min;
        this.max = max;
        this.span = resolveSpan(min, max);
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.THRESHOLD;
    }

    @Override
    public boolean isApplicable(DetectionInput input) {
        return (min != null || max != null) && !input.isEmpty();
    }

    @Override
    public List<MethodFinding> apply(DetectionInput input) {
        List<MethodFinding> findings = new ArrayList<>();
        List<TimedValue> points = input.getPoints();
        for (int i = 0; i < points.size(); i++) {
            double v = points.get(i).getValue();
            double excursion;
            String detail;
            if (min != null && v < min) {
                excursion = min - v;
                detail = String.format(Locale.ROOT, "%.3f below min %.3f", v, min);
            } else if (max != null && v > max) {
                excursion = v - max;
                detail = String.format(Locale.ROOT, "%.3f above max %.3f", v, max);
            } else {
                continue;
            }
            double ratio = excursion / span;
            Severity severity = Severities.classify(ratio, 0.10, 0.50);
            findings.add(new MethodFinding(i, points.get(i).getTimestamp(), v,
                    new AnomalyEvidence(DetectionMethod.THRESHOLD, Severities.score(ratio, 0.50), true,
                            severity, ratio, detail)));
        }
        return findings;
    }

    private static double resolveSpan(Double min, Double max) {
        double span;
        if (min != null && max != null) {
            span = max - min;
        } else if (max != null) {
            span = Math.abs(max);
        } else if (min != null) {
            span = Math.abs(min);
        } else {
            span = 1.0;
        }
        return span > 0 ? span : 1.0;
    }
}
