package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.stats.StatisticalAnalyzer;
import com.streamanalytics.core.stats.TimedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Detects a level shift between the first and second half of the series.
 *
 * <p>
 * The shift {@code |mean(second) - mean(first)|} is measured in standard
 * deviations of the whole sample. When it exceeds {@code sigmas} the first
 * point of the second half is flagged. Severity: {@code < 3} LOW,
 * {@code < 5} MEDIUM, otherwise HIGH.
 * </p>
 *
 * <h3>Sample size</h3>
 * <p>
 * At least {@value #MIN_POINTS} points are needed; shorter series are not
 * evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointMethod implements DetectionMethodStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointMethod.class);

    static final int MIN_POINTS = 4;

    private final double sigmas;

    public ChangePointMethod(double sigmas) {
        if (sigmas <= 0) {
            throw new IllegalArgumentException("change-point sigmas must be > 0, got: " + sigmas);
        }
        this.sigmas = sigmas;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.CHANGE_POINT;
    }

    @Override
    public boolean isApplicable(DetectionInput input) {
        return input.size() >= MIN_POINTS;
    }

    @Override
    public List<MethodFinding> apply(DetectionInput input) {
        double[] values = input.values();
        int split = values.length / 2;
        double sd = StatisticalAnalyzer.stddev(values);
        if (sd == 0.0) {
            return List.of();
        }
        double before = StatisticalAnalyzer.mean(Arrays.copyOfRange(values, 0, split));
        double after = StatisticalAnalyzer.mean(Arrays.copyOfRange(values, split, values.length));
        double shift = Math.abs(after - before) / sd;
        if (shift <= sigmas) {
            return List.of();
        }
        TimedValue point = input.getPoints().get(split);
        LOG.debug("Change point in {} at {}: mean {} -> {} ({}σ)", input.getMetricName(),
                point.getTimestamp(), before, after, shift);
        return List.of(new MethodFinding(split, point.getTimestamp(), point.getValue(),
                new AnomalyEvidence(DetectionMethod.CHANGE_POINT, Severities.score(shift, 5.0), true,
                        Severities.classify(shift, 3.0, 5.0), shift,
                        String.format(Locale.ROOT, "mean shift %.3f -> %.3f (%.3fσ)", before, after, shift))));
    }

    public double getSigmas() {
        return sigmas;
    }
}
