package com.streamanalytics.core.detection;

import com.streamanalytics.core.model.AnomalyEvidence;
import com.streamanalytics.core.model.DetectionMethod;
import com.streamanalytics.core.stats.Outlier;
import com.streamanalytics.core.stats.StatisticalAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Flags points whose z-score {@code |v - mean| / σ} exceeds the threshold.
 *
 * <p>
 * Severity: {@code z < 3} LOW, {@code z < 5} MEDIUM, otherwise HIGH. The score
 * is {@code min(z / 5, 1)}. A constant series flags nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreMethod implements DetectionMethodStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreMethod.class);

    private final double threshold;

    public ZScoreMethod(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public List<MethodFinding> apply(DetectionInput input) {
        List<Outlier> outliers = StatisticalAnalyzer.zScoreOutliers(input.values(), threshold);
        LOG.trace("z-score over {} point(s) of {}: {} outlier(s)", input.size(), input.getMetricName(),
                outliers.size());
        return outliers.stream()
                .map(o -> new MethodFinding(o.getIndex(), input.getPoints().get(o.getIndex()).getTimestamp(),
                        o.getValue(), new AnomalyEvidence(DetectionMethod.ZSCORE,
                                Severities.score(o.getDeviation(), 5.0), true,
                                Severities.classify(o.getDeviation(), 3.0, 5.0), o.getDeviation(),
                                String.format(Locale.ROOT, "z=%.3f > %.2f", o.getDeviation(), threshold))))
                .toList();
    }

    public double getThreshold() {
        return threshold;
    }
}
