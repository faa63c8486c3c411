package com.streamanalytics.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * One detection method's finding for one point.
 *
 * <p>
 * {@code score} is the method's confidence normalised to {@code [0, 1]};
 * {@code deviation} is the raw magnitude in the method's own unit (sigmas for
 * z-score and change-point, IQR widths for IQR, fraction of the bound span for
 * threshold).
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvidence {

    private final DetectionMethod method;
    private final double score;
    private final boolean anomaly;
    private final Severity severity;
    private final double deviation;
    private final String detail;

    @JsonCreator
    public AnomalyEvidence(
            @JsonProperty("method") DetectionMethod method,
            @JsonProperty("score") double score,
            @JsonProperty("anomaly") boolean anomaly,
            @JsonProperty("severity") Severity severity,
            @JsonProperty("deviation") double deviation,
            @JsonProperty("detail") String detail) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
        this.score = score;
        this.anomaly = anomaly;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.deviation = deviation;
        this.detail = detail != null ? detail : "";
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getDeviation() {
        return deviation;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvidence that))
            return false;
        return Double.compare(score, that.score) == 0
                && anomaly == that.anomaly
                && Double.compare(deviation, that.deviation) == 0
                && method == that.method
                && severity == that.severity
                && detail.equals(that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, score, anomaly, severity, deviation, detail);
    }

    @Override
    public String toString() {
        return method + "{score=" + String.format(Locale.ROOT, "%.3f", score) + ", severity=" + severity + '}';
    }
}
