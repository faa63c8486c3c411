package com.streamanalytics.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of anomaly detection for one point of one series.
 *
 * <p>
 * Carries one {@link AnomalyEvidence} entry per method that examined the
 * point, the weighted {@code combinedConfidence} in {@code [0, 1]}, and the
 * vote outcome {@code anomaly}. Evidence is kept ordered by method.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AnomalyResult.Builder.class)
public final class AnomalyResult implements EventPayload {

    private final String metricName;
    private final Map<String, String> tags;
    private final String windowId;
    private final Instant timestamp;
    private final double value;
    private final Set<AnomalyEvidence> evidence;
    private final double combinedConfidence;
    private final boolean anomaly;

    private AnomalyResult(Builder b) {
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.tags = b.tags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.tags))
                : Map.of();
        this.windowId = b.windowId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.value = b.value;
        Set<AnomalyEvidence> ordered = new LinkedHashSet<>();
        b.evidence.stream()
                .sorted(Comparator.comparing(AnomalyEvidence::getMethod))
                .forEach(ordered::add);
        this.evidence = Collections.unmodifiableSet(ordered);
        if (b.combinedConfidence < 0.0 || b.combinedConfidence > 1.0) {
            throw new IllegalArgumentException(
                    "combinedConfidence must be in [0, 1], got: " + b.combinedConfidence);
        }
        this.combinedConfidence = b.combinedConfidence;
        this.anomaly = b.anomaly;
    }

    public static Builder builder() {
        return new Builder();
    }

    public MetricKey seriesKey() {
        return MetricKey.of(metricName, tags);
    }

    /**
     * @return the evidence entry of the given method, if that method ran
     */
    public Optional<AnomalyEvidence> evidenceFor(DetectionMethod method) {
        return evidence.stream().filter(e -> e.getMethod() == method).findFirst();
    }

    /**
     * @return the highest severity among evidence entries that flagged the
     *         point, or {@link Severity#LOW} if none did
     */
    public Severity maxSeverity() {
        return evidence.stream()
                .filter(AnomalyEvidence::isAnomaly)
                .map(AnomalyEvidence::getSeverity)
                .max(Comparator.naturalOrder())
                .orElse(Severity.LOW);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public String getWindowId() {
        return windowId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public Set<AnomalyEvidence> getEvidence() {
        return evidence;
    }

    public double getCombinedConfidence() {
        return combinedConfidence;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String metricName;
        private Map<String, String> tags;
        private String windowId;
        private Instant timestamp;
        private double value;
        private final Set<AnomalyEvidence> evidence = new LinkedHashSet<>();
        private double combinedConfidence;
        private boolean anomaly;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder windowId(String windowId) {
            this.windowId = windowId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder evidence(Collection<AnomalyEvidence> evidence) {
            this.evidence.clear();
            if (evidence != null) {
                this.evidence.addAll(evidence);
            }
            return this;
        }

        public Builder addEvidence(AnomalyEvidence evidence) {
            this.evidence.add(Objects.requireNonNull(evidence, "evidence must not be null"));
            return this;
        }

        public Builder combinedConfidence(double combinedConfidence) {
            this.combinedConfidence = combinedConfidence;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public AnomalyResult build() {
            return new AnomalyResult(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyResult that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(combinedConfidence, that.combinedConfidence) == 0
                && anomaly == that.anomaly
                && metricName.equals(that.metricName)
                && tags.equals(that.tags)
                && Objects.equals(windowId, that.windowId)
                && timestamp.equals(that.timestamp)
                && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, tags, windowId, timestamp, value, combinedConfidence, anomaly);
    }

    @Override
    public String toString() {
        return "AnomalyResult{" + seriesKey()
                + ", timestamp=" + timestamp
                + ", value=" + value
                + ", confidence=" + String.format(Locale.ROOT, "%.3f", combinedConfidence)
                + ", anomaly=" + anomaly
                + ", evidence=" + evidence
                + '}';
    }
}
