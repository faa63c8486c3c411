package com.streamanalytics.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Summary statistics for one metric series over one window or flush batch.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code count >= 1}</li>
 * <li>{@code min <= median <= p95 <= p99 <= max}</li>
 * </ul>
 * <p>
 * Both are checked by {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AggregateResult.Builder.class)
public final class AggregateResult implements EventPayload {

    private final String metricName;
    private final Map<String, String> tags;
    private final AggregationLevel level;
    private final String windowId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double median;
    private final double stddev;
    private final double p95;
    private final double p99;
    private final double sum;

    private AggregateResult(Builder b) {
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.tags = b.tags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.tags))
                : Map.of();
        this.level = Objects.requireNonNull(b.level, "level must not be null");
        this.windowId = b.windowId;
        this.windowStart = Objects.requireNonNull(b.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        this.count = b.count;
        this.min = b.min;
        this.max = b.max;
        this.mean = b.mean;
        this.median = b.median;
        this.stddev = b.stddev;
        this.p95 = b.p95;
        this.p99 = b.p99;
        this.sum = b.sum;

        if (count < 1) {
            throw new IllegalStateException("Aggregate count must be >= 1, got: " + count);
        }
        if (!(min <= median && median <= p95 && p95 <= p99 && p99 <= max)) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "Aggregate ordering violated for %s: min=%s median=%s p95=%s p99=%s max=%s",
                    metricName, min, median, p95, p99, max));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public MetricKey seriesKey() {
        return MetricKey.of(metricName, tags);
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

    public AggregationLevel getLevel() {
        return level;
    }

    public String getWindowId() {
        return windowId;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public long getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStddev() {
        return stddev;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public double getSum() {
        return sum;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String metricName;
        private Map<String, String> tags;
        private AggregationLevel level = AggregationLevel.WINDOW;
        private String windowId;
        private Instant windowStart;
        private Instant windowEnd;
        private long count;
        private double min;
        private double max;
        private double mean;
        private double median;
        private double stddev;
        private double p95;
        private double p99;
        private double sum;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder level(AggregationLevel level) {
            this.level = level;
            return this;
        }

        public Builder windowId(String windowId) {
            this.windowId = windowId;
            return this;
        }

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(Instant windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder count(long count) {
            this.count = count;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder median(double median) {
            this.median = median;
            return this;
        }

        public Builder stddev(double stddev) {
            this.stddev = stddev;
            return this;
        }

        public Builder p95(double p95) {
            this.p95 = p95;
            return this;
        }

        public Builder p99(double p99) {
            this.p99 = p99;
            return this;
        }

        public Builder sum(double sum) {
            this.sum = sum;
            return this;
        }

        /**
         * @return the aggregate
         * @throws NullPointerException  if a required field is missing
         * @throws IllegalStateException if count or ordering invariants fail
         */
        public AggregateResult build() {
            return new AggregateResult(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregateResult that))
            return false;
        return count == that.count
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(stddev, that.stddev) == 0
                && Double.compare(p95, that.p95) == 0
                && Double.compare(p99, that.p99) == 0
                && Double.compare(sum, that.sum) == 0
                && metricName.equals(that.metricName)
                && tags.equals(that.tags)
                && level == that.level
                && Objects.equals(windowId, that.windowId)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, tags, level, windowId, windowStart, windowEnd, count, mean);
    }

    @Override
    public String toString() {
        return "AggregateResult{" + seriesKey()
                + ", level=" + level
                + ", window=[" + windowStart + ", " + windowEnd + ")"
                + ", count=" + count
                + ", mean=" + mean
                + ", p99=" + p99
                + '}';
    }
}
