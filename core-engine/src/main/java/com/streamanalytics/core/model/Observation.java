package com.streamanalytics.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.streamanalytics.core.error.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single raw measurement: metric name, numeric value, tags and the event
 * time at which it was taken.
 *
 * <h3>Validation</h3>
 * <p>
 * Instances are validated at construction. A blank name, a {@code NaN} or
 * infinite value, or a missing timestamp is rejected with a
 * {@link ValidationException}; a malformed observation never enters the
 * pipeline.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = Observation.Builder.class)
public final class Observation implements EventPayload {

    private final String name;
    private final double value;
    private final Map<String, String> tags;
    private final Instant timestamp;
    private final MetricType type;

    private Observation(Builder b) {
        if (b.name == null || b.name.isBlank()) {
            throw new ValidationException("Observation name must not be null or blank");
        }
        if (Double.isNaN(b.value) || Double.isInfinite(b.value)) {
            throw new ValidationException(
                    "Observation value for '" + b.name + "' must be finite, got: " + b.value);
        }
        if (b.timestamp == null) {
            throw new ValidationException("Observation timestamp for '" + b.name + "' must not be null");
        }
        this.name = b.name;
        this.value = b.value;
        this.tags = b.tags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.tags))
                : Map.of();
        this.timestamp = b.timestamp;
        this.type = b.type != null ? b.type : MetricType.GAUGE;
    }

    /**
     * Shorthand for a gauge observation.
     *
     * @throws ValidationException if any argument is invalid
     */
    public static Observation of(String name, double value, Map<String, String> tags, Instant timestamp) {
        return builder().name(name).value(value).tags(tags).timestamp(timestamp).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the series this observation belongs to
     */
    public MetricKey seriesKey() {
        return MetricKey.of(name, tags);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MetricType getType() {
        return type;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@link #build()} validates.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String name;
        private double value;
        private Map<String, String> tags;
        private Instant timestamp;
        private MetricType type;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder type(MetricType type) {
            this.type = type;
            return this;
        }

        /**
         * @return a validated observation
         * @throws ValidationException if name, value or timestamp is invalid
         */
        public Observation build() {
            return new Observation(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return Double.compare(value, that.value) == 0
                && name.equals(that.name)
                && tags.equals(that.tags)
                && timestamp.equals(that.timestamp)
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, tags, timestamp, type);
    }

    @Override
    public String toString() {
        return "Observation{" + seriesKey() + "=" + value + " @" + timestamp + '}';
    }
}
