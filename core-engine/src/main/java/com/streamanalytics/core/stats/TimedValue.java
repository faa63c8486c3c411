package com.streamanalytics.core.stats;

import java.time.Instant;
import java.util.Objects;

/**
 * A value paired with its event time.
 *
 * @since 1.0.0
 */
public final class TimedValue {

    private final Instant timestamp;
    private final double value;

    public TimedValue(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimedValue that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return value + "@" + timestamp;
    }
}
