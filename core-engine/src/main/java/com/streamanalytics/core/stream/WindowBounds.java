package com.streamanalytics.core.stream;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)} of a window.
 *
 * @since 1.0.0
 */
public final class WindowBounds {

    private final Instant start;
    private final Instant end;

    public WindowBounds(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start " + start + " must be before end " + end);
        }
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowBounds that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
