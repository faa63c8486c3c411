package com.streamanalytics.core.stream;

import com.streamanalytics.core.model.WindowType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fixed, non-overlapping windows aligned to the epoch:
 * {@code start = floor(ts / size) × size}.
 *
 * @since 1.0.0
 */
public final class TumblingWindowAssigner implements WindowAssigner {

    private final long sizeMillis;

    public TumblingWindowAssigner(Duration size) {
        this.sizeMillis = size.toMillis();
        if (sizeMillis < 1) {
            throw new IllegalArgumentException("Window size must be >= 1 ms, got: " + size);
        }
    }

    @Override
    public List<WindowBounds> assign(Instant timestamp) {
        long start = Math.floorDiv(timestamp.toEpochMilli(), sizeMillis) * sizeMillis;
        return List.of(new WindowBounds(Instant.ofEpochMilli(start), Instant.ofEpochMilli(start + sizeMillis)));
    }

    @Override
    public WindowType type() {
        return WindowType.TUMBLING;
    }
}
