package com.streamanalytics.core.stream;

import com.streamanalytics.core.model.WindowType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Overlapping windows of length {@code size} starting every {@code slide}.
 * The slide is shorter than the size, so windows always overlap. A timestamp
 * belongs to {@code size / slide} windows when size is a multiple of slide.
 *
 * @since 1.0.0
 */
public final class SlidingWindowAssigner implements WindowAssigner {

    private final long sizeMillis;
    private final long slideMillis;

    public SlidingWindowAssigner(Duration size, Duration slide) {
        this.sizeMillis = size.toMillis();
        this.slideMillis = slide.toMillis();
        if (slideMillis < 1 || sizeMillis <= slideMillis) {
            throw new IllegalArgumentException(
                    "Sliding windows need 1 ms <= slide < size, got size=" + size + " slide=" + slide);
        }
    }

    @Override
    public List<WindowBounds> assign(Instant timestamp) {
        long ts = timestamp.toEpochMilli();
        long lastStart = Math.floorDiv(ts, slideMillis) * slideMillis;
        List<WindowBounds> windows = new ArrayList<>();
        for (long start = lastStart; start > ts - sizeMillis; start -= slideMillis) {
            windows.add(new WindowBounds(Instant.ofEpochMilli(start), Instant.ofEpochMilli(start + sizeMillis)));
        }
        Collections.reverse(windows);
        return windows;
    }

    @Override
    public WindowType type() {
        return WindowType.SLIDING;
    }
}
