package com.streamanalytics.core.stream;

import com.streamanalytics.core.model.WindowType;

import java.time.Instant;
import java.util.List;

/**
 * Maps an event time to the fixed-boundary windows it belongs to.
 *
 * <p>
 * Session windows have data-dependent boundaries and are handled by the
 * {@link StreamProcessor} directly.
 * </p>
 *
 * @since 1.0.0
 */
public interface WindowAssigner {

    /**
     * @param timestamp event time
     * @return windows containing {@code timestamp}, earliest start first
     */
    List<WindowBounds> assign(Instant timestamp);

    WindowType type();
}
