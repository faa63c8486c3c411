package com.streamanalytics.core.stream;

import com.streamanalytics.core.model.Window;

/**
 * Synchronous callback run by the {@link StreamProcessor} for each sealed
 * window, before {@code WINDOW_CLOSED} is published.
 *
 * <p>
 * Listeners run on the thread that closed the window, outside the window
 * table lock. An exception is logged and counted and does not stop the
 * remaining listeners.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface WindowListener {

    void onWindowClosed(Window window);
}
