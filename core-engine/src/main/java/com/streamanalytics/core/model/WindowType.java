package com.streamanalytics.core.model;

/**
 * Windowing strategy.
 *
 * @since 1.0.0
 */
public enum WindowType {
    TUMBLING,
    SLIDING,
    SESSION
}
