package com.streamanalytics.core.config;

import com.streamanalytics.core.model.WindowType;

import java.time.Duration;
import java.util.List;

/**
 * Stream windowing settings.
 *
 * <h3>Grace period</h3>
 * <p>
 * A closed window is remembered for {@code gracePeriodSeconds} (default 5)
 * past its end. Late observations that arrive in that interval reopen it;
 * later ones are dropped and counted.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowConfig {

    private WindowType type = WindowType.TUMBLING;
    private long sizeSeconds = 60;
    private long slideSeconds = 10;
    private long sessionGapSeconds = 300;
    private long gracePeriodSeconds = 5;
    private int maxOpenWindows = 10_000;
    private long tickIntervalMillis = 1_000;

    public Duration size() {
        return Duration.ofSeconds(sizeSeconds);
    }

    public Duration slide() {
        return Duration.ofSeconds(slideSeconds);
    }

    public Duration sessionGap() {
        return Duration.ofSeconds(sessionGapSeconds);
    }

    public Duration gracePeriod() {
        return Duration.ofSeconds(gracePeriodSeconds);
    }

    public Duration tickInterval() {
        return Duration.ofMillis(tickIntervalMillis);
    }

    void collectErrors(List<String> errors) {
        if (type == null) {
            errors.add("window.type is required");
        }
        if (sizeSeconds < 1) {
            errors.add("window.sizeSeconds must be >= 1, got: " + sizeSeconds);
        }
        if (type == WindowType.SLIDING && (slideSeconds < 1 || slideSeconds >= sizeSeconds)) {
            errors.add("window.slideSeconds must be in [1, sizeSeconds), got: " + slideSeconds);
        }
        if (type == WindowType.SESSION && sessionGapSeconds < 1) {
            errors.add("window.sessionGapSeconds must be >= 1, got: " + sessionGapSeconds);
        }
        if (gracePeriodSeconds < 0) {
            errors.add("window.gracePeriodSeconds must be >= 0, got: " + gracePeriodSeconds);
        }
        if (maxOpenWindows < 1) {
            errors.add("window.maxOpenWindows must be >= 1, got: " + maxOpenWindows);
        }
        if (tickIntervalMillis < 1) {
            errors.add("window.tickIntervalMillis must be >= 1, got: " + tickIntervalMillis);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public WindowType getType() {
        return type;
    }

    public void setType(WindowType type) {
        this.type = type;
    }

    public long getSizeSeconds() {
        return sizeSeconds;
    }

    public void setSizeSeconds(long sizeSeconds) {
        this.sizeSeconds = sizeSeconds;
    }

    public long getSlideSeconds() {
        return slideSeconds;
    }

    public void setSlideSeconds(long slideSeconds) {
        this.slideSeconds = slideSeconds;
    }

    public long getSessionGapSeconds() {
        return sessionGapSeconds;
    }

    public void setSessionGapSeconds(long sessionGapSeconds) {
        this.sessionGapSeconds = sessionGapSeconds;
    }

    public long getGracePeriodSeconds() {
        return gracePeriodSeconds;
    }

    public void setGracePeriodSeconds(long gracePeriodSeconds) {
        this.gracePeriodSeconds = gracePeriodSeconds;
    }

    public int getMaxOpenWindows() {
        return maxOpenWindows;
    }

    public void setMaxOpenWindows(int maxOpenWindows) {
        this.maxOpenWindows = maxOpenWindows;
    }

    public long getTickIntervalMillis() {
        return tickIntervalMillis;
    }

    public void setTickIntervalMillis(long tickIntervalMillis) {
        this.tickIntervalMillis = tickIntervalMillis;
    }

    @Override
    public String toString() {
        return "WindowConfig{type=" + type
                + ", sizeSeconds=" + sizeSeconds
                + ", slideSeconds=" + slideSeconds
                + ", sessionGapSeconds=" + sessionGapSeconds
                + ", gracePeriodSeconds=" + gracePeriodSeconds
                + ", maxOpenWindows=" + maxOpenWindows + '}';
    }
}
