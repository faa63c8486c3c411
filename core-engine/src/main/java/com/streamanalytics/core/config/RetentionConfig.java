package com.streamanalytics.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Data retention settings. Records older than {@code retentionDays} are
 * removed every {@code sweepIntervalMinutes}.
 *
 * @since 1.0.0
 */
public class RetentionConfig {

    private boolean enabled = true;
    private int retentionDays = 90;
    private long sweepIntervalMinutes = 60;

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    public Duration sweepInterval() {
        return Duration.ofMinutes(sweepIntervalMinutes);
    }

    void collectErrors(List<String> errors) {
        if (retentionDays < 1) {
            errors.add("retention.retentionDays must be >= 1, got: " + retentionDays);
        }
        if (sweepIntervalMinutes < 1) {
            errors.add("retention.sweepIntervalMinutes must be >= 1, got: " + sweepIntervalMinutes);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public long getSweepIntervalMinutes() {
        return sweepIntervalMinutes;
    }

    public void setSweepIntervalMinutes(long sweepIntervalMinutes) {
        this.sweepIntervalMinutes = sweepIntervalMinutes;
    }

    @Override
    public String toString() {
        return "RetentionConfig{enabled=" + enabled
                + ", retentionDays=" + retentionDays
                + ", sweepIntervalMinutes=" + sweepIntervalMinutes + '}';
    }
}
