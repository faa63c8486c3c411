package com.streamanalytics.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Event bus settings.
 *
 * <pre>
 * bus:
 *   workerThreads: 4
 *   queueCapacity: 10000
 *   dedupMaxEntries: 100000
 *   dedupHorizonSeconds: 300
 * </pre>
 *
 * @since 1.0.0
 */
public class EventBusConfig {

    private int workerThreads = 4;
    private int queueCapacity = 10_000;
    private int dedupMaxEntries = 100_000;
    private long dedupHorizonSeconds = 300;
    private long shutdownTimeoutSeconds = 5;

    public Duration dedupHorizon() {
        return Duration.ofSeconds(dedupHorizonSeconds);
    }

    public Duration shutdownTimeout() {
        return Duration.ofSeconds(shutdownTimeoutSeconds);
    }

    void collectErrors(List<String> errors) {
        if (workerThreads < 1) {
            errors.add("bus.workerThreads must be >= 1, got: " + workerThreads);
        }
        if (queueCapacity < 1) {
            errors.add("bus.queueCapacity must be >= 1, got: " + queueCapacity);
        }
        if (dedupMaxEntries < 1) {
            errors.add("bus.dedupMaxEntries must be >= 1, got: " + dedupMaxEntries);
        }
        if (dedupHorizonSeconds < 1) {
            errors.add("bus.dedupHorizonSeconds must be >= 1, got: " + dedupHorizonSeconds);
        }
        if (shutdownTimeoutSeconds < 0) {
            errors.add("bus.shutdownTimeoutSeconds must be >= 0, got: " + shutdownTimeoutSeconds);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getDedupMaxEntries() {
        return dedupMaxEntries;
    }

    public void setDedupMaxEntries(int dedupMaxEntries) {
        this.dedupMaxEntries = dedupMaxEntries;
    }

    public long getDedupHorizonSeconds() {
        return dedupHorizonSeconds;
    }

    public void setDedupHorizonSeconds(long dedupHorizonSeconds) {
        this.dedupHorizonSeconds = dedupHorizonSeconds;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "EventBusConfig{workerThreads=" + workerThreads
                + ", queueCapacity=" + queueCapacity
                + ", dedupMaxEntries=" + dedupMaxEntries
                + ", dedupHorizonSeconds=" + dedupHorizonSeconds + '}';
    }
}
