package com.streamanalytics.core.config;

import com.streamanalytics.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the engine configuration tree.
 *
 * <p>
 * Expected YAML structure (every section and key is optional; omitted values
 * take the defaults shown):
 * </p>
 *
 * <pre>
 * bus:
 *   workerThreads: 4
 * collector:
 *   batchSize: 100
 *   flushIntervalMillis: 5000
 * window:
 *   type: TUMBLING
 *   sizeSeconds: 60
 *   gracePeriodSeconds: 5
 * detection:
 *   methods: [COMBINED]
 * storage:
 *   backend: MEMORY
 * retention:
 *   retentionDays: 90
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading or building programmatically.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private EventBusConfig bus = new EventBusConfig();
    private CollectorConfig collector = new CollectorConfig();
    private WindowConfig window = new WindowConfig();
    private DetectionConfig detection = new DetectionConfig();
    private StorageConfig storage = new StorageConfig();
    private RetentionConfig retention = new RetentionConfig();

    /**
     * Validate every section. Collects all errors and throws a single
     * exception listing them.
     *
     * @throws ConfigurationException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        bus.collectErrors(errors);
        collector.collectErrors(errors);
        window.collectErrors(errors);
        detection.collectErrors(errors);
        storage.collectErrors(errors);
        retention.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (null sections fall back to defaults)
    // ---------------------------------------------------------------

    public EventBusConfig getBus() {
        return bus;
    }

    public void setBus(EventBusConfig bus) {
        this.bus = bus != null ? bus : new EventBusConfig();
    }

    public CollectorConfig getCollector() {
        return collector;
    }

    public void setCollector(CollectorConfig collector) {
        this.collector = collector != null ? collector : new CollectorConfig();
    }

    public WindowConfig getWindow() {
        return window;
    }

    public void setWindow(WindowConfig window) {
        this.window = window != null ? window : new WindowConfig();
    }

    public DetectionConfig getDetection() {
        return detection;
    }

    public void setDetection(DetectionConfig detection) {
        this.detection = detection != null ? detection : new DetectionConfig();
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage != null ? storage : new StorageConfig();
    }

    public RetentionConfig getRetention() {
        return retention;
    }

    public void setRetention(RetentionConfig retention) {
        this.retention = retention != null ? retention : new RetentionConfig();
    }

    @Override
    public String toString() {
        return "EngineConfig{" + bus + ", " + collector + ", " + window + ", "
                + detection + ", " + storage + ", " + retention + '}';
    }
}
