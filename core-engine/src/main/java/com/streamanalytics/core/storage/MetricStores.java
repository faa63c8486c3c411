package com.streamanalytics.core.storage;

import com.streamanalytics.core.config.StorageBackend;
import com.streamanalytics.core.config.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates a {@link MetricStore} from {@link StorageConfig}.
 *
 * @since 1.0.0
 */
public final class MetricStores {

    private static final Logger LOG = LoggerFactory.getLogger(MetricStores.class);

    private MetricStores() {
        // utility class — not instantiable
    }

    /**
     * @param config storage configuration; must not be {@code null}
     * @return a store for the configured backend
     * @throws IllegalArgumentException if a cached store is asked to wrap
     *                                  another cached store
     */
    public static MetricStore create(StorageConfig config) {
        Objects.requireNonNull(config, "StorageConfig must not be null");
        LOG.info("Creating {} metric store", config.getBackend());
        return switch (config.getBackend()) {
            case MEMORY -> new InMemoryMetricStore(config.getMaxRecords());
            case DURABLE -> JdbcMetricStore.create(config);
            case CACHED -> new CachedMetricStore(createDelegate(config), config.cacheTtl(),
                    config.getCacheMaxEntries());
        };
    }

    private static MetricStore createDelegate(StorageConfig config) {
        StorageBackend delegate = config.getCacheDelegate();
        return switch (delegate) {
            case MEMORY -> new InMemoryMetricStore(config.getMaxRecords());
            case DURABLE -> JdbcMetricStore.create(config);
            case CACHED -> throw new IllegalArgumentException(
                    "A cached store cannot wrap another cached store");
        };
    }
}
