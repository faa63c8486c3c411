package com.streamanalytics.core.config;

/**
 * Storage implementation selected by {@link StorageConfig#getBackend()}.
 *
 * @since 1.0.0
 */
public enum StorageBackend {

    /** Bounded in-process store, lost on restart. */
    MEMORY,

    /** JDBC store with per-day partition tables. */
    DURABLE,

    /** Caffeine read-through cache in front of {@link StorageConfig#getCacheDelegate()}. */
    CACHED
}
