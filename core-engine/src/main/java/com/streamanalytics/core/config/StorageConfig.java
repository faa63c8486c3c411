package com.streamanalytics.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Storage layer settings: backend choice, JDBC pool, cache and retry policy.
 *
 * @since 1.0.0
 */
public class StorageConfig {

    private StorageBackend backend = StorageBackend.MEMORY;

    // ---------------------------------------------------------------
    // Durable (JDBC)
    // ---------------------------------------------------------------
    private String jdbcUrl;
    private String username;
    private String password;
    private int maxPoolSize = 10;
    private long connectionTimeoutMillis = 30_000;
    private int insertChunkSize = 500;
    private long writeTimeoutMillis = 10_000;

    // ---------------------------------------------------------------
    // In-memory
    // ---------------------------------------------------------------
    private int maxRecords = 1_000_000;

    // ---------------------------------------------------------------
    // Cache
    // ---------------------------------------------------------------
    private StorageBackend cacheDelegate = StorageBackend.DURABLE;
    private long cacheTtlSeconds = 300;
    private long cacheMaxEntries = 10_000;

    // ---------------------------------------------------------------
    // Retry
    // ---------------------------------------------------------------
    private int retryMaxAttempts = 3;
    private long retryInitialBackoffMillis = 100;
    private long retryMaxBackoffMillis = 2_000;

    public Duration connectionTimeout() {
        return Duration.ofMillis(connectionTimeoutMillis);
    }

    public Duration writeTimeout() {
        return Duration.ofMillis(writeTimeoutMillis);
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    void collectErrors(List<String> errors) {
        if (backend == null) {
            errors.add("storage.backend is required");
            return;
        }
        boolean needsJdbc = backend == StorageBackend.DURABLE
                || (backend == StorageBackend.CACHED && cacheDelegate == StorageBackend.DURABLE);
        if (needsJdbc && (jdbcUrl == null || jdbcUrl.isBlank())) {
            errors.add("storage.jdbcUrl is required for the durable backend");
        }
        if (backend == StorageBackend.CACHED && (cacheDelegate == null || cacheDelegate == StorageBackend.CACHED)) {
            errors.add("storage.cacheDelegate must be MEMORY or DURABLE, got: " + cacheDelegate);
        }
        if (maxPoolSize < 1) {
            errors.add("storage.maxPoolSize must be >= 1, got: " + maxPoolSize);
        }
        if (connectionTimeoutMillis < 250) {
            errors.add("storage.connectionTimeoutMillis must be >= 250, got: " + connectionTimeoutMillis);
        }
        if (insertChunkSize < 1) {
            errors.add("storage.insertChunkSize must be >= 1, got: " + insertChunkSize);
        }
        if (writeTimeoutMillis < 1) {
            errors.add("storage.writeTimeoutMillis must be >= 1, got: " + writeTimeoutMillis);
        }
        if (maxRecords < 1) {
            errors.add("storage.maxRecords must be >= 1, got: " + maxRecords);
        }
        if (cacheTtlSeconds < 1) {
            errors.add("storage.cacheTtlSeconds must be >= 1, got: " + cacheTtlSeconds);
        }
        if (cacheMaxEntries < 1) {
            errors.add("storage.cacheMaxEntries must be >= 1, got: " + cacheMaxEntries);
        }
        if (retryMaxAttempts < 1) {
            errors.add("storage.retryMaxAttempts must be >= 1, got: " + retryMaxAttempts);
        }
        if (retryInitialBackoffMillis < 0 || retryMaxBackoffMillis < retryInitialBackoffMillis) {
            errors.add("storage retry backoff must satisfy 0 <= initial <= max, got: "
                    + retryInitialBackoffMillis + " / " + retryMaxBackoffMillis);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public StorageBackend getBackend() {
        return backend;
    }

    public void setBackend(StorageBackend backend) {
        this.backend = backend;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public long getConnectionTimeoutMillis() {
        return connectionTimeoutMillis;
    }

    public void setConnectionTimeoutMillis(long connectionTimeoutMillis) {
        this.connectionTimeoutMillis = connectionTimeoutMillis;
    }

    public int getInsertChunkSize() {
        return insertChunkSize;
    }

    public void setInsertChunkSize(int insertChunkSize) {
        this.insertChunkSize = insertChunkSize;
    }

    public long getWriteTimeoutMillis() {
        return writeTimeoutMillis;
    }

    public void setWriteTimeoutMillis(long writeTimeoutMillis) {
        this.writeTimeoutMillis = writeTimeoutMillis;
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public StorageBackend getCacheDelegate() {
        return cacheDelegate;
    }

    public void setCacheDelegate(StorageBackend cacheDelegate) {
        this.cacheDelegate = cacheDelegate;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(long cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public void setRetryMaxAttempts(int retryMaxAttempts) {
        this.retryMaxAttempts = retryMaxAttempts;
    }

    public long getRetryInitialBackoffMillis() {
        return retryInitialBackoffMillis;
    }

    public void setRetryInitialBackoffMillis(long retryInitialBackoffMillis) {
        this.retryInitialBackoffMillis = retryInitialBackoffMillis;
    }

    public long getRetryMaxBackoffMillis() {
        return retryMaxBackoffMillis;
    }

    public void setRetryMaxBackoffMillis(long retryMaxBackoffMillis) {
        this.retryMaxBackoffMillis = retryMaxBackoffMillis;
    }

    @Override
    public String toString() {
        // password deliberately omitted
        return "StorageConfig{backend=" + backend
                + ", jdbcUrl='" + jdbcUrl + '\''
                + ", maxPoolSize=" + maxPoolSize
                + ", insertChunkSize=" + insertChunkSize
                + ", cacheDelegate=" + cacheDelegate
                + ", cacheTtlSeconds=" + cacheTtlSeconds
                + ", retryMaxAttempts=" + retryMaxAttempts + '}';
    }
}
