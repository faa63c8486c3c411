package com.streamanalytics.core.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Caffeine cache in front of another {@link MetricStore}.
 *
 * <h3>Caches</h3>
 * <ul>
 * <li><b>Records</b>, keyed by {@link RecordKey}: written through on insert,
 * read through on {@link #find(RecordKey)}.</li>
 * <li><b>Ranges</b>, keyed by {@code (kind, metric, start, end, version)}:
 * read through on {@link #queryRange}. Any write or delete touching a metric
 * invalidates that metric's cached ranges.</li>
 * </ul>
 * <p>
 * Every metric carries a version that is bumped once a write to it has
 * reached the delegate, and {@link #deleteBefore(Instant)} bumps all of them.
 * A range loaded while a write was in flight is cached under the version read
 * before the load, so it is never served after that write returns.
 * </p>
 * <p>
 * Both caches are bounded by {@code maxEntries} and expire entries
 * {@code ttl} after they are written.
 * </p>
 *
 * @since 1.0.0
 */
public class CachedMetricStore implements MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(CachedMetricStore.class);

    private final MetricStore delegate;
    private final Cache<RecordKey, StorageRecord> records;
    private final Cache<RangeKey, List<StorageRecord>> ranges;
    private final ConcurrentMap<String, AtomicLong> versions = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();

    public CachedMetricStore(MetricStore delegate, Duration ttl, long maxEntries) {
        this.delegate = Objects.requireNonNull(delegate, "delegate store must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        this.records = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        this.ranges = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        LOG.info("Initialized metric store caches size={} ttl={} over {}",
                maxEntries, ttl, delegate.getClass().getSimpleName());
    }

    @Override
    public void insertBatch(List<StorageRecord> batch) {
        delegate.insertBatch(batch);
        afterWrite(batch);
    }

    @Override
    public void insertBatch(List<StorageRecord> batch, Duration timeout) {
        delegate.insertBatch(batch, timeout);
        afterWrite(batch);
    }

    @Override
    public List<StorageRecord> queryRange(RecordKind kind, String metricName, Instant start, Instant end) {
        RangeKey key = new RangeKey(kind, metricName, start, end, versionOf(metricName));
        return ranges.get(key, k -> List.copyOf(delegate.queryRange(kind, metricName, start, end)));
    }

    @Override
    public Optional<StorageRecord> find(RecordKey key) {
        return Optional.ofNullable(records.get(key, k -> delegate.find(k).orElse(null)));
    }

    @Override
    public long deleteBefore(Instant cutoff) {
        long removed = delegate.deleteBefore(cutoff);
        if (removed > 0) {
            epoch.incrementAndGet();
            records.invalidateAll();
            ranges.invalidateAll();
        }
        return removed;
    }

    @Override
    public boolean containsMetric(String metricName) {
        return delegate.containsMetric(metricName);
    }

    public CacheStats recordCacheStats() {
        return records.stats();
    }

    public CacheStats rangeCacheStats() {
        return ranges.stats();
    }

    @Override
    public void close() {
        records.invalidateAll();
        ranges.invalidateAll();
        delegate.close();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void afterWrite(List<StorageRecord> batch) {
        for (StorageRecord record : batch) {
            records.put(record.getKey(), record);
        }
        Set<String> touched = batch.stream().map(StorageRecord::getMetricName).collect(Collectors.toSet());
        for (String metric : touched) {
            versions.computeIfAbsent(metric, m -> new AtomicLong()).incrementAndGet();
        }
        ranges.asMap().keySet().removeIf(k -> touched.contains(k.metricName));
    }

    // both counters only grow, so their sum changes whenever either does
    private long versionOf(String metricName) {
        AtomicLong version = versions.get(metricName);
        return epoch.get() + (version == null ? 0 : version.get());
    }

    private static final class RangeKey {
        private final RecordKind kind;
        private final String metricName;
        private final Instant start;
        private final Instant end;
        private final long version;

        RangeKey(RecordKind kind, String metricName, Instant start, Instant end, long version) {
            this.kind = kind;
            this.metricName = metricName;
            this.start = start;
            this.end = end;
            this.version = version;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof RangeKey that))
                return false;
            return kind == that.kind
                    && metricName.equals(that.metricName)
                    && start.equals(that.start)
                    && end.equals(that.end)
                    && version == that.version;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, metricName, start, end, version);
        }
    }
}
