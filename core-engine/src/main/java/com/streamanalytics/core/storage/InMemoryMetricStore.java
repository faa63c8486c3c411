package com.streamanalytics.core.storage;

import com.streamanalytics.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, process-local {@link MetricStore}.
 *
 * <p>
 * Holds at most {@code maxRecords} records. Inserting past the bound evicts
 * the records with the oldest timestamps first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Guarded by a read-write lock: queries run concurrently, writes are
 * exclusive.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryMetricStore implements MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMetricStore.class);

    private final int maxRecords;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<RecordKey, StorageRecord> byKey = new HashMap<>();
    private final NavigableMap<Instant, Map<RecordKey, StorageRecord>> byTime = new TreeMap<>();
    private long evicted;
    private volatile boolean closed;

    public InMemoryMetricStore(int maxRecords) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be >= 1, got: " + maxRecords);
        }
        this.maxRecords = maxRecords;
    }

    @Override
    public void insertBatch(List<StorageRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        ensureOpen();
        if (records.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            for (StorageRecord record : records) {
                remove(record.getKey());
                byKey.put(record.getKey(), record);
                byTime.computeIfAbsent(record.getTimestamp(), t -> new LinkedHashMap<>())
                        .put(record.getKey(), record);
            }
            evictOverflow();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * In-memory writes complete without blocking; the timeout is ignored.
     */
    @Override
    public void insertBatch(List<StorageRecord> records, Duration timeout) {
        insertBatch(records);
    }

    @Override
    public List<StorageRecord> queryRange(RecordKind kind, String metricName, Instant start, Instant end) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        ensureOpen();
        List<StorageRecord> result = new ArrayList<>();
        if (end.isBefore(start)) {
            return result;
        }
        lock.readLock().lock();
        try {
            for (Map<RecordKey, StorageRecord> bucket : byTime.subMap(start, true, end, true).values()) {
                for (StorageRecord record : bucket.values()) {
                    if (record.getKind() == kind && record.getMetricName().equals(metricName)) {
                        result.add(record);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        result.sort(Comparator.comparing(StorageRecord::getTimestamp));
        return result;
    }

    @Override
    public Optional<StorageRecord> find(RecordKey key) {
        ensureOpen();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byKey.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long deleteBefore(Instant cutoff) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            long removed = 0;
            NavigableMap<Instant, Map<RecordKey, StorageRecord>> expired = byTime.headMap(cutoff, false);
            for (Map<RecordKey, StorageRecord> bucket : expired.values()) {
                for (RecordKey key : bucket.keySet()) {
                    byKey.remove(key);
                    removed++;
                }
            }
            expired.clear();
            LOG.debug("Deleted {} in-memory record(s) before {}", removed, cutoff);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean containsMetric(String metricName) {
        ensureOpen();
        lock.readLock().lock();
        try {
            return byKey.keySet().stream().anyMatch(k -> k.getMetricName().equals(metricName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byKey.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long evictedCount() {
        lock.readLock().lock();
        try {
            return evicted;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    // ---------------------------------------------------------------
    // Internal (callers hold the write lock)
    // ---------------------------------------------------------------

    private void remove(RecordKey key) {
        StorageRecord existing = byKey.remove(key);
        if (existing == null) {
            return;
        }
        Map<RecordKey, StorageRecord> bucket = byTime.get(existing.getTimestamp());
        if (bucket != null) {
            bucket.remove(key);
            if (bucket.isEmpty()) {
                byTime.remove(existing.getTimestamp());
            }
        }
    }

    private void evictOverflow() {
        while (byKey.size() > maxRecords) {
            Map.Entry<Instant, Map<RecordKey, StorageRecord>> oldest = byTime.firstEntry();
            Iterator<RecordKey> it = oldest.getValue().keySet().iterator();
            RecordKey victim = it.next();
            it.remove();
            byKey.remove(victim);
            if (oldest.getValue().isEmpty()) {
                byTime.remove(oldest.getKey());
            }
            evicted++;
            LOG.trace("Evicted oldest record {}", victim);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("In-memory store is closed", false);
        }
    }
}
