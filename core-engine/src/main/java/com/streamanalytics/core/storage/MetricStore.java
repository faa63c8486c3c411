package com.streamanalytics.core.storage;

import com.streamanalytics.core.error.StorageException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Time-series record store.
 *
 * <h3>Semantics shared by every implementation</h3>
 * <ul>
 * <li>{@link #insertBatch} is all-or-nothing; a record whose key already
 * exists is replaced.</li>
 * <li>Range queries cover the closed interval {@code [start, end]} and
 * return records ordered by timestamp.</li>
 * <li>Long-running calls honour thread interruption and fail with a
 * non-retryable {@link StorageException}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface MetricStore extends AutoCloseable {

    /**
     * Persist a batch with the store's default timeout.
     *
     * @throws StorageException if the batch could not be persisted
     */
    void insertBatch(List<StorageRecord> records);

    /**
     * Persist a batch, giving up after {@code timeout}.
     *
     * @throws StorageException if the batch could not be persisted in time
     */
    void insertBatch(List<StorageRecord> records, Duration timeout);

    List<StorageRecord> queryRange(RecordKind kind, String metricName, Instant start, Instant end);

    /**
     * Query every kind of record for a metric.
     */
    default List<StorageRecord> queryRange(String metricName, Instant start, Instant end) {
        List<StorageRecord> all = new ArrayList<>();
        for (RecordKind kind : RecordKind.values()) {
            all.addAll(queryRange(kind, metricName, start, end));
        }
        all.sort(Comparator.comparing(StorageRecord::getTimestamp));
        return all;
    }

    Optional<StorageRecord> find(RecordKey key);

    /**
     * Remove every record with a timestamp before {@code cutoff}.
     *
     * @return number of records removed
     */
    long deleteBefore(Instant cutoff);

    /**
     * @return {@code true} if at least one record of any kind exists for the
     *         metric
     */
    boolean containsMetric(String metricName);

    @Override
    void close();
}
