package com.streamanalytics.core.storage;

import com.streamanalytics.core.config.RetentionConfig;
import com.streamanalytics.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically removes records older than the retention period.
 *
 * @since 1.0.0
 */
public class RetentionManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);

    private final MetricStore store;
    private final RetentionConfig config;
    private final Clock clock;
    private final AtomicLong totalDeleted = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public RetentionManager(MetricStore store, RetentionConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "MetricStore must not be null");
        this.config = Objects.requireNonNull(config, "RetentionConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Schedule sweeps at the configured interval. Does nothing when retention
     * is disabled.
     */
    public synchronized void start() {
        if (!config.isEnabled() || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = config.sweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledSweep, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        LOG.info("Retention sweeps scheduled every {} keeping {}", config.sweepInterval(), config.retention());
    }

    /**
     * Delete everything older than {@code now - retention}.
     *
     * @return number of records removed
     * @throws StorageException if the store fails
     */
    public long sweep() {
        Instant cutoff = clock.instant().minus(config.retention());
        long removed = store.deleteBefore(cutoff);
        totalDeleted.addAndGet(removed);
        LOG.info("Retention sweep removed {} record(s) older than {}", removed, cutoff);
        return removed;
    }

    public long getTotalDeleted() {
        return totalDeleted.get();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (StorageException e) {
            // Next sweep retries; the data is still there.
            LOG.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
