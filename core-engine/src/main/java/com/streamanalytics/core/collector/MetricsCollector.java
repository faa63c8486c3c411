package com.streamanalytics.core.collector;

import com.streamanalytics.core.bus.EventBus;
import com.streamanalytics.core.config.CollectorConfig;
import com.streamanalytics.core.config.OverflowPolicy;
import com.streamanalytics.core.error.BackpressureException;
import com.streamanalytics.core.error.StorageException;
import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.FailureNotice;
import com.streamanalytics.core.model.MetricKey;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.model.Window;
import com.streamanalytics.core.stats.RunningStats;
import com.streamanalytics.core.storage.MetricStore;
import com.streamanalytics.core.storage.RetryingExecutor;
import com.streamanalytics.core.storage.StorageRecord;
import com.streamanalytics.core.stream.WindowListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers validated observations, keeps running statistics per series, and
 * flushes batch aggregates to storage.
 *
 * <h3>Buffering</h3>
 * <p>
 * {@link #record(Observation)} appends to a bounded buffer guarded by its own
 * lock. When the buffer is full the caller waits up to the offer timeout for
 * space; after that the {@link OverflowPolicy} decides: evict the oldest
 * buffered observation, or throw {@link BackpressureException}.
 * </p>
 *
 * <h3>Flushing</h3>
 * <p>
 * A flush is triggered when {@code batchSize} observations are buffered or
 * when the flush interval elapses, whichever comes first. Each flushed batch
 * is grouped by series into {@code BATCH}-level aggregates and written
 * through a {@link RetryingExecutor}. If every attempt fails the batch is put
 * back at the head of the buffer, so nothing is partially persisted.
 * </p>
 *
 * <h3>Windows</h3>
 * <p>
 * As a {@link WindowListener} the collector aggregates every sealed stream
 * window into a {@code WINDOW}-level aggregate, persists it and publishes
 * {@link EventType#AGGREGATE_COMPUTED}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsCollector implements WindowListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCollector.class);
    private static final String SOURCE = "metrics-collector";

    private final CollectorConfig config;
    private final MetricStore store;
    private final EventBus bus;
    private final RetryingExecutor retrying;
    private final Clock clock;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final Condition notFull = bufferLock.newCondition();
    private final Deque<Observation> buffer = new ArrayDeque<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final Map<MetricKey, RunningStats> running = new ConcurrentHashMap<>();

    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);
    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong collected = new AtomicLong();
    private final AtomicLong batchesFlushed = new AtomicLong();
    private final AtomicLong flushErrors = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong windowsAggregated = new AtomicLong();

    private final ScheduledExecutorService scheduler;
    private volatile boolean started;

    public MetricsCollector(CollectorConfig config, MetricStore store, EventBus bus,
            RetryingExecutor retrying, Clock clock) {
        this.config = Objects.requireNonNull(config, "CollectorConfig must not be null");
        this.store = Objects.requireNonNull(store, "MetricStore must not be null");
        this.bus = Objects.requireNonNull(bus, "EventBus must not be null");
        this.retrying = Objects.requireNonNull(retrying, "RetryingExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-collector-flush");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the interval flush timer.
     */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        long interval = config.flushInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledFlush, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Metrics collector started: {}", config);
    }

    // ---------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------

    /**
     * Validate and buffer an observation stamped with the current time.
     *
     * @throws com.streamanalytics.core.error.ValidationException if the input is invalid
     * @throws BackpressureException if the buffer is full under {@code REJECT}
     */
    public Observation record(String name, double value, Map<String, String> tags) {
        Observation observation = Observation.of(name, value, tags, clock.instant());
        record(observation);
        return observation;
    }

    /**
     * Buffer an already validated observation.
     *
     * @throws BackpressureException if the buffer is full under {@code REJECT}
     */
    public void record(Observation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        int size;
        bufferLock.lock();
        try {
            long remaining = config.offerTimeout().toNanos();
            while (buffer.size() >= config.getBufferCapacity() && remaining > 0) {
                remaining = awaitSpace(remaining);
            }
            if (buffer.size() >= config.getBufferCapacity()) {
                if (config.getOverflowPolicy() == OverflowPolicy.REJECT) {
                    throw new BackpressureException("Collector buffer full (" + buffer.size()
                            + " observations), rejecting " + observation.seriesKey());
                }
                Observation evicted = buffer.pollFirst();
                dropped.incrementAndGet();
                LOG.warn("Collector buffer full, dropped oldest observation {}", evicted);
            }
            buffer.addLast(observation);
            size = buffer.size();
        } finally {
            bufferLock.unlock();
        }

        RunningStats stats = running.computeIfAbsent(observation.seriesKey(), k -> new RunningStats());
        synchronized (stats) {
            stats.add(observation.getValue());
        }
        collected.incrementAndGet();

        if (size >= config.getBatchSize()) {
            requestFlush();
        }
    }

    /**
     * @return a copy of the running statistics of a series, if it was seen
     */
    public Optional<RunningStats> runningStats(MetricKey key) {
        RunningStats stats = running.get(key);
        if (stats == null) {
            return Optional.empty();
        }
        synchronized (stats) {
            return Optional.of(stats.copy());
        }
    }

    // ---------------------------------------------------------------
    // Flushing
    // ---------------------------------------------------------------

    /**
     * Write out every buffered observation now.
     *
     * @return number of observations flushed
     * @throws StorageException if a batch could not be persisted after
     *                          retries; that batch is back in the buffer
     */
    public int flush() {
        flushLock.lock();
        try {
            int total = 0;
            while (true) {
                List<Observation> batch = drain(config.getBatchSize());
                if (batch.isEmpty()) {
                    return total;
                }
                try {
                    persistBatch(batch);
                } catch (RuntimeException e) {
                    requeue(batch);
                    flushErrors.incrementAndGet();
                    throw e;
                }
                total += batch.size();
            }
        } finally {
            flushLock.unlock();
        }
    }

    @Override
    public void onWindowClosed(Window window) {
        if (window.size() == 0) {
            return;
        }
        AggregateResult aggregate = AggregateCalculator.fromWindow(window);
        retrying.run("store window aggregate " + window.getId(),
                () -> store.insertBatch(List.of(StorageRecord.of(aggregate))));
        windowsAggregated.incrementAndGet();
        bus.publish(Event.of(EventType.AGGREGATE_COMPUTED, SOURCE, aggregate));
        LOG.debug("Aggregated window {} (revision {}): count={}", window.getId(), window.getRevision(),
                aggregate.getCount());
    }

    public CollectorStats stats() {
        int buffered;
        bufferLock.lock();
        try {
            buffered = buffer.size();
        } finally {
            bufferLock.unlock();
        }
        return new CollectorStats(collected.get(), batchesFlushed.get(), flushErrors.get(), dropped.get(),
                buffered, windowsAggregated.get());
    }

    /**
     * Stop the timer and make a final flush attempt.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            int flushed = flush();
            LOG.info("Metrics collector closed after final flush of {} observation(s)", flushed);
        } catch (StorageException e) {
            LOG.error("Final collector flush failed, {} observation(s) not persisted: {}",
                    stats().getBuffered(), e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void persistBatch(List<Observation> batch) {
        String batchId = "batch-" + batchSequence.incrementAndGet();
        Map<MetricKey, List<Observation>> groups = new LinkedHashMap<>();
        for (Observation o : batch) {
            groups.computeIfAbsent(o.seriesKey(), k -> new ArrayList<>()).add(o);
        }

        List<AggregateResult> aggregates = new ArrayList<>(groups.size());
        List<StorageRecord> records = new ArrayList<>();
        groups.forEach((key, group) -> {
            AggregateResult aggregate = AggregateCalculator.fromBatch(key, group, batchId);
            aggregates.add(aggregate);
            records.add(StorageRecord.of(aggregate));
        });
        if (config.isAuditRawObservations()) {
            for (int i = 0; i < batch.size(); i++) {
                records.add(StorageRecord.of(batch.get(i), batchId + "/" + i));
            }
        }

        retrying.run("collector flush " + batchId, () -> store.insertBatch(records));
        batchesFlushed.incrementAndGet();
        aggregates.forEach(a -> bus.publish(Event.of(EventType.AGGREGATE_COMPUTED, SOURCE, a)));
        LOG.debug("Flushed {} observation(s) as {} aggregate(s) [{}]", batch.size(), aggregates.size(), batchId);
    }

    private List<Observation> drain(int max) {
        bufferLock.lock();
        try {
            List<Observation> batch = new ArrayList<>(Math.min(max, buffer.size()));
            while (batch.size() < max && !buffer.isEmpty()) {
                batch.add(buffer.pollFirst());
            }
            if (!batch.isEmpty()) {
                notFull.signalAll();
            }
            return batch;
        } finally {
            bufferLock.unlock();
        }
    }

    private void requeue(List<Observation> batch) {
        bufferLock.lock();
        try {
            ListIterator<Observation> it = batch.listIterator(batch.size());
            while (it.hasPrevious()) {
                buffer.addFirst(it.previous());
            }
        } finally {
            bufferLock.unlock();
        }
        LOG.warn("Re-queued {} observation(s) after failed flush", batch.size());
    }

    private long awaitSpace(long remainingNanos) {
        try {
            return notFull.awaitNanos(remainingNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackpressureException("Interrupted while waiting for collector buffer space");
        }
    }

    private void requestFlush() {
        if (!flushScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.execute(() -> {
                flushScheduled.set(false);
                scheduledFlush();
            });
        } catch (RejectedExecutionException e) {
            flushScheduled.set(false);
            LOG.debug("Collector closed, size-triggered flush skipped");
        }
    }

    private void scheduledFlush() {
        try {
            flush();
        } catch (RuntimeException e) {
            // Keep the periodic task alive; the batch is back in the buffer.
            LOG.error("Background collector flush failed: {}", e.getMessage(), e);
            bus.publish(Event.of(EventType.PROCESSING_FAILED, SOURCE,
                    new FailureNotice(SOURCE, e.getMessage(), clock.instant())));
        }
    }
}
