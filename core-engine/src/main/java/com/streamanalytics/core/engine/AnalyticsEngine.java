package com.streamanalytics.core.engine;

import com.streamanalytics.core.bus.AsyncEventBus;
import com.streamanalytics.core.bus.EventBus;
import com.streamanalytics.core.bus.EventHandler;
import com.streamanalytics.core.collector.MetricsCollector;
import com.streamanalytics.core.config.EngineConfig;
import com.streamanalytics.core.config.EngineConfigLoader;
import com.streamanalytics.core.detection.AnomalyDetector;
import com.streamanalytics.core.detection.AnomalyMonitor;
import com.streamanalytics.core.error.InvalidQueryException;
import com.streamanalytics.core.error.UnknownMetricException;
import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AggregationLevel;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.Event;
import com.streamanalytics.core.model.EventType;
import com.streamanalytics.core.model.Observation;
import com.streamanalytics.core.storage.MetricStore;
import com.streamanalytics.core.storage.MetricStores;
import com.streamanalytics.core.storage.RecordKind;
import com.streamanalytics.core.storage.RetentionManager;
import com.streamanalytics.core.storage.RetryPolicy;
import com.streamanalytics.core.storage.RetryingExecutor;
import com.streamanalytics.core.stream.StreamProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the analytics engine.
 *
 * <p>
 * Wires the event bus, metrics collector, stream processor, anomaly detector
 * and storage layer together from an {@link EngineConfig}:
 * </p>
 *
 * <pre>
 * recordMetric ─► bus (METRIC_COLLECTED)
 *              ├► collector ─► BATCH aggregates ─► store
 *              └► stream processor ─► closed window ─► collector ─► WINDOW aggregate ─► store
 *                                                  └► anomaly monitor ─► ANOMALY records ─► store
 *                                                                     └► bus (ANOMALY_DETECTED)
 * </pre>
 *
 * <h3>Queries</h3>
 * <p>
 * Ranges include both ends, {@code [start, end]}. Queries only read from the
 * store, so repeating one returns the same result.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsEngine.class);
    private static final String SOURCE = "analytics-engine";

    private final EngineConfig config;
    private final Clock clock;
    private final EventBus bus;
    private final MetricStore store;
    private final MetricsCollector collector;
    private final StreamProcessor processor;
    private final AnomalyMonitor monitor;
    private final RetentionManager retention;
    private final Set<String> knownMetrics = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private AnalyticsEngine(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.bus = builder.bus != null ? builder.bus : new AsyncEventBus(config.getBus(), clock);
        this.store = builder.store != null ? builder.store : MetricStores.create(config.getStorage());

        RetryingExecutor retrying = new RetryingExecutor(RetryPolicy.from(config.getStorage()));
        this.collector = new MetricsCollector(config.getCollector(), store, bus, retrying, clock);
        AnomalyDetector detector = builder.detector != null
                ? builder.detector
                : new AnomalyDetector(config.getDetection());
        this.monitor = new AnomalyMonitor(detector, store, bus, retrying);
        this.processor = new StreamProcessor(config.getWindow(), bus, clock, List.of(collector, monitor));
        this.retention = new RetentionManager(store, config.getRetention(), clock);
    }

    /**
     * Build an engine from the configuration found by
     * {@link EngineConfigLoader#load()}.
     */
    public static AnalyticsEngine fromDefaultConfig() {
        return builder(EngineConfigLoader.load()).build();
    }

    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    /**
     * Start the periodic collector flush, the watermark ticker and the
     * retention sweep.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        collector.start();
        processor.start();
        retention.start();
        LOG.info("Analytics engine started (storage={}, window={} {}s)", config.getStorage().getBackend(),
                config.getWindow().getType(), config.getWindow().getSizeSeconds());
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record an observation stamped with the engine clock.
     *
     * @throws com.streamanalytics.core.error.ValidationException   if the input is invalid
     * @throws com.streamanalytics.core.error.BackpressureException if the collector rejects it
     */
    public Observation recordMetric(String name, double value, Map<String, String> tags) {
        return recordMetric(Observation.of(name, value, tags, clock.instant()));
    }

    /**
     * Record an observation carrying its own event time.
     */
    public Observation recordMetric(Observation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        collector.record(observation);
        knownMetrics.add(observation.getName());
        bus.publish(Event.of(EventType.METRIC_COLLECTED, SOURCE, observation));
        processor.process(observation);
        return observation;
    }

    /**
     * Advance event time for every series, closing the windows that become
     * due.
     */
    public void advanceWatermark(Instant watermark) {
        processor.advanceTo(watermark);
    }

    /**
     * Close every open window and flush the collector buffer now.
     */
    public void flush() {
        processor.closeAll();
        collector.flush();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Window-level aggregates of a metric whose window starts in
     * {@code [start, end]}.
     *
     * @throws InvalidQueryException  if {@code end} is before {@code start}
     * @throws UnknownMetricException if the metric was never recorded
     */
    public List<AggregateResult> getMetrics(String name, Instant start, Instant end) {
        return getMetrics(name, start, end, AggregationLevel.WINDOW);
    }

    public List<AggregateResult> getMetrics(String name, Instant start, Instant end, AggregationLevel level) {
        Objects.requireNonNull(level, "level must not be null");
        checkQuery(name, start, end);
        return store.queryRange(RecordKind.AGGREGATE, name, start, end).stream()
                .map(r -> r.payloadAs(AggregateResult.class))
                .flatMap(Optional::stream)
                .filter(a -> a.getLevel() == level)
                .toList();
    }

    /**
     * Flagged points of a metric with a timestamp in {@code [start, end]}.
     *
     * @throws InvalidQueryException  if {@code end} is before {@code start}
     * @throws UnknownMetricException if the metric was never recorded
     */
    public List<AnomalyResult> getAnomalies(String name, Instant start, Instant end) {
        checkQuery(name, start, end);
        return store.queryRange(RecordKind.ANOMALY, name, start, end).stream()
                .map(r -> r.payloadAs(AnomalyResult.class))
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Raw observations, only present when the collector audits them.
     */
    public List<Observation> getObservations(String name, Instant start, Instant end) {
        checkQuery(name, start, end);
        return store.queryRange(RecordKind.OBSERVATION, name, start, end).stream()
                .map(r -> r.payloadAs(Observation.class))
                .flatMap(Optional::stream)
                .toList();
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    public UUID subscribe(EventType type, EventHandler handler) {
        return bus.subscribe(type, handler);
    }

    public UUID subscribeAll(EventHandler handler) {
        return bus.subscribeAll(handler);
    }

    public boolean unsubscribe(UUID subscriptionId) {
        return bus.unsubscribe(subscriptionId);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public EngineStats stats() {
        return new EngineStats(bus.stats(), collector.stats(), processor.stats(),
                monitor.getAnomaliesPublished(), retention.getTotalDeleted());
    }

    public EngineConfig getConfig() {
        return config;
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    /**
     * Close every open window, flush the collector, then stop the bus and the
     * store.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Shutting down analytics engine");
        processor.close();
        collector.close();
        retention.close();
        bus.close();
        store.close();
        LOG.info("Analytics engine stopped");
    }

    private void checkQuery(String name, Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (name == null || name.isBlank()) {
            throw new InvalidQueryException("Metric name must not be blank");
        }
        if (end.isBefore(start)) {
            throw new InvalidQueryException("Query end " + end + " is before start " + start);
        }
        if (!knownMetrics.contains(name) && !store.containsMetric(name)) {
            throw new UnknownMetricException(name);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private final EngineConfig config;
        private Clock clock = Clock.systemUTC();
        private EventBus bus;
        private MetricStore store;
        private AnomalyDetector detector;

        private Builder(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must not be null");
            return this;
        }

        /**
         * Use this bus instead of one built from {@code config.bus}. The
         * engine closes it on shutdown.
         */
        public Builder eventBus(EventBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Use this store instead of one built from {@code config.storage}.
         * The engine closes it on shutdown.
         */
        public Builder store(MetricStore store) {
            this.store = store;
            return this;
        }

        public Builder detector(AnomalyDetector detector) {
            this.detector = detector;
            return this;
        }

        /**
         * @throws com.streamanalytics.core.error.ConfigurationException if the
         *                                                             configuration is invalid
         */
        public AnalyticsEngine build() {
            config.validate();
            return new AnalyticsEngine(this);
        }
    }
}
