package com.streamanalytics.service;

import com.streamanalytics.core.engine.AnalyticsEngine;
import com.streamanalytics.core.engine.EngineStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer meters for the analytics engine.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code analytics.observations.collected} – observations accepted by the collector</li>
 * <li>{@code analytics.observations.dropped} – observations evicted from a full buffer</li>
 * <li>{@code analytics.observations.late.dropped} – observations past the grace period</li>
 * <li>{@code analytics.batches.flushed} / {@code analytics.flush.errors}</li>
 * <li>{@code analytics.windows.closed} / {@code analytics.windows.open}</li>
 * <li>{@code analytics.bus.published} / {@code analytics.bus.handler.errors} /
 * {@code analytics.bus.queue.depth}</li>
 * <li>{@code analytics.anomalies.detected} – anomalies published by the engine</li>
 * <li>{@code analytics.alerts.delivered} – anomalies written to the alert log</li>
 * <li>{@code analytics.alert.latency} – event time of the anomalous point to alert delivery</li>
 * <li>{@code analytics.retention.deleted} – records removed by retention sweeps</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EngineMetrics implements MeterBinder {

    private static final Logger LOG = LoggerFactory.getLogger(EngineMetrics.class);

    private final AnalyticsEngine engine;
    private Counter alertsDelivered;
    private Timer alertLatency;

    public EngineMetrics(AnalyticsEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        counter(registry, "analytics.observations.collected", "Observations accepted by the collector",
                s -> s.getCollector().getCollected());
        counter(registry, "analytics.observations.dropped", "Observations evicted from a full collector buffer",
                s -> s.getCollector().getDropped());
        counter(registry, "analytics.observations.late.dropped", "Observations that missed every grace period",
                s -> s.getStream().getLateDropped());
        counter(registry, "analytics.batches.flushed", "Collector batches written to storage",
                s -> s.getCollector().getBatchesFlushed());
        counter(registry, "analytics.flush.errors", "Collector flushes that failed after retries",
                s -> s.getCollector().getFlushErrors());
        counter(registry, "analytics.windows.closed", "Windows emitted by the stream processor",
                s -> s.getStream().getWindowsClosed());
        counter(registry, "analytics.bus.published", "Events accepted by the event bus",
                s -> s.getBus().getPublished());
        counter(registry, "analytics.bus.handler.errors", "Subscriber invocations that threw",
                s -> s.getBus().getHandlerErrors());
        counter(registry, "analytics.anomalies.detected", "Anomalies published by the engine",
                EngineStats::getAnomaliesDetected);
        counter(registry, "analytics.retention.deleted", "Records removed by retention sweeps",
                EngineStats::getRetentionDeleted);

        gauge(registry, "analytics.windows.open", "Windows currently open", s -> s.getStream().getOpenWindows());
        gauge(registry, "analytics.collector.buffered", "Observations waiting for a flush",
                s -> s.getCollector().getBuffered());
        gauge(registry, "analytics.bus.queue.depth", "Events waiting for dispatch", s -> s.getBus().getQueueDepth());

        alertsDelivered = Counter.builder("analytics.alerts.delivered")
                .description("Anomalies written to the alert log")
                .register(registry);
        alertLatency = Timer.builder("analytics.alert.latency")
                .description("Delay from the anomalous point's event time to alert delivery")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        LOG.info("Engine metrics registered");
    }

    /**
     * Count a delivered alert.
     *
     * @throws IllegalStateException if {@link #bindTo} was not called
     */
    public void recordAlert(Duration latency) {
        if (alertsDelivered == null) {
            throw new IllegalStateException("EngineMetrics is not bound to a registry");
        }
        alertsDelivered.increment();
        alertLatency.record(latency);
    }

    private void counter(MeterRegistry registry, String name, String description,
            ToDoubleFunction<EngineStats> value) {
        FunctionCounter.builder(name, engine, e -> value.applyAsDouble(e.stats()))
                .description(description)
                .register(registry);
    }

    private void gauge(MeterRegistry registry, String name, String description,
            ToDoubleFunction<EngineStats> value) {
        Gauge.builder(name, engine, e -> value.applyAsDouble(e.stats()))
                .description(description)
                .register(registry);
    }
}
