package com.streamanalytics.service;

import com.streamanalytics.core.config.EngineConfig;
import com.streamanalytics.core.config.EngineConfigLoader;
import com.streamanalytics.core.engine.AnalyticsEngine;
import com.streamanalytics.core.model.EventType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the analytics service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   POST /observations (JSON)
 *     → AnalyticsEngine.recordMetric
 *     → windows, aggregates and anomalies in the configured store
 *     → ANOMALY_DETECTED → AlertLogger → JSON alert log
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Host settings come from environment variables via {@link ServiceConfig};
 * engine settings from the YAML located by {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * A JVM shutdown hook stops the HTTP server, then closes the engine, which
 * emits every open window and flushes the collector before the store is
 * closed.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsService {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsService.class);

    private AnalyticsService() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting analytics service with config: {}", config);
        EngineConfig engineConfig = loadEngineConfig(config);

        // 2. Build the engine and its meters
        Clock clock = Clock.systemUTC();
        AnalyticsEngine engine = AnalyticsEngine.builder(engineConfig).clock(clock).build();
        MeterRegistry registry = new SimpleMeterRegistry();
        EngineMetrics metrics = new EngineMetrics(engine);
        metrics.bindTo(registry);

        // 3. Alert delivery
        engine.subscribe(EventType.ANOMALY_DETECTED,
                new AlertLogger(new AnomalyAlertSerializer(), metrics, clock));

        // 4. Start engine, HTTP endpoints and stats reporting
        engine.start();
        ServiceHttpServer httpServer = new ServiceHttpServer(engine, registry, clock);
        httpServer.start(config.getHttpPort());
        ScheduledExecutorService reporter = scheduleStatsLog(engine, config.getStatsLogIntervalSeconds());

        // 5. Run until the JVM is asked to stop
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            httpServer.stop();
            reporter.shutdownNow();
            engine.close();
            stopped.countDown();
        }, "service-shutdown"));
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static EngineConfig loadEngineConfig(ServiceConfig config) {
        String path = config.getEngineConfigPath();
        EngineConfig engineConfig = (path != null && !path.isBlank())
                ? EngineConfigLoader.fromFile(path)
                : EngineConfigLoader.load();
        if (config.getTickIntervalMs() > 0) {
            engineConfig.getWindow().setTickIntervalMillis(config.getTickIntervalMs());
        }
        return engineConfig;
    }

    private static ScheduledExecutorService scheduleStatsLog(AnalyticsEngine engine, long intervalSeconds) {
        ScheduledExecutorService reporter = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stats-reporter");
            t.setDaemon(true);
            return t;
        });
        if (intervalSeconds > 0) {
            reporter.scheduleAtFixedRate(() -> LOG.info("{}", engine.stats()),
                    intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        }
        return reporter;
    }
}
