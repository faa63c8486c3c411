package com.streamanalytics.service;

import com.streamanalytics.core.bus.EventHandler;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Subscriber that writes every detected anomaly as one JSON line to the
 * {@value #ALERT_LOGGER} logger and records it in {@link EngineMetrics}.
 *
 * @since 1.0.0
 */
public class AlertLogger implements EventHandler {

    static final String ALERT_LOGGER = "com.streamanalytics.alerts";

    private static final Logger LOG = LoggerFactory.getLogger(AlertLogger.class);
    private static final Logger ALERTS = LoggerFactory.getLogger(ALERT_LOGGER);

    private final AnomalyAlertSerializer serializer;
    private final EngineMetrics metrics;
    private final Clock clock;

    public AlertLogger(AnomalyAlertSerializer serializer, EngineMetrics metrics, Clock clock) {
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onEvent(Event event) {
        event.payloadAs(AnomalyResult.class).ifPresentOrElse(this::emit,
                () -> LOG.warn("Ignoring {} event {} without an anomaly payload", event.getType(), event.getId()));
    }

    private void emit(AnomalyResult alert) {
        String json = serializer.serialize(alert);
        if (!json.isEmpty()) {
            ALERTS.warn(json);
        }
        Duration latency = Duration.between(alert.getTimestamp(), clock.instant());
        metrics.recordAlert(latency.isNegative() ? Duration.ZERO : latency);
    }
}
