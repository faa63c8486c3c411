package com.streamanalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamanalytics.core.engine.AnalyticsEngine;
import com.streamanalytics.core.error.BackpressureException;
import com.streamanalytics.core.error.ValidationException;
import com.streamanalytics.core.model.Observation;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server of the analytics service.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with {@code {"status":"UP"}}
 * while the process runs</li>
 * <li>{@code GET /readiness} – {@code 200} once the engine is started,
 * {@code 503} otherwise; target for Kubernetes readiness checks</li>
 * <li>{@code GET /stats} – every registered meter as JSON</li>
 * <li>{@code POST /observations} – one observation object or an array of
 * them; a missing {@code timestamp} is filled with the current time.
 * Responds {@code 202}, {@code 400} for invalid input, {@code 503} under
 * backpressure</li>
 * </ul>
 *
 * <p>
 * Runs on the JDK {@link HttpServer} with two daemon worker threads.
 * </p>
 *
 * @since 1.0.0
 */
public class ServiceHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceHttpServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final AnalyticsEngine engine;
    private final MeterRegistry registry;
    private final Clock clock;
    private final ObjectMapper mapper;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ServiceHttpServer(AnalyticsEngine engine, MeterRegistry registry, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the server on the given port; {@code 0} binds an ephemeral port.
     *
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind HTTP server on port " + port, e);
        }
        server.createContext("/health", ServiceHttpServer::handleHealth);
        server.createContext("/readiness", this::handleReadiness);
        server.createContext("/stats", this::handleStats);
        server.createContext("/observations", this::handleObservations);

        executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "service-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful after starting on port {@code 0}
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (engine.isRunning()) {
            respond(exchange, 200, HEALTH_RESPONSE);
        } else {
            respond(exchange, 503, NOT_READY_RESPONSE);
        }
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        Map<String, Map<String, Double>> meters = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            Map<String, Double> values = new TreeMap<>();
            for (Measurement m : meter.measure()) {
                values.put(m.getStatistic().getTagValueRepresentation(), m.getValue());
            }
            meters.put(meterName(meter), values);
        }
        respond(exchange, 200, mapper.writeValueAsBytes(meters));
    }

    private void handleObservations(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            respond(exchange, 405, error("Use POST"));
            return;
        }
        List<Observation> observations;
        try (InputStream body = exchange.getRequestBody()) {
            observations = parse(mapper.readTree(body));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            respond(exchange, 400, error("Malformed observation: " + e.getMessage()));
            return;
        }

        int accepted = 0;
        try {
            for (Observation observation : observations) {
                engine.recordMetric(observation);
                accepted++;
            }
        } catch (ValidationException e) {
            respond(exchange, 400, error(e.getMessage() + " (accepted " + accepted + ")"));
            return;
        } catch (BackpressureException e) {
            respond(exchange, 503, error(e.getMessage() + " (accepted " + accepted + ")"));
            return;
        }
        respond(exchange, 202, mapper.writeValueAsBytes(Map.of("accepted", accepted)));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private List<Observation> parse(JsonNode root) throws JsonProcessingException {
        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("empty body");
        }
        List<Observation> observations = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                observations.add(toObservation(node));
            }
        } else {
            observations.add(toObservation(root));
        }
        return observations;
    }

    private Observation toObservation(JsonNode node) throws JsonProcessingException {
        if (!(node instanceof ObjectNode object)) {
            throw new IllegalArgumentException("expected a JSON object, got: " + node.getNodeType());
        }
        if (!object.hasNonNull("timestamp")) {
            object.put("timestamp", clock.instant().toString());
        }
        try {
            return mapper.treeToValue(object, Observation.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof ValidationException invalid) {
                throw new IllegalArgumentException(invalid.getMessage(), e);
            }
            throw e;
        }
    }

    private byte[] error(String message) throws JsonProcessingException {
        return mapper.writeValueAsBytes(Map.of("error", message));
    }

    private static String meterName(Meter meter) {
        StringBuilder name = new StringBuilder(meter.getId().getName());
        List<Tag> tags = meter.getId().getTags();
        if (!tags.isEmpty()) {
            name.append('{');
            for (int i = 0; i < tags.size(); i++) {
                if (i > 0) {
                    name.append(',');
                }
                name.append(tags.get(i).getKey()).append('=').append(tags.get(i).getValue());
            }
            name.append('}');
        }
        return name.toString();
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
