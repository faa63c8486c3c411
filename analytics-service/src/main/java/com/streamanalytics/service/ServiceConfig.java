package com.streamanalytics.service;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of the analytics service host.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * Engine settings live in the YAML file named by {@code ANALYTICS_CONFIG_PATH};
 * this object only covers what the host itself needs.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final long tickIntervalMs;

    // ---------------------------------------------------------------
    // Reporting
    // ---------------------------------------------------------------
    private final long statsLogIntervalSeconds;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.engineConfigPath = b.engineConfigPath;
        this.tickIntervalMs = b.tickIntervalMs;
        this.statsLogIntervalSeconds = b.statsLogIntervalSeconds;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ServiceConfig fromEnvironment(UnaryOperator<String> env) {
        try {
            return new Builder()
                    .httpPort(Integer.parseInt(env(env, "HEALTH_PORT", "8080")))
                    .engineConfigPath(env(env, "ANALYTICS_CONFIG_PATH", ""))
                    .tickIntervalMs(Long.parseLong(env(env, "TICK_INTERVAL_MS", "0")))
                    .statsLogIntervalSeconds(Long.parseLong(env(env, "STATS_LOG_INTERVAL_SECONDS", "60")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    /**
     * @return watermark tick interval override; {@code 0} keeps the YAML value
     */
    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    /**
     * @return interval of the periodic stats log line; {@code 0} disables it
     */
    public long getStatsLogIntervalSeconds() {
        return statsLogIntervalSeconds;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [1, 65535], non-negative intervals).
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String engineConfigPath = "";
        private long tickIntervalMs = 0;
        private long statsLogIntervalSeconds = 60;

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder tickIntervalMs(long v) {
            this.tickIntervalMs = v;
            return this;
        }

        public Builder statsLogIntervalSeconds(long v) {
            this.statsLogIntervalSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath must not be null (use \"\" for default)");
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [1, 65535], got: " + httpPort);
            }
            if (tickIntervalMs < 0) {
                throw new IllegalArgumentException("tickIntervalMs must be >= 0, got: " + tickIntervalMs);
            }
            if (statsLogIntervalSeconds < 0) {
                throw new IllegalArgumentException(
                        "statsLogIntervalSeconds must be >= 0, got: " + statsLogIntervalSeconds);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", tickIntervalMs=" + tickIntervalMs +
                ", statsLogIntervalSeconds=" + statsLogIntervalSeconds +
                '}';
    }
}
