package com.streamanalytics.core.config;

import com.streamanalytics.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EngineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}, by default
 * {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method calls {@link EngineConfig#validate()} after
 * parsing, so the engine fails fast on invalid configuration. Duplicate keys
 * are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYTICS_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "analytics-engine.yml";

    private EngineConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution: the file named by
     * {@code ANALYTICS_CONFIG_PATH} if it exists, otherwise the classpath
     * default.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if parsing or validation fails
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading engine configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed engine configuration in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Engine configuration {} is empty, using defaults", source);
            config = new EngineConfig();
        }
        config.validate();

        LOG.info("Loaded engine configuration: {}", config);
        return config;
    }
}
