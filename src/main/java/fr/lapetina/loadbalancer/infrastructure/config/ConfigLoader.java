package fr.lapetina.loadbalancer.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Validation of the loaded values
 *
 * The pool is fixed for the process lifetime, so configuration is read once at startup.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(LoadBalancerConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public LoadBalancerConfig load() {
        LoadBalancerConfig config = loadFromPath();
        validate(config);
        log.info("Configuration loaded: backends={}, algorithm={}, port={}",
                config.getBackends().size(), config.getAlgorithm(), config.getServer().getPort());
        return config;
    }

    private LoadBalancerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private LoadBalancerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public LoadBalancerConfig loadFromStream(InputStream inputStream) {
        LoadBalancerConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private LoadBalancerConfig parse(InputStream is, String source) {
        try {
            LoadBalancerConfig config = yaml.load(is);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks value ranges. Backend addresses are checked when the pool is built.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(LoadBalancerConfig config) {
        List<String> errors = new ArrayList<>();

        if (config.getServer() == null) {
            errors.add("server section is required");
        } else {
            checkPort(errors, "server.port", config.getServer().getPort());
            if (config.getServer().getMaxBodyBytes() <= 0) {
                errors.add("server.maxBodyBytes must be positive");
            }
        }

        if (config.getBackends() == null || config.getBackends().isEmpty()) {
            errors.add("backends must list at least one address");
        }

        LoadBalancerConfig.HealthCheckConfig healthCheck = config.getHealthCheck();
        if (healthCheck == null) {
            errors.add("healthCheck section is required");
        } else {
            if (healthCheck.getIntervalMs() <= 0) {
                errors.add("healthCheck.intervalMs must be positive");
            }
            if (healthCheck.getTimeoutMs() <= 0) {
                errors.add("healthCheck.timeoutMs must be positive");
            }
            if (healthCheck.getPath() == null || !healthCheck.getPath().startsWith("/")) {
                errors.add("healthCheck.path must start with '/'");
            }
        }

        LoadBalancerConfig.TimeoutsConfig timeouts = config.getTimeouts();
        if (timeouts == null) {
            errors.add("timeouts section is required");
        } else {
            if (timeouts.getConnectTimeoutMs() <= 0) {
                errors.add("timeouts.connectTimeoutMs must be positive");
            }
            if (timeouts.getRequestTimeoutMs() <= 0) {
                errors.add("timeouts.requestTimeoutMs must be positive");
            }
        }

        LoadBalancerConfig.EventsConfig events = config.getEvents();
        if (events == null) {
            errors.add("events section is required");
        } else if (events.getRingBufferSize() <= 0 || Integer.bitCount(events.getRingBufferSize()) != 1) {
            errors.add("events.ringBufferSize must be a power of 2");
        }

        LoadBalancerConfig.MetricsConfig metrics = config.getMetrics();
        if (metrics == null) {
            errors.add("metrics section is required");
        } else if (metrics.isEnabled()) {
            checkPort(errors, "metrics.port", metrics.getPort());
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    // Port 0 binds an ephemeral port
    private static void checkPort(List<String> errors, String name, int port) {
        if (port < 0 || port > 65535) {
            errors.add(name + " must be between 0 and 65535");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static LoadBalancerConfig createDefault() {
        return new LoadBalancerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
