package fr.lapetina.loadbalancer;

import fr.lapetina.loadbalancer.dispatch.RequestDispatcher;
import fr.lapetina.loadbalancer.disruptor.EventPipeline;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.domain.strategy.BackendSelector;
import fr.lapetina.loadbalancer.domain.strategy.SelectionAlgorithm;
import fr.lapetina.loadbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.loadbalancer.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.loadbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.loadbalancer.infrastructure.health.BackendHealthMonitor;
import fr.lapetina.loadbalancer.infrastructure.http.BackendHttpClient;
import fr.lapetina.loadbalancer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired load balancer core from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LoadBalancerFactory factory = LoadBalancerFactory.create("config.yaml").start()) {
 *     DispatchResult result = factory.getDispatcher().dispatch(ProxyRequest.get("/"));
 * }
 * }</pre>
 */
public class LoadBalancerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancerFactory.class);

    private final LoadBalancerConfig config;
    private final BackendPool pool;
    private final SelectionAlgorithm algorithm;
    private final MetricsRegistry metricsRegistry;
    private final EventPipeline eventPipeline;
    private final BackendHttpClient httpClient;
    private final BackendHealthMonitor healthMonitor;
    private final RequestDispatcher dispatcher;

    protected LoadBalancerFactory(LoadBalancerConfig config, BackendHttpClient httpClientOverride) {
        ConfigLoader.validate(config);
        this.config = config;

        this.pool = buildPool(config);
        this.algorithm = resolveAlgorithm(config.getAlgorithm());

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        for (Backend backend : pool) {
            metricsRegistry.registerBackend(backend);
        }

        this.eventPipeline = EventPipeline.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .build();

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        this.healthMonitor = new BackendHealthMonitor(
                pool,
                httpClient,
                eventPipeline,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                Duration.ofMillis(config.getHealthCheck().getTimeoutMs()),
                config.getHealthCheck().getPath()
        );

        this.dispatcher = new RequestDispatcher(pool, new BackendSelector(), algorithm, httpClient, eventPipeline);

        log.info("LoadBalancerFactory initialized: backends={}, algorithm={}",
                pool.size(), algorithm.getConfigName());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static LoadBalancerFactory create(String configPath) {
        log.info("Initializing LoadBalancerFactory from config: {}", configPath);
        return new LoadBalancerFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static LoadBalancerFactory create(LoadBalancerConfig config) {
        return new LoadBalancerFactory(config, null);
    }

    /**
     * Starts the event pipeline and, when enabled, the health monitor.
     */
    public LoadBalancerFactory start() {
        eventPipeline.start();
        if (config.getHealthCheck().isEnabled()) {
            healthMonitor.start();
        } else {
            log.info("Health checks disabled, all backends stay ALIVE");
        }
        log.info("Load balancer core started");
        return this;
    }

    private static BackendPool buildPool(LoadBalancerConfig config) {
        try {
            return BackendPool.fromAddresses(config.getBackends());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static SelectionAlgorithm resolveAlgorithm(String name) {
        SelectionAlgorithm algorithm = SelectionAlgorithm.fromName(name);
        if (!SelectionAlgorithm.isKnown(name)) {
            log.warn("Unknown algorithm '{}', using {}", name, algorithm.getConfigName());
        }
        return algorithm;
    }

    private BackendHttpClient createHttpClient() {
        return new BackendHttpClient(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                config.getServer().getMaxBodyBytes()
        );
    }

    public LoadBalancerConfig getConfig() {
        return config;
    }

    public BackendPool getPool() {
        return pool;
    }

    public SelectionAlgorithm getAlgorithm() {
        return algorithm;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public EventPipeline getEventPipeline() {
        return eventPipeline;
    }

    public BackendHttpClient getHttpClient() {
        return httpClient;
    }

    public BackendHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public RequestDispatcher getDispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        log.info("Shutting down LoadBalancerFactory...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        try {
            eventPipeline.close();
        } catch (Exception e) {
            log.warn("Error closing event pipeline", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("LoadBalancerFactory shut down");
    }
}
