package fr.lapetina.loadbalancer.infrastructure.metrics;

import fr.lapetina.loadbalancer.domain.event.HealthEvent;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import fr.lapetina.loadbalancer.domain.model.Backend;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters per backend, algorithm and status
 * - Response duration histograms per backend and algorithm
 * - Per-backend active connection, health and request count gauges
 * - Health probe duration histograms
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private static final Duration[] RESPONSE_BUCKETS = {
            Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofMillis(100),
            Duration.ofMillis(250), Duration.ofMillis(500), Duration.ofSeconds(1),
            Duration.ofMillis(2500), Duration.ofSeconds(5), Duration.ofSeconds(10)
    };

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> responseTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> healthCheckTimers = new ConcurrentHashMap<>();

    private final Counter noBackendCounter;
    private final Counter droppedEventsCounter;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.noBackendCounter = Counter.builder(prefix + "_no_backend_total")
                .description("Requests rejected because no backend was alive")
                .register(registry);

        this.droppedEventsCounter = Counter.builder(prefix + "_events_dropped_total")
                .description("Request and health events dropped because the ring buffer was full")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("lb");
    }

    /**
     * Registers the live gauges of a backend. They read the backend's own counters on each scrape.
     */
    public void registerBackend(Backend backend) {
        String name = backend.getName();

        Gauge.builder(prefix + "_active_connections", backend, Backend::getActiveConnections)
                .description("Requests currently in flight per backend")
                .tag("backend", name)
                .register(registry);

        Gauge.builder(prefix + "_backend_health", backend, b -> b.isAlive() ? 1 : 0)
                .description("Backend health status (1=ALIVE, 0=DEAD)")
                .tag("backend", name)
                .register(registry);

        FunctionCounter.builder(prefix + "_backend_requests_total", backend, Backend::getRequestCount)
                .description("Requests dispatched per backend since startup")
                .tag("backend", name)
                .register(registry);
    }

    /**
     * Records a completed or rejected request.
     *
     * @throws NullPointerException if the event has no backend or algorithm
     */
    public void recordRequest(RequestEvent event) {
        String backend = Objects.requireNonNull(event.backendAddress(), "backendAddress");
        String algorithm = Objects.requireNonNull(event.algorithm(), "algorithm");
        String status = String.valueOf(event.statusCode());

        String counterKey = backend + ":" + algorithm + ":" + status;
        requestCounters.computeIfAbsent(counterKey, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of proxied requests")
                        .tag("backend", backend)
                        .tag("algorithm", algorithm)
                        .tag("status", status)
                        .register(registry)
        ).increment();

        String timerKey = backend + ":" + algorithm;
        responseTimers.computeIfAbsent(timerKey, k ->
                Timer.builder(prefix + "_response_duration")
                        .description("Response duration per backend")
                        .tag("backend", backend)
                        .tag("algorithm", algorithm)
                        .serviceLevelObjectives(RESPONSE_BUCKETS)
                        .register(registry)
        ).record(Duration.ofMillis(event.latencyMs()));
    }

    /**
     * Records the duration of one health probe.
     */
    public void recordHealth(HealthEvent event) {
        String backend = Objects.requireNonNull(event.backendAddress(), "backendAddress");
        healthCheckTimers.computeIfAbsent(backend, k ->
                Timer.builder(prefix + "_health_check_duration")
                        .description("Health probe duration per backend")
                        .tag("backend", backend)
                        .serviceLevelObjectives(RESPONSE_BUCKETS)
                        .register(registry)
        ).record(Duration.ofMillis(event.latencyMs()));
    }

    public void incrementNoBackend() {
        noBackendCounter.increment();
    }

    public void incrementDroppedEvents() {
        droppedEventsCounter.increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
