package fr.lapetina.loadbalancer.infrastructure.health;

import fr.lapetina.loadbalancer.domain.event.EventPublisher;
import fr.lapetina.loadbalancer.domain.event.HealthEvent;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.infrastructure.NamedThreadFactory;
import fr.lapetina.loadbalancer.infrastructure.http.BackendHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health monitor for the backend pool.
 *
 * Every interval, fires one asynchronous probe per backend. Each probe has
 * its own timeout and updates its backend as soon as it completes, so a
 * hanging backend never delays the others. A probe that completes in time
 * with status 200 marks the backend ALIVE; anything else marks it DEAD.
 * There are no retries within a round: the next round is the retry.
 */
public final class BackendHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

    private final BackendPool pool;
    private final BackendHttpClient httpClient;
    private final EventPublisher eventPublisher;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final String healthPath;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Map<Backend, CompletableFuture<ProbeResult>> pendingProbes = new ConcurrentHashMap<>();

    public BackendHealthMonitor(
            BackendPool pool,
            BackendHttpClient httpClient,
            EventPublisher eventPublisher,
            Duration checkInterval,
            Duration probeTimeout,
            String healthPath
    ) {
        this.pool = pool;
        this.httpClient = httpClient;
        this.eventPublisher = eventPublisher;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.healthPath = healthPath;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("health-monitor", true));
    }

    public BackendHealthMonitor(BackendPool pool, BackendHttpClient httpClient, EventPublisher eventPublisher) {
        this(pool, httpClient, eventPublisher, Duration.ofSeconds(5), Duration.ofSeconds(2), "/health");
    }

    /**
     * Starts the periodic health checking. The first round runs immediately.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Health monitor already closed");
        }
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleAtFixedRate(
                    this::runScheduledRound,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started: interval={}, timeout={}, path={}, backends={}",
                    checkInterval, probeTimeout, healthPath, pool.size());
        }
    }

    private void runScheduledRound() {
        // An exception escaping here would cancel the schedule
        try {
            checkAllBackends();
        } catch (RuntimeException e) {
            log.error("Health check round failed", e);
        }
    }

    /**
     * Probes every backend once, concurrently.
     *
     * @return future completing when every probe of this round has been applied
     */
    public CompletableFuture<Void> checkAllBackends() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(null);
        }

        log.debug("Starting health check round: backendCount={}", pool.size());

        List<CompletableFuture<ProbeResult>> probes = new ArrayList<>(pool.size());
        for (Backend backend : pool) {
            probes.add(checkBackend(backend));
        }
        return CompletableFuture.allOf(probes.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Probes a single backend and applies the result.
     * If a probe for this backend is still pending, returns that probe instead of starting another.
     */
    public CompletableFuture<ProbeResult> checkBackend(Backend backend) {
        if (closed.get()) {
            return CompletableFuture.completedFuture(ProbeResult.failure("monitor closed", 0));
        }

        // Claiming the slot and checking for a pending probe happen in one atomic step
        CompletableFuture<ProbeResult> slot = new CompletableFuture<>();
        CompletableFuture<ProbeResult> current = pendingProbes.compute(backend,
                (key, pending) -> pending != null && !pending.isDone() ? pending : slot);
        if (current != slot) {
            log.debug("Previous probe still pending, skipping: backend={}", backend.getName());
            return current;
        }

        CompletableFuture<ProbeResult> probe;
        try {
            probe = httpClient.healthCheck(backend, healthPath, probeTimeout);
        } catch (RuntimeException e) {
            probe = CompletableFuture.completedFuture(ProbeResult.failure(e.toString(), 0));
        }

        probe.exceptionally(ex -> ProbeResult.failure(ex.toString(), probeTimeout.toMillis()))
                .thenApply(result -> {
                    applyResult(backend, result);
                    return result;
                })
                .whenComplete((result, ex) -> {
                    pendingProbes.remove(backend, slot);
                    if (ex != null) {
                        slot.completeExceptionally(ex);
                    } else {
                        slot.complete(result);
                    }
                });
        return slot;
    }

    private void applyResult(Backend backend, ProbeResult result) {
        if (closed.get()) {
            return;
        }

        boolean wasAlive = backend.setAlive(result.healthy());
        backend.setLastProbeLatencyMs(result.latencyMs());

        if (wasAlive && !result.healthy()) {
            log.warn("Backend marked DEAD: backend={}, status={}, error={}, latencyMs={}",
                    backend.getName(), result.statusCode(), result.error(), result.latencyMs());
        } else if (!wasAlive && result.healthy()) {
            log.info("Backend marked ALIVE: backend={}, latencyMs={}", backend.getName(), result.latencyMs());
        } else {
            log.debug("Health check result: backend={}, alive={}, status={}, latencyMs={}",
                    backend.getName(), result.healthy(), result.statusCode(), result.latencyMs());
        }

        try {
            eventPublisher.publishHealth(new HealthEvent(backend.getName(), result.healthy(), result.latencyMs()));
        } catch (RuntimeException e) {
            log.warn("Failed to publish health event: backend={}, error={}", backend.getName(), e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get() && !closed.get();
    }

    /**
     * Stops scheduling and cancels probes still in flight.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            running.set(false);
            scheduler.shutdownNow();
            for (CompletableFuture<ProbeResult> probe : pendingProbes.values()) {
                probe.cancel(true);
            }
            pendingProbes.clear();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Health monitor scheduler did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Health monitor stopped");
        }
    }
}
