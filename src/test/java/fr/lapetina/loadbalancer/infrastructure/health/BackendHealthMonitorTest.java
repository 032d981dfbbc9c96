package fr.lapetina.loadbalancer.infrastructure.health;

import fr.lapetina.loadbalancer.domain.event.EventPublisher;
import fr.lapetina.loadbalancer.domain.event.HealthEvent;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.infrastructure.http.BackendHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;

class BackendHealthMonitorTest {

    private Backend a;
    private Backend b;
    private BackendPool pool;
    private StubProbeClient client;
    private RecordingPublisher publisher;
    private BackendHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        a = Backend.of("http://localhost:9000");
        b = Backend.of("http://localhost:9001");
        pool = BackendPool.of(a, b);
        client = new StubProbeClient();
        publisher = new RecordingPublisher();
        monitor = new BackendHealthMonitor(
                pool, client, publisher, Duration.ofMillis(50), Duration.ofMillis(200), "/health");
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        client.close();
    }

    @Test
    @DisplayName("should keep healthy backends alive across rounds")
    void shouldKeepHealthyBackendsAlive() {
        for (int i = 0; i < 3; i++) {
            monitor.checkAllBackends().join();
        }

        assertThat(a.isAlive()).isTrue();
        assertThat(b.isAlive()).isTrue();
        assertThat(publisher.healthEvents).hasSize(6);
    }

    @Test
    @DisplayName("should mark backend dead after a single failed probe")
    void shouldMarkDeadAfterSingleFailure() {
        client.respond(b, ProbeResult.ofStatus(500, 3));

        monitor.checkAllBackends().join();

        assertThat(a.isAlive()).isTrue();
        assertThat(b.isAlive()).isFalse();
        assertThat(b.getLastProbeLatencyMs()).isEqualTo(3);
    }

    @Test
    @DisplayName("should treat non-200 success codes as dead")
    void shouldTreatNon200AsDead() {
        client.respond(a, ProbeResult.ofStatus(204, 1));

        monitor.checkBackend(a).join();

        assertThat(a.isAlive()).isFalse();
    }

    @Test
    @DisplayName("should revive a dead backend on the next successful probe")
    void shouldReviveDeadBackend() {
        b.setAlive(false);

        monitor.checkBackend(b).join();

        assertThat(b.isAlive()).isTrue();
    }

    @Test
    @DisplayName("should fold probe exceptions into dead")
    void shouldFoldExceptionsIntoDead() {
        client.fail(a, new IllegalStateException("boom"));

        ProbeResult result = monitor.checkBackend(a).join();

        assertThat(result.healthy()).isFalse();
        assertThat(a.isAlive()).isFalse();
    }

    @Test
    @DisplayName("should not let a hanging probe delay other backends")
    void shouldNotBlockOnHangingProbe() {
        CompletableFuture<ProbeResult> hanging = new CompletableFuture<>();
        client.respondWith(a, hanging);
        client.respond(b, ProbeResult.ofStatus(503, 2));

        CompletableFuture<Void> round = monitor.checkAllBackends();

        await().atMost(1, TimeUnit.SECONDS).untilAsserted(() -> assertThat(b.isAlive()).isFalse());
        assertThat(round).isNotDone();
        assertThat(a.isAlive()).isTrue();

        hanging.complete(ProbeResult.failure("timeout", 200));
        round.join();
        assertThat(a.isAlive()).isFalse();
    }

    @Test
    @DisplayName("should not start a second probe while one is pending")
    void shouldNotOverlapProbes() {
        CompletableFuture<ProbeResult> hanging = new CompletableFuture<>();
        client.respondWith(a, hanging);

        CompletableFuture<ProbeResult> first = monitor.checkBackend(a);
        CompletableFuture<ProbeResult> second = monitor.checkBackend(a);

        assertThat(second).isSameAs(first);
        assertThat(client.calls(a)).isEqualTo(1);

        hanging.complete(ProbeResult.ofStatus(200, 1));
        first.join();
    }

    @Test
    @DisplayName("should start a single probe when rounds overlap across threads")
    void shouldNotOverlapProbesAcrossThreads() throws Exception {
        CompletableFuture<ProbeResult> hanging = new CompletableFuture<>();
        client.respondWith(a, hanging);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<CompletableFuture<ProbeResult>>> submitted = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                submitted.add(executor.submit(() -> {
                    startGate.await();
                    return monitor.checkBackend(a);
                }));
            }
            startGate.countDown();

            Set<CompletableFuture<ProbeResult>> probes = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<CompletableFuture<ProbeResult>> future : submitted) {
                probes.add(future.get(2, TimeUnit.SECONDS));
            }

            assertThat(probes).hasSize(1);
            assertThat(client.calls(a)).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        hanging.complete(ProbeResult.ofStatus(200, 1));
        assertThat(monitor.checkBackend(a).join().healthy()).isTrue();
        assertThat(client.calls(a)).isEqualTo(2);
    }

    @Test
    @DisplayName("should publish a health event per probe")
    void shouldPublishHealthEvents() {
        client.respond(b, ProbeResult.failure("Connection refused", 4));

        monitor.checkAllBackends().join();

        assertThat(publisher.healthEvents)
                .extracting(HealthEvent::backendAddress, HealthEvent::alive)
                .containsExactlyInAnyOrder(
                        tuple("http://localhost:9000", true),
                        tuple("http://localhost:9001", false));
    }

    @Test
    @DisplayName("should probe periodically once started")
    void shouldProbePeriodically() {
        monitor.start();

        assertThat(monitor.isRunning()).isTrue();
        await().atMost(2, TimeUnit.SECONDS).until(() -> client.calls(a) >= 3);
    }

    @Test
    @DisplayName("should cancel pending probes and stop on close")
    void shouldCancelOnClose() {
        CompletableFuture<ProbeResult> hanging = new CompletableFuture<>();
        client.respondWith(a, hanging);
        CompletableFuture<ProbeResult> pending = monitor.checkBackend(a);

        monitor.close();

        assertThat(pending).isCancelled();
        assertThat(monitor.isRunning()).isFalse();

        hanging.complete(ProbeResult.failure("late", 1));
        assertThat(a.isAlive()).isTrue();
        assertThat(monitor.checkAllBackends()).isDone();
    }

    /**
     * Probe client answering from canned results, 200 by default.
     */
    static class StubProbeClient extends BackendHttpClient {
        private final Map<Backend, CompletableFuture<ProbeResult>> responses = new ConcurrentHashMap<>();
        private final Map<Backend, RuntimeException> failures = new ConcurrentHashMap<>();
        private final Map<Backend, AtomicInteger> callCounts = new ConcurrentHashMap<>();

        void respond(Backend backend, ProbeResult result) {
            responses.put(backend, CompletableFuture.completedFuture(result));
        }

        void respondWith(Backend backend, CompletableFuture<ProbeResult> future) {
            responses.put(backend, future);
        }

        void fail(Backend backend, RuntimeException exception) {
            failures.put(backend, exception);
        }

        int calls(Backend backend) {
            AtomicInteger count = callCounts.get(backend);
            return count == null ? 0 : count.get();
        }

        @Override
        public CompletableFuture<ProbeResult> healthCheck(Backend backend, String path, Duration timeout) {
            callCounts.computeIfAbsent(backend, k -> new AtomicInteger()).incrementAndGet();
            RuntimeException failure = failures.get(backend);
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return responses.getOrDefault(backend, CompletableFuture.completedFuture(ProbeResult.ofStatus(200, 1)));
        }
    }

    static class RecordingPublisher implements EventPublisher {
        final List<HealthEvent> healthEvents = new CopyOnWriteArrayList<>();

        @Override
        public void publishRequest(RequestEvent event) {
            // not expected here
        }

        @Override
        public void publishHealth(HealthEvent event) {
            healthEvents.add(event);
        }
    }
}
