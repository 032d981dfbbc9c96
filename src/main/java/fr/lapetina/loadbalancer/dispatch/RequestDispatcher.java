package fr.lapetina.loadbalancer.dispatch;

import fr.lapetina.loadbalancer.domain.event.EventPublisher;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;
import fr.lapetina.loadbalancer.domain.model.DispatchResult;
import fr.lapetina.loadbalancer.domain.model.ErrorType;
import fr.lapetina.loadbalancer.domain.model.ProxyRequest;
import fr.lapetina.loadbalancer.domain.model.ProxyResponse;
import fr.lapetina.loadbalancer.domain.strategy.BackendSelector;
import fr.lapetina.loadbalancer.domain.strategy.SelectionAlgorithm;
import fr.lapetina.loadbalancer.infrastructure.http.BackendHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * Serves one request: select a backend, forward, report.
 *
 * The selected backend's active connection count is incremented before
 * forwarding and decremented in a {@code finally} block, so it is restored
 * on every exit path. There is no retry on another backend: a failed
 * forward is reported to the caller as is.
 *
 * Thread-safe: called concurrently by every front server worker.
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final BackendPool pool;
    private final BackendSelector selector;
    private final SelectionAlgorithm algorithm;
    private final BackendHttpClient httpClient;
    private final EventPublisher eventPublisher;

    public RequestDispatcher(
            BackendPool pool,
            BackendSelector selector,
            SelectionAlgorithm algorithm,
            BackendHttpClient httpClient,
            EventPublisher eventPublisher
    ) {
        this.pool = pool;
        this.selector = selector;
        this.algorithm = algorithm != null ? algorithm : SelectionAlgorithm.RANDOM;
        this.httpClient = httpClient;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Dispatches a request to an alive backend.
     *
     * @return the backend response, or an error result carrying the status to return
     */
    public DispatchResult dispatch(ProxyRequest request) {
        long start = System.nanoTime();

        Optional<Backend> selected = selector.selectBackend(pool, algorithm);
        if (selected.isEmpty()) {
            DispatchResult result = DispatchResult.noBackend(elapsed(start));
            log.warn("No backend available: requestId={}, method={}, path={}, algorithm={}, aliveCount=0",
                    request.requestId(), request.method(), request.path(), algorithm.getConfigName());
            publish(request, result);
            return result;
        }

        Backend backend = selected.get();
        DispatchResult result;

        backend.recordStart();
        try {
            ProxyResponse response = httpClient.forward(backend, request);
            result = DispatchResult.forwarded(backend, response, elapsed(start));
            log.debug("Request forwarded: requestId={}, backend={}, status={}, latencyMs={}",
                    request.requestId(), backend.getName(), response.statusCode(), result.latency().toMillis());
        } catch (HttpConnectTimeoutException e) {
            result = failed(request, backend, ErrorType.BACKEND_ERROR, e, start);
        } catch (HttpTimeoutException e) {
            result = failed(request, backend, ErrorType.TIMEOUT, e, start);
        } catch (IOException e) {
            result = failed(request, backend, ErrorType.BACKEND_ERROR, e, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = failed(request, backend, ErrorType.BACKEND_ERROR, e, start);
        } catch (RuntimeException e) {
            log.error("Unexpected dispatch failure: requestId={}, backend={}",
                    request.requestId(), backend.getName(), e);
            result = DispatchResult.failed(backend, ErrorType.INTERNAL_ERROR, describe(e), elapsed(start));
        } finally {
            backend.recordEnd();
        }

        publish(request, result);
        return result;
    }

    private DispatchResult failed(ProxyRequest request, Backend backend, ErrorType errorType,
                                  Exception e, long start) {
        DispatchResult result = DispatchResult.failed(backend, errorType, describe(e), elapsed(start));
        log.warn("Forwarding failed: requestId={}, backend={}, errorType={}, error={}, latencyMs={}",
                request.requestId(), backend.getName(), errorType, result.errorMessage(),
                result.latency().toMillis());
        return result;
    }

    private void publish(ProxyRequest request, DispatchResult result) {
        RequestEvent event = new RequestEvent(
                request.clientAddress(),
                request.method(),
                request.path(),
                result.backendName(),
                result.latency().toMillis(),
                result.statusCode(),
                algorithm.getConfigName()
        );
        try {
            eventPublisher.publishRequest(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish request event: requestId={}, error={}", request.requestId(), e.getMessage());
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public SelectionAlgorithm getAlgorithm() {
        return algorithm;
    }

    public BackendPool getPool() {
        return pool;
    }
}
