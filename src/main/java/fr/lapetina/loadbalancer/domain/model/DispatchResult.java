package fr.lapetina.loadbalancer.domain.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of dispatching one request.
 *
 * Exactly one of {@code response} and {@code errorType} is non-null.
 * {@code backend} is null only when no backend could be selected.
 */
public record DispatchResult(
        Backend backend,
        ProxyResponse response,
        ErrorType errorType,
        String errorMessage,
        Duration latency
) {

    /**
     * Backend name reported when no backend was selected.
     */
    public static final String NO_BACKEND = "none";

    public static DispatchResult forwarded(Backend backend, ProxyResponse response, Duration latency) {
        return new DispatchResult(backend, response, null, null, latency);
    }

    public static DispatchResult failed(Backend backend, ErrorType errorType, String message, Duration latency) {
        return new DispatchResult(backend, null, errorType, message, latency);
    }

    public static DispatchResult noBackend(Duration latency) {
        return new DispatchResult(null, null, ErrorType.NO_AVAILABLE_BACKEND,
                "No backends available", latency);
    }

    public int statusCode() {
        return response != null ? response.statusCode() : errorType.getStatusCode();
    }

    public boolean isError() {
        return errorType != null;
    }

    public Optional<Backend> selectedBackend() {
        return Optional.ofNullable(backend);
    }

    public String backendName() {
        return backend != null ? backend.getName() : NO_BACKEND;
    }
}
