package fr.lapetina.loadbalancer.domain.event;

/**
 * Report of one served request.
 *
 * @param clientAddress  remote address of the caller
 * @param method         HTTP method
 * @param path           request path without query string
 * @param backendAddress chosen backend, {@code "none"} if no backend was alive
 * @param latencyMs      wall-clock time from selection to completion
 * @param statusCode     status returned to the caller
 * @param algorithm      selection algorithm in use
 */
public record RequestEvent(
        String clientAddress,
        String method,
        String path,
        String backendAddress,
        long latencyMs,
        int statusCode,
        String algorithm
) {
}
