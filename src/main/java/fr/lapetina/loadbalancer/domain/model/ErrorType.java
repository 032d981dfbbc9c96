package fr.lapetina.loadbalancer.domain.model;

/**
 * Error taxonomy for dispatched requests.
 * Each value maps to the status code returned to the caller.
 */
public enum ErrorType {
    /** No backend in the pool is alive */
    NO_AVAILABLE_BACKEND(503),

    /** Backend unreachable or connection broken mid-request */
    BACKEND_ERROR(502),

    /** Backend did not answer within the request timeout */
    TIMEOUT(504),

    /** Internal system error */
    INTERNAL_ERROR(500);

    private final int statusCode;

    ErrorType(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
