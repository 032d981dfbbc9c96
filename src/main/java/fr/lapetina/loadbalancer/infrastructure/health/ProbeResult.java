package fr.lapetina.loadbalancer.infrastructure.health;

/**
 * Outcome of one health probe.
 *
 * @param healthy    true iff the probe completed in time with status 200
 * @param statusCode HTTP status, or -1 when no response was received
 * @param latencyMs  time spent on the probe
 * @param error      failure description, null when a response was received
 */
public record ProbeResult(
        boolean healthy,
        int statusCode,
        long latencyMs,
        String error
) {

    public static ProbeResult ofStatus(int statusCode, long latencyMs) {
        return new ProbeResult(statusCode == 200, statusCode, latencyMs, null);
    }

    public static ProbeResult failure(String error, long latencyMs) {
        return new ProbeResult(false, -1, latencyMs, error);
    }
}
