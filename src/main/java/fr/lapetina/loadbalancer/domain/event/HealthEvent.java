package fr.lapetina.loadbalancer.domain.event;

/**
 * Report of one health probe.
 *
 * @param backendAddress probed backend
 * @param alive          liveness after the probe
 * @param latencyMs      probe round-trip time
 */
public record HealthEvent(
        String backendAddress,
        boolean alive,
        long latencyMs
) {
}
