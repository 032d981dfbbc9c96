package fr.lapetina.loadbalancer.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.loadbalancer.domain.event.LoadBalancerEvent;
import fr.lapetina.loadbalancer.domain.event.RequestEvent;
import fr.lapetina.loadbalancer.domain.model.DispatchResult;
import fr.lapetina.loadbalancer.infrastructure.metrics.MetricsRegistry;

/**
 * Feeds request and health reports into the Micrometer registry.
 *
 * Records:
 * - Request count by backend, algorithm and status
 * - Response duration histograms
 * - Requests rejected for lack of a live backend
 * - Health probe durations
 */
public final class MetricsHandler implements EventHandler<LoadBalancerEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(LoadBalancerEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        switch (event.getType()) {
            case REQUEST -> recordRequest(event.getRequestEvent());
            case HEALTH -> metricsRegistry.recordHealth(event.getHealthEvent());
        }
    }

    private void recordRequest(RequestEvent request) {
        if (DispatchResult.NO_BACKEND.equals(request.backendAddress())) {
            metricsRegistry.incrementNoBackend();
        }
        metricsRegistry.recordRequest(request);
    }
}
