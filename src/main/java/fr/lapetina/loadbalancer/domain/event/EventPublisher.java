package fr.lapetina.loadbalancer.domain.event;

/**
 * Sink for request and health reports.
 *
 * Fire-and-forget: implementations must return quickly and must not throw,
 * whatever happens to the logging and metrics collaborators behind them.
 */
public interface EventPublisher {

    void publishRequest(RequestEvent event);

    void publishHealth(HealthEvent event);

    /**
     * Publisher that discards everything.
     */
    static EventPublisher noop() {
        return new EventPublisher() {
            @Override
            public void publishRequest(RequestEvent event) {
                // discarded
            }

            @Override
            public void publishHealth(HealthEvent event) {
                // discarded
            }
        };
    }
}
