package fr.lapetina.loadbalancer.domain.strategy;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;

import java.util.Optional;

/**
 * Strategy interface for picking a backend out of the pool.
 *
 * Implementations must be thread-safe as they are called from every
 * request-handling thread concurrently. They only read backend state:
 * counters are updated by the dispatcher.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the algorithm this strategy implements.
     */
    SelectionAlgorithm getAlgorithm();

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    default String getName() {
        return getAlgorithm().getConfigName();
    }

    /**
     * Selects an alive backend.
     *
     * @param pool the backend pool, may be null or empty
     * @return an alive backend, or empty if none is alive
     */
    Optional<Backend> selectBackend(BackendPool pool);
}
