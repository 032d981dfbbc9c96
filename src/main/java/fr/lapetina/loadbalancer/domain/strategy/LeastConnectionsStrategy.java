package fr.lapetina.loadbalancer.domain.strategy;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;

import java.util.Optional;

/**
 * Least-connections load balancing strategy.
 *
 * Selects the alive backend with the fewest active connections, ties going
 * to the first one in pool order. Counters are read one at a time without
 * a pool-wide snapshot; a stale read costs at most one extra request on a
 * slightly busier backend.
 *
 * Thread-safe as it reads atomic counters from Backend.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public SelectionAlgorithm getAlgorithm() {
        return SelectionAlgorithm.LEAST_CONN;
    }

    @Override
    public Optional<Backend> selectBackend(BackendPool pool) {
        if (pool == null || pool.isEmpty()) {
            return Optional.empty();
        }

        Backend selected = null;
        int minConnections = Integer.MAX_VALUE;

        for (Backend backend : pool) {
            if (!backend.isAlive()) {
                continue;
            }

            int connections = backend.getActiveConnections();
            // Strict comparison keeps the first backend on ties
            if (selected == null || connections < minConnections) {
                minConnections = connections;
                selected = backend;
            }
        }

        return Optional.ofNullable(selected);
    }
}
