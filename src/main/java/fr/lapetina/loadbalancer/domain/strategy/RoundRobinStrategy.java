package fr.lapetina.loadbalancer.domain.strategy;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin load balancing strategy.
 *
 * Each call takes the next cursor value as its starting position and scans
 * forward circularly, skipping dead backends. Concurrent callers always get
 * distinct cursor values, so they start from distinct positions.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    // Treated as unsigned, wraps after 2^64 selections
    private final AtomicLong cursor = new AtomicLong(0);

    @Override
    public SelectionAlgorithm getAlgorithm() {
        return SelectionAlgorithm.ROUND_ROBIN;
    }

    @Override
    public Optional<Backend> selectBackend(BackendPool pool) {
        if (pool == null || pool.isEmpty()) {
            return Optional.empty();
        }

        int size = pool.size();
        int startIndex = (int) Long.remainderUnsigned(cursor.getAndIncrement(), size);

        // Try each backend starting from current cursor position
        for (int i = 0; i < size; i++) {
            Backend backend = pool.get((startIndex + i) % size);
            if (backend.isAlive()) {
                return Optional.of(backend);
            }
        }

        return Optional.empty();
    }

    long getCursor() {
        return cursor.get();
    }
}
