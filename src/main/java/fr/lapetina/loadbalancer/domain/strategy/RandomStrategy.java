package fr.lapetina.loadbalancer.domain.strategy;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random load balancing strategy.
 *
 * Samples a backend uniformly and resamples while the sample is dead, at
 * most once per pool member. If every sample missed, falls back to a
 * uniform pick among the alive backends of one scan, so the call always
 * terminates and only returns empty when nothing is alive.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public SelectionAlgorithm getAlgorithm() {
        return SelectionAlgorithm.RANDOM;
    }

    @Override
    public Optional<Backend> selectBackend(BackendPool pool) {
        if (pool == null || pool.isEmpty()) {
            return Optional.empty();
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        int size = pool.size();

        for (int attempt = 0; attempt < size; attempt++) {
            Backend candidate = pool.get(random.nextInt(size));
            if (candidate.isAlive()) {
                return Optional.of(candidate);
            }
        }

        List<Backend> alive = new ArrayList<>(size);
        for (Backend backend : pool) {
            if (backend.isAlive()) {
                alive.add(backend);
            }
        }

        if (alive.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(alive.get(random.nextInt(alive.size())));
    }
}
