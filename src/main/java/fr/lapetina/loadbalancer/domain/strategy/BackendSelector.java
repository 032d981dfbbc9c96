package fr.lapetina.loadbalancer.domain.strategy;

import fr.lapetina.loadbalancer.domain.model.Backend;
import fr.lapetina.loadbalancer.domain.model.BackendPool;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for backend selection.
 *
 * Holds one strategy instance per algorithm for the lifetime of the pool,
 * so selection state such as the round-robin cursor is created once and
 * shared by every caller. Pure decision function: never touches counters.
 */
public final class BackendSelector {

    private final Map<SelectionAlgorithm, LoadBalancingStrategy> strategies =
            new EnumMap<>(SelectionAlgorithm.class);

    public BackendSelector() {
        for (SelectionAlgorithm algorithm : SelectionAlgorithm.values()) {
            strategies.put(algorithm, StrategyFactory.create(algorithm));
        }
    }

    /**
     * Selects an alive backend with the given algorithm.
     *
     * @param pool      backend pool, may be empty
     * @param algorithm selection algorithm, null means {@link SelectionAlgorithm#RANDOM}
     * @return an alive backend, or empty if none is alive
     */
    public Optional<Backend> selectBackend(BackendPool pool, SelectionAlgorithm algorithm) {
        SelectionAlgorithm effective = algorithm != null ? algorithm : SelectionAlgorithm.RANDOM;
        return strategies.get(effective).selectBackend(pool);
    }
}
