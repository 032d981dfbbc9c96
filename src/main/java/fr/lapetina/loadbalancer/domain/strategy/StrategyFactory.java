package fr.lapetina.loadbalancer.domain.strategy;

/**
 * Factory for creating load balancing strategies.
 */
public final class StrategyFactory {

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Creates a fresh strategy for the given algorithm.
     */
    public static LoadBalancingStrategy create(SelectionAlgorithm algorithm) {
        return switch (algorithm) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_CONN -> new LeastConnectionsStrategy();
            case RANDOM -> new RandomStrategy();
        };
    }
}
