package fr.lapetina.loadbalancer.domain.strategy;

import java.util.Locale;

/**
 * Closed set of selection algorithms.
 * Unrecognized configuration names resolve to {@link #RANDOM}.
 */
public enum SelectionAlgorithm {
    ROUND_ROBIN("roundrobin"),
    LEAST_CONN("leastconn"),
    RANDOM("random");

    private final String configName;

    SelectionAlgorithm(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configured name. Never fails: null, blank or unknown names give {@link #RANDOM}.
     */
    public static SelectionAlgorithm fromName(String name) {
        if (name == null) {
            return RANDOM;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SelectionAlgorithm algorithm : values()) {
            if (algorithm.configName.equals(normalized)) {
                return algorithm;
            }
        }
        return RANDOM;
    }

    /**
     * True if the name maps to an algorithm without falling back.
     */
    public static boolean isKnown(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SelectionAlgorithm algorithm : values()) {
            if (algorithm.configName.equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}
