package fr.lapetina.loadbalancer.domain.model;

/**
 * Liveness of a backend as last observed by the health monitor.
 *
 * ALIVE: Backend answered its last probe in time with a success status
 * DEAD: Backend failed its last probe (refused, timed out or non-success status)
 */
public enum BackendHealth {
    ALIVE,
    DEAD
}
