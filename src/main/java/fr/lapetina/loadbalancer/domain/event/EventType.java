package fr.lapetina.loadbalancer.domain.event;

/**
 * Kind of payload carried by a {@link LoadBalancerEvent} slot.
 */
public enum EventType {
    REQUEST,
    HEALTH
}
