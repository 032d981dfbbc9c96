package fr.lapetina.loadbalancer.domain.event;

/**
 * Mutable event slot for the Disruptor ring buffer.
 *
 * Slots are pre-allocated and reused: a producer fills one with either a
 * request or a health report, handlers read it, and the last handler
 * clears it.
 *
 * NOT thread-safe - the Disruptor guarantees handler ordering per slot.
 */
public final class LoadBalancerEvent {

    private EventType type;
    private RequestEvent requestEvent;
    private HealthEvent healthEvent;
    private long publishedAtNanos;

    public void initialize(RequestEvent event) {
        this.type = EventType.REQUEST;
        this.requestEvent = event;
        this.healthEvent = null;
        this.publishedAtNanos = System.nanoTime();
    }

    public void initialize(HealthEvent event) {
        this.type = EventType.HEALTH;
        this.healthEvent = event;
        this.requestEvent = null;
        this.publishedAtNanos = System.nanoTime();
    }

    public void clear() {
        this.type = null;
        this.requestEvent = null;
        this.healthEvent = null;
        this.publishedAtNanos = 0L;
    }

    public EventType getType() {
        return type;
    }

    public RequestEvent getRequestEvent() {
        return requestEvent;
    }

    public HealthEvent getHealthEvent() {
        return healthEvent;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "LoadBalancerEvent{" +
                "type=" + type +
                ", request=" + requestEvent +
                ", health=" + healthEvent +
                '}';
    }
}
