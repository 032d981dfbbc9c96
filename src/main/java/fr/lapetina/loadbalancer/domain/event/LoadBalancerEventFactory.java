package fr.lapetina.loadbalancer.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating LoadBalancerEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by
 * clearing and re-initializing them.
 */
public final class LoadBalancerEventFactory implements EventFactory<LoadBalancerEvent> {

    @Override
    public LoadBalancerEvent newInstance() {
        return new LoadBalancerEvent();
    }
}
