package fr.lapetina.loadbalancer.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.loadbalancer.domain.event.LoadBalancerEvent;

/**
 * Final stage handler: releases the slot's references so reports are not
 * retained until the ring wraps around.
 */
public final class ClearingHandler implements EventHandler<LoadBalancerEvent> {

    @Override
    public void onEvent(LoadBalancerEvent event, long sequence, boolean endOfBatch) {
        event.clear();
    }
}
