package fr.lapetina.inference.router.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the gateway ring buffer events. Events are then reused by
 * clearing and re-initializing them.
 */
public final class GatewayRequestEventFactory implements EventFactory<GatewayRequestEvent> {

    @Override
    public GatewayRequestEvent newInstance() {
        return new GatewayRequestEvent();
    }
}
