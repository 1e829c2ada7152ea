package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.ring.EmptyRingException;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Second stage handler: resolves the owner of the routing key on the hash ring.
 *
 * Health does not take part in the choice: a key always goes to its ring owner.
 */
public final class RoutingHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RoutingHandler.class);

    private final WorkerRegistry registry;
    private final GatewayStats stats;
    private final Clock clock;

    public RoutingHandler(WorkerRegistry registry, GatewayStats stats, Clock clock) {
        this.registry = registry;
        this.stats = stats;
        this.clock = clock;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != RequestState.VALIDATED) {
            return;
        }

        String requestId = event.getRequest().requestId();
        String routingKey = event.getRequest().routingKey();
        try {
            WorkerEndpoint owner = registry.route(routingKey);
            event.markRouted(owner, clock.instant());
            log.debug("Request routed: requestId={}, routingKey={}, nodeId={}", requestId, routingKey, owner.getId());
        } catch (EmptyRingException e) {
            stats.recordUnrouted();
            event.reject(RequestState.NO_ROUTE, ErrorType.NO_AVAILABLE_NODE, e.getMessage());
            log.warn("No worker available: requestId={}, routingKey={}", requestId, routingKey);
        }
    }
}
