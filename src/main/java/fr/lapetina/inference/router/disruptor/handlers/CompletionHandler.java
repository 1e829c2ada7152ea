package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs the pipeline summary and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getRequest() != null) {
                log.debug("Pipeline done: requestId={}, state={}, nodeId={}, sequence={}",
                        event.getRequest().requestId(),
                        event.getState(),
                        event.getOwner() != null ? event.getOwner().getId() : "none",
                        sequence);
            }
        } finally {
            event.clear();
        }
    }
}
