package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Third stage handler: caps the number of requests in flight across all workers.
 *
 * A slot is taken here and given back by the dispatch callback once the request
 * is resolved.
 */
public final class RateLimitHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    // Threshold for warning about approaching capacity (percentage)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final int maxGlobalInFlight;
    private volatile boolean capacityWarningLogged = false;

    public RateLimitHandler(int maxGlobalInFlight) {
        this.maxGlobalInFlight = maxGlobalInFlight;
        log.info("RateLimitHandler initialized: maxGlobalInFlight={}", maxGlobalInFlight);
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != RequestState.ROUTED) {
            return;
        }

        // Single consumer thread: check-then-increment cannot overshoot
        int current = globalInFlight.get();
        if (current >= maxGlobalInFlight) {
            event.reject(RequestState.RATE_LIMITED, ErrorType.CAPACITY_ERROR,
                    "Global in-flight limit reached: " + current + "/" + maxGlobalInFlight);
            log.warn("Rate limited: requestId={}, globalInFlight={}, max={}",
                    event.getRequest().requestId(), current, maxGlobalInFlight);
            return;
        }

        checkCapacityThreshold(current);
        int admitted = globalInFlight.incrementAndGet();
        event.markAdmitted();

        log.debug("Request admitted: requestId={}, nodeId={}, globalInFlight={}/{}",
                event.getRequest().requestId(), event.getOwner().getId(), admitted, maxGlobalInFlight);
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxGlobalInFlight;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching global capacity threshold: globalInFlight={}/{} ({}%)",
                    current, maxGlobalInFlight, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }

    /**
     * Gives back the slot of a resolved request.
     */
    public void releaseSlot() {
        int remaining = globalInFlight.decrementAndGet();
        log.debug("Global slot released: globalInFlight={}/{}", remaining, maxGlobalInFlight);
    }

    public int getGlobalInFlight() {
        return globalInFlight.get();
    }

    public int getMaxGlobalInFlight() {
        return maxGlobalInFlight;
    }
}
