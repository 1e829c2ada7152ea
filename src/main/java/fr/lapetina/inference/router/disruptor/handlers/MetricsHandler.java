package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * Fifth stage handler: records pipeline metrics.
 *
 * Records:
 * - Stage latencies up to dispatch
 * - Final state and error type of requests that never reached a worker
 * - Global in-flight and ring buffer gauges
 *
 * Forwarded requests are counted by the dispatch callback once their outcome is known.
 */
public final class MetricsHandler implements EventHandler<GatewayRequestEvent> {

    private final MetricsRegistry metricsRegistry;
    private final IntSupplier globalInFlight;
    private final LongSupplier ringBufferRemaining;

    public MetricsHandler(MetricsRegistry metricsRegistry, IntSupplier globalInFlight, LongSupplier ringBufferRemaining) {
        this.metricsRegistry = metricsRegistry;
        this.globalInFlight = globalInFlight;
        this.ringBufferRemaining = ringBufferRemaining;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
        }
        try {
            recordMetrics(event);
            if (endOfBatch) {
                metricsRegistry.setGlobalInFlight(globalInFlight.getAsInt());
                metricsRegistry.setRingBufferRemaining((int) ringBufferRemaining.getAsLong());
            }
        } finally {
            MDC.remove("requestId");
        }
    }

    private void recordMetrics(GatewayRequestEvent event) {
        if (event.getValidatedAt() != null && event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("validation",
                    Duration.between(event.getAcceptedAt(), event.getValidatedAt()));
        }
        if (event.getRoutedAt() != null && event.getValidatedAt() != null) {
            metricsRegistry.recordStageLatency("routing",
                    Duration.between(event.getValidatedAt(), event.getRoutedAt()));
        }
        if (event.getDispatchedAt() != null && event.getRoutedAt() != null) {
            metricsRegistry.recordStageLatency("admission",
                    Duration.between(event.getRoutedAt(), event.getDispatchedAt()));
        }

        RequestState state = event.getState();
        if (state != null && state != RequestState.FORWARDED) {
            metricsRegistry.incrementRequestCount("none", state);
            if (event.getErrorType() != null) {
                metricsRegistry.incrementErrorCount("none", event.getErrorType());
            }
        }
    }
}
