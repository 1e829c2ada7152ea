package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.PendingOutcome;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.infrastructure.http.RequestForwarder;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fourth stage handler: forwards admitted requests and resolves the caller's future.
 *
 * The forward is asynchronous. The event is recycled by the last stage before the
 * worker answers, so the callback only works on values copied out of the event here.
 */
public final class DispatchHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final RequestForwarder forwarder;
    private final RateLimitHandler rateLimitHandler;
    private final GatewayStats stats;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public DispatchHandler(
            RequestForwarder forwarder,
            RateLimitHandler rateLimitHandler,
            GatewayStats stats,
            MetricsRegistry metrics,
            Clock clock
    ) {
        this.forwarder = forwarder;
        this.rateLimitHandler = rateLimitHandler;
        this.stats = stats;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            completeWithError(event);
            return;
        }

        if (event.getState() != RequestState.ROUTED || !event.isAdmitted()) {
            event.reject(RequestState.FAILED_TERMINAL, ErrorType.INTERNAL_ERROR,
                    "Invalid state for dispatch: " + event.getState());
            completeWithError(event);
            return;
        }

        dispatch(event);
    }

    private void dispatch(GatewayRequestEvent event) {
        InferenceRequest request = event.getRequest();
        WorkerEndpoint owner = event.getOwner();
        PendingOutcome pending = event.getPending();
        Instant dispatchedAt = clock.instant();
        event.markForwarded(dispatchedAt);

        log.debug("Forwarding request: requestId={}, nodeId={}, url={}",
                request.requestId(), owner.getId(), owner.getBaseUrl());

        CompletableFuture<ForwardOutcome> forwarded;
        try {
            forwarded = forwarder.forward(request, owner);
        } catch (RuntimeException e) {
            log.error("Forwarding could not start: requestId={}, nodeId={}", request.requestId(), owner.getId(), e);
            InferenceResult error = InferenceResult.error(request.requestId(), owner.getId(),
                    ErrorType.INTERNAL_ERROR, e.toString(), 0);
            forwarded = CompletableFuture.completedFuture(
                    new ForwardOutcome(error, RequestState.FAILED_TERMINAL, 1, List.of(owner.getId())));
        }

        forwarded.whenComplete((outcome, throwable) -> {
            ForwardOutcome resolved = outcome;
            if (throwable != null) {
                InferenceResult error = InferenceResult.error(request.requestId(), owner.getId(),
                        ErrorType.INTERNAL_ERROR, throwable.toString(), 0);
                resolved = new ForwardOutcome(error, RequestState.FAILED_TERMINAL, 1, List.of(owner.getId()));
            }
            try {
                onForwarded(request, dispatchedAt, resolved);
            } catch (RuntimeException e) {
                log.error("Failed to record outcome: requestId={}", request.requestId(), e);
            } finally {
                // Slot is free before the caller sees the outcome
                rateLimitHandler.releaseSlot();
            }
            deliver(pending, resolved);
        });
    }

    private void onForwarded(InferenceRequest request, Instant dispatchedAt, ForwardOutcome outcome) {
        InferenceResult result = outcome.result();
        String nodeId = result.workerId() != null ? result.workerId() : "none";

        metrics.recordStageLatency("forward", Duration.between(dispatchedAt, clock.instant()));
        metrics.incrementRequestCount(nodeId, outcome.finalState());

        if (outcome.isSuccess()) {
            log.info("Request completed: requestId={}, nodeId={}, attempts={}, batchId={}, batchSize={}, latencyMs={}",
                    request.requestId(), nodeId, outcome.attempts(), result.batchId(), result.batchSize(),
                    result.latencyMs());
        } else {
            log.warn("Request failed: requestId={}, nodesTried={}, attempts={}, errorType={}, error={}, latencyMs={}",
                    request.requestId(), outcome.nodesTried(), outcome.attempts(), result.errorType(),
                    result.errorMessage(), result.latencyMs());
        }
    }

    private void completeWithError(GatewayRequestEvent event) {
        if (event.getPending() != null && event.getPending().isResolved()) {
            // Already answered by the pipeline's exception handler
            return;
        }

        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        InferenceRequest request = event.getRequest();
        String requestId = request != null ? request.requestId() : "unknown";
        long latencyMs = event.getAcceptedAt() != null
                ? Duration.between(event.getAcceptedAt(), clock.instant()).toMillis()
                : 0;

        InferenceResult error = InferenceResult.error(requestId, null, errorType, event.getErrorMessage(), latencyMs);
        RequestState state = event.getState() != null ? event.getState() : RequestState.FAILED_TERMINAL;

        log.warn("Completing request with pre-dispatch error: requestId={}, state={}, errorType={}, error={}",
                requestId, state, errorType, event.getErrorMessage());

        deliver(event.getPending(), new ForwardOutcome(error, state, 0, List.of()));
    }

    private void deliver(PendingOutcome pending, ForwardOutcome outcome) {
        if (pending == null) {
            if (!outcome.isSuccess()) {
                stats.recordFailure();
            }
            return;
        }
        if (!pending.resolve(outcome)) {
            log.debug("Outcome already delivered: requestId={}, state={}", pending.requestId(), outcome.finalState());
        }
    }
}
