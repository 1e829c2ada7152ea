package fr.lapetina.inference.router.domain.event;

import fr.lapetina.inference.router.domain.routing.ForwardOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The caller's side of one request in the pipeline.
 *
 * Several paths can end a request (the dispatch stage, the forward callback, the
 * pipeline's exception handler, shutdown). Only the first {@link #resolve} counts:
 * it reports a failure to the failure counter, then completes the caller's future.
 */
public final class PendingOutcome {

    private final String requestId;
    private final Runnable failureCounter;
    private final CompletableFuture<ForwardOutcome> future = new CompletableFuture<>();
    private final AtomicBoolean resolved = new AtomicBoolean(false);

    public PendingOutcome(String requestId, Runnable failureCounter) {
        this.requestId = requestId;
        this.failureCounter = failureCounter;
    }

    public String requestId() {
        return requestId;
    }

    public CompletableFuture<ForwardOutcome> future() {
        return future;
    }

    public boolean isResolved() {
        return resolved.get();
    }

    /**
     * Delivers the outcome unless another path already did.
     *
     * @return true if this call delivered it
     */
    public boolean resolve(ForwardOutcome outcome) {
        if (!resolved.compareAndSet(false, true)) {
            return false;
        }
        // Counted before the caller can observe the outcome
        if (!outcome.isSuccess()) {
            failureCounter.run();
        }
        future.complete(outcome);
        return true;
    }
}
