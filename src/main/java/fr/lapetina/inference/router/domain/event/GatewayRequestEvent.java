package fr.lapetina.inference.router.domain.event;

import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;

import java.time.Instant;

/**
 * Event object for the gateway's Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: the event is cleared by the last stage, while a forwarded request may
 * still be in flight. Anything an asynchronous callback needs must be copied out of
 * the event before the callback is registered.
 */
public final class GatewayRequestEvent {

    private InferenceRequest request;

    private RequestState state;
    private WorkerEndpoint owner;
    private boolean admitted;
    private ErrorType errorType;
    private String errorMessage;

    // Timing
    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant routedAt;
    private Instant dispatchedAt;

    private PendingOutcome pending;

    // Sequence number (set by Disruptor)
    private long sequence;

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.owner = null;
        this.admitted = false;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.routedAt = null;
        this.dispatchedAt = null;
        this.pending = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(InferenceRequest request, PendingOutcome pending, Instant now) {
        clear();
        this.request = request;
        this.pending = pending;
        this.state = RequestState.RECEIVED;
        this.acceptedAt = now;
    }

    public InferenceRequest getRequest() {
        return request;
    }

    public RequestState getState() {
        return state;
    }

    public WorkerEndpoint getOwner() {
        return owner;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getRoutedAt() {
        return routedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public PendingOutcome getPending() {
        return pending;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated(Instant now) {
        this.state = RequestState.VALIDATED;
        this.validatedAt = now;
    }

    public void markRouted(WorkerEndpoint owner, Instant now) {
        this.state = RequestState.ROUTED;
        this.owner = owner;
        this.routedAt = now;
    }

    public void markAdmitted() {
        this.admitted = true;
    }

    /**
     * Drops the admission after its slot was released outside the dispatch stage.
     */
    public void revokeAdmission() {
        this.admitted = false;
    }

    public void markForwarded(Instant now) {
        this.state = RequestState.FORWARDED;
        this.dispatchedAt = now;
    }

    /**
     * Ends the event before dispatch with one of the pre-dispatch terminal states.
     */
    public void reject(RequestState state, ErrorType errorType, String message) {
        this.state = state;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * Checks if processing should skip remaining handlers.
     */
    public boolean shouldSkip() {
        return state == null || state.isTerminal();
    }

    @Override
    public String toString() {
        return "GatewayRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", owner=" + (owner != null ? owner.getId() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
