package fr.lapetina.inference.router.domain.event;

/**
 * Lifecycle state of a request in the gateway pipeline.
 *
 * <pre>
 * RECEIVED → VALIDATED → ROUTED → FORWARDED → COMPLETED
 *                                           → FAILED → (RETRIED → FORWARDED)* → FAILED_TERMINAL
 * </pre>
 *
 * FAILED and RETRIED are attempt-level states: the pipeline event stays FORWARDED
 * while the forwarder walks ring successors, and each failed or retried attempt is
 * counted under its state in the per-node request metrics.
 */
public enum RequestState {
    /** Event just published, awaiting validation */
    RECEIVED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** Owner node resolved on the hash ring */
    ROUTED,

    /** Ring is empty */
    NO_ROUTE,

    /** Rejected by the global in-flight cap */
    RATE_LIMITED,

    /** Request sent to a worker */
    FORWARDED,

    /** Worker returned a result */
    COMPLETED,

    /** One attempt failed; the retry policy decides what comes next */
    FAILED,

    /** Sent again to the next distinct worker on the ring */
    RETRIED,

    /** Request failed and no further attempt will be made */
    FAILED_TERMINAL;

    /**
     * True for the states a request can finish in.
     */
    public boolean isTerminal() {
        return this == COMPLETED
                || this == FAILED_TERMINAL
                || this == VALIDATION_FAILED
                || this == NO_ROUTE
                || this == RATE_LIMITED;
    }
}
