package fr.lapetina.inference.router.domain.model;

/**
 * Error taxonomy carried by {@link InferenceResult}.
 * Used for HTTP status mapping, retry decisions and metrics tags.
 */
public enum ErrorType {
    /** Malformed request sent by the client */
    CLIENT_ERROR,

    /** Request rejected by gateway validation */
    VALIDATION_ERROR,

    /** No worker registered on the ring */
    NO_AVAILABLE_NODE,

    /** Gateway backpressure: ring buffer full or global in-flight cap reached */
    CAPACITY_ERROR,

    /** Compute engine failed for the whole batch */
    BATCH_EXECUTION_ERROR,

    /** Worker-side wait for the batch result exceeded its bound */
    TIMEOUT,

    /** Gateway-to-worker call exceeded the forwarding timeout */
    FORWARDING_TIMEOUT,

    /** Worker could not be reached */
    CONNECTION_ERROR,

    /** Worker answered with a failure status */
    WORKER_ERROR,

    /** Circuit breaker is open for the target worker */
    CIRCUIT_OPEN,

    /** Unexpected failure inside the router */
    INTERNAL_ERROR
}
