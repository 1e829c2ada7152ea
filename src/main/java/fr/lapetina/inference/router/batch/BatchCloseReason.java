package fr.lapetina.inference.router.batch;

/**
 * Why a pending batch was closed.
 */
public enum BatchCloseReason {
    /** Batch reached the maximum batch size */
    SIZE,

    /** Deadline fired before the batch filled up */
    TIMEOUT,

    /** Queue is closing and flushed its pending batch */
    SHUTDOWN
}
