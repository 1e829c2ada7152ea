package fr.lapetina.inference.router.batch;

/**
 * Delivered to every request of a batch whose execution failed.
 */
public class BatchExecutionException extends RuntimeException {

    private final long batchId;
    private final int batchSize;

    public BatchExecutionException(long batchId, int batchSize, String message, Throwable cause) {
        super(message, cause);
        this.batchId = batchId;
        this.batchSize = batchSize;
    }

    public long getBatchId() {
        return batchId;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
