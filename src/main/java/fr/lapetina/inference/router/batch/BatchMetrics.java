package fr.lapetina.inference.router.batch;

/**
 * Point-in-time counters of a {@link BatchQueue}.
 *
 * @param totalRequests   requests accepted by the queue
 * @param totalBatches    batches closed, whatever the reason
 * @param fullBatches     batches closed because they reached the maximum size
 * @param timeoutBatches  batches closed by their deadline
 * @param shutdownBatches batches flushed on close
 * @param failedBatches   batches whose execution failed
 * @param batchedRequests requests that were part of a closed batch
 * @param queueDepth      requests waiting in the pending batch
 */
public record BatchMetrics(
        long totalRequests,
        long totalBatches,
        long fullBatches,
        long timeoutBatches,
        long shutdownBatches,
        long failedBatches,
        long batchedRequests,
        int queueDepth
) {
    /**
     * Average size of the closed batches, 0 when none closed yet.
     */
    public double avgBatchSize() {
        return totalBatches == 0 ? 0.0 : (double) batchedRequests / totalBatches;
    }
}
