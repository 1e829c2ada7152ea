package fr.lapetina.inference.router.worker;

import fr.lapetina.inference.router.batch.BatchExecutionException;
import fr.lapetina.inference.router.batch.BatchMetrics;
import fr.lapetina.inference.router.batch.BatchQueue;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Request intake of a worker: hands each request to the batch queue and waits,
 * bounded by the result timeout, for its result.
 *
 * <p>A caller that gives up only stops waiting. Its request stays in its batch and
 * the batch still executes for the other callers.
 */
public final class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private final String nodeId;
    private final BatchQueue batchQueue;
    private final Duration resultTimeout;
    private final MetricsRegistry metricsRegistry;

    private final AtomicInteger activeRequests = new AtomicInteger();
    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder totalProcessed = new LongAdder();
    private final LongAdder totalFailed = new LongAdder();
    private final LongAdder totalTimedOut = new LongAdder();

    public WorkerService(String nodeId, BatchQueue batchQueue, Duration resultTimeout, MetricsRegistry metricsRegistry) {
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID is required");
        this.batchQueue = Objects.requireNonNull(batchQueue, "Batch queue is required");
        this.resultTimeout = Objects.requireNonNull(resultTimeout, "Result timeout is required");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "Metrics registry is required");
    }

    /**
     * Runs one request through the batch queue.
     *
     * @return the request's result, or an error result; never null
     */
    public InferenceResult infer(InferenceRequest request) {
        InferenceRequest received = request.arrivedAt(Instant.now());
        totalRequests.increment();
        activeRequests.incrementAndGet();
        long start = System.nanoTime();

        try {
            CompletableFuture<InferenceResult> future = batchQueue.submit(received);
            InferenceResult result = future.get(resultTimeout.toMillis(), TimeUnit.MILLISECONDS);
            totalProcessed.increment();
            return result;

        } catch (TimeoutException e) {
            totalTimedOut.increment();
            log.warn("Result not ready in time: requestId={}, timeoutMs={}", received.requestId(),
                    resultTimeout.toMillis());
            return failure(received, ErrorType.TIMEOUT,
                    "Result not ready within " + resultTimeout.toMillis() + "ms");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BatchExecutionException batchError) {
                return failure(received, ErrorType.BATCH_EXECUTION_ERROR,
                        "Batch " + batchError.getBatchId() + " failed: " + batchError.getMessage());
            }
            if (cause instanceof RejectedExecutionException) {
                return failure(received, ErrorType.CAPACITY_ERROR, "Worker is shutting down");
            }
            log.error("Unexpected batch error: requestId={}", received.requestId(), cause);
            return failure(received, ErrorType.INTERNAL_ERROR, String.valueOf(cause));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(received, ErrorType.INTERNAL_ERROR, "Interrupted while waiting for result");

        } finally {
            activeRequests.decrementAndGet();
            metricsRegistry.recordStageLatency("batch_wait", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private InferenceResult failure(InferenceRequest request, ErrorType errorType, String message) {
        totalFailed.increment();
        metricsRegistry.incrementErrorCount(nodeId, errorType);
        long latencyMs = Duration.between(request.arrivalTime(), Instant.now()).toMillis();
        return InferenceResult.error(request.requestId(), nodeId, errorType, message, latencyMs);
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    public long getTotalRequests() {
        return totalRequests.sum();
    }

    /**
     * Requests that received a successful result.
     */
    public long getTotalProcessed() {
        return totalProcessed.sum();
    }

    public long getTotalFailed() {
        return totalFailed.sum();
    }

    public long getTotalTimedOut() {
        return totalTimedOut.sum();
    }

    public int getQueueDepth() {
        return batchQueue.queueDepth();
    }

    public BatchMetrics getBatchMetrics() {
        return batchQueue.metrics();
    }

    public boolean isAcceptingRequests() {
        return !batchQueue.isClosed();
    }
}
