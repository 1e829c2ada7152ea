package fr.lapetina.inference.router.batch;

import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-worker dynamic batching queue.
 *
 * <p>Requests accumulate in a pending batch that closes when it reaches
 * {@code maxBatchSize} or when {@code timeout} has elapsed since its first request,
 * whichever comes first. A closed batch is swapped out for a fresh one under the
 * lock, then executed once on the execution pool; submitters never wait for an
 * executing batch to join the next one.
 *
 * <p>Each submission gets its own {@link CompletableFuture}. Outputs are paired with
 * requests by index. A failed execution completes every future of the batch
 * exceptionally with {@link BatchExecutionException}. Cancelling one future only
 * drops that caller's wait; the batch still runs for the others.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (BatchQueue queue = BatchQueue.builder()
 *         .workerId("worker_8001")
 *         .maxBatchSize(32)
 *         .timeout(Duration.ofMillis(20))
 *         .engine(engine)
 *         .build()) {
 *     InferenceResult result = queue.submit(request).get();
 * }
 * }</pre>
 */
public final class BatchQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchQueue.class);

    private final String workerId;
    private final int maxBatchSize;
    private final Duration timeout;
    private final ComputeEngine engine;
    private final ScheduledExecutorService deadlineScheduler;
    private final ExecutorService executionPool;

    // Guards pending and closed
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong batchIds = new AtomicLong();
    private PendingBatch pending;
    private boolean closed;

    private final AtomicInteger queueDepth = new AtomicInteger();
    private final AtomicInteger executingBatches = new AtomicInteger();
    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder totalBatches = new LongAdder();
    private final LongAdder fullBatches = new LongAdder();
    private final LongAdder timeoutBatches = new LongAdder();
    private final LongAdder shutdownBatches = new LongAdder();
    private final LongAdder failedBatches = new LongAdder();
    private final LongAdder batchedRequests = new LongAdder();

    private BatchQueue(Builder builder) {
        this.workerId = Objects.requireNonNull(builder.workerId, "Worker ID is required");
        this.engine = Objects.requireNonNull(builder.engine, "Compute engine is required");
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout is required");
        if (builder.maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1, got " + builder.maxBatchSize);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (builder.executionThreads < 1) {
            throw new IllegalArgumentException("executionThreads must be >= 1, got " + builder.executionThreads);
        }
        this.maxBatchSize = builder.maxBatchSize;

        this.deadlineScheduler = Executors.newSingleThreadScheduledExecutor(
                namedThreads("batch-deadline-" + workerId));
        this.executionPool = Executors.newFixedThreadPool(
                builder.executionThreads, namedThreads("batch-exec-" + workerId));
        this.pending = new PendingBatch(batchIds.incrementAndGet());

        log.info("BatchQueue created: workerId={}, maxBatchSize={}, timeoutMs={}, executionThreads={}",
                workerId, maxBatchSize, timeout.toMillis(), builder.executionThreads);
    }

    /**
     * Adds a request to the pending batch.
     *
     * @return future completed with the request's result once its batch has executed,
     *         or exceptionally with {@link BatchExecutionException} if the batch failed,
     *         or {@link RejectedExecutionException} if the queue is closed
     */
    public CompletableFuture<InferenceResult> submit(InferenceRequest request) {
        Objects.requireNonNull(request, "Request is required");
        CompletableFuture<InferenceResult> future = new CompletableFuture<>();

        lock.lock();
        try {
            if (closed) {
                future.completeExceptionally(
                        new RejectedExecutionException("Batch queue is closed: workerId=" + workerId));
                return future;
            }

            PendingBatch batch = pending;
            batch.add(request, future);
            queueDepth.incrementAndGet();
            totalRequests.increment();

            if (batch.size() >= maxBatchSize) {
                dispatch(swapLocked(BatchCloseReason.SIZE));
            } else if (batch.size() == 1) {
                long batchId = batch.id;
                batch.deadline = deadlineScheduler.schedule(
                        () -> onDeadline(batchId), timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
        return future;
    }

    /**
     * Number of requests in the pending batch.
     */
    public int queueDepth() {
        return queueDepth.get();
    }

    /**
     * Number of batches currently executing.
     */
    public int executingBatches() {
        return executingBatches.get();
    }

    public BatchMetrics metrics() {
        return new BatchMetrics(
                totalRequests.sum(),
                totalBatches.sum(),
                fullBatches.sum(),
                timeoutBatches.sum(),
                shutdownBatches.sum(),
                failedBatches.sum(),
                batchedRequests.sum(),
                queueDepth.get()
        );
    }

    public String getWorkerId() {
        return workerId;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes the pending batch, waits for executing batches to finish and rejects
     * any later submission.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (pending.size() > 0) {
                dispatch(swapLocked(BatchCloseReason.SHUTDOWN));
            }
        } finally {
            lock.unlock();
        }

        deadlineScheduler.shutdownNow();
        executionPool.shutdown();
        try {
            if (!executionPool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Batch execution pool did not terminate in time: workerId={}", workerId);
                executionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executionPool.shutdownNow();
        }
        log.info("BatchQueue closed: workerId={}, totalBatches={}", workerId, totalBatches.sum());
    }

    private void onDeadline(long batchId) {
        lock.lock();
        try {
            // The batch may already have closed by size; its successor has a different id
            if (!closed && pending.id == batchId && pending.size() > 0) {
                dispatch(swapLocked(BatchCloseReason.TIMEOUT));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the pending batch and installs a fresh one. Caller holds the lock.
     */
    private ClosedBatch swapLocked(BatchCloseReason reason) {
        PendingBatch current = pending;
        if (current.deadline != null) {
            current.deadline.cancel(false);
        }
        pending = new PendingBatch(batchIds.incrementAndGet());
        queueDepth.addAndGet(-current.size());

        Batch batch = new Batch(current.id, current.requests, current.createdAt, Instant.now(), reason);
        totalBatches.increment();
        batchedRequests.add(batch.size());
        switch (reason) {
            case SIZE -> fullBatches.increment();
            case TIMEOUT -> timeoutBatches.increment();
            case SHUTDOWN -> shutdownBatches.increment();
        }
        return new ClosedBatch(batch, current.waiters);
    }

    /**
     * Hands a closed batch to the execution pool. Called under the lock so that
     * {@link #close()} cannot shut the pool down between a swap and its dispatch.
     */
    private void dispatch(ClosedBatch closedBatch) {
        try {
            executionPool.execute(() -> execute(closedBatch));
        } catch (RejectedExecutionException e) {
            log.error("Batch execution rejected: workerId={}, batchId={}", workerId, closedBatch.batch.batchId(), e);
            fail(closedBatch, new BatchExecutionException(closedBatch.batch.batchId(), closedBatch.batch.size(),
                    "Batch execution rejected", e));
        }
    }

    private void execute(ClosedBatch closedBatch) {
        Batch batch = closedBatch.batch;
        executingBatches.incrementAndGet();
        long start = System.nanoTime();
        try {
            log.debug("Executing batch: workerId={}, batchId={}, size={}, reason={}, ageMs={}",
                    workerId, batch.batchId(), batch.size(), batch.closeReason(), batch.age().toMillis());

            List<Object> outputs = engine.execute(batch);
            if (outputs == null || outputs.size() != batch.size()) {
                throw new ComputeException("Engine returned " + (outputs == null ? "no" : outputs.size())
                        + " outputs for a batch of " + batch.size());
            }

            Instant now = Instant.now();
            for (int i = 0; i < batch.size(); i++) {
                InferenceRequest request = batch.requests().get(i);
                long latencyMs = Duration.between(request.arrivalTime(), now).toMillis();
                closedBatch.waiters.get(i).complete(InferenceResult.success(
                        request.requestId(), outputs.get(i), workerId, latencyMs, batch.batchId(), batch.size()));
            }

            log.debug("Batch completed: workerId={}, batchId={}, size={}, computeMs={}",
                    workerId, batch.batchId(), batch.size(), (System.nanoTime() - start) / 1_000_000);
        } catch (ComputeException e) {
            log.warn("Batch failed: workerId={}, batchId={}, size={}, error={}",
                    workerId, batch.batchId(), batch.size(), e.getMessage());
            fail(closedBatch, new BatchExecutionException(batch.batchId(), batch.size(), e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("Unexpected error executing batch: workerId={}, batchId={}", workerId, batch.batchId(), e);
            fail(closedBatch, new BatchExecutionException(batch.batchId(), batch.size(),
                    "Unexpected engine error: " + e.getMessage(), e));
        } catch (Error e) {
            // Waiters still fail; the error itself goes on to the pool thread
            log.error("Fatal error executing batch: workerId={}, batchId={}", workerId, batch.batchId(), e);
            fail(closedBatch, new BatchExecutionException(batch.batchId(), batch.size(),
                    "Fatal engine error: " + e, e));
            throw e;
        } finally {
            executingBatches.decrementAndGet();
        }
    }

    private void fail(ClosedBatch closedBatch, BatchExecutionException error) {
        failedBatches.increment();
        for (CompletableFuture<InferenceResult> waiter : closedBatch.waiters) {
            waiter.completeExceptionally(error);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Batch still accepting requests. Only touched under the queue lock.
     */
    private static final class PendingBatch {
        final long id;
        Instant createdAt;
        final List<InferenceRequest> requests = new ArrayList<>();
        final List<CompletableFuture<InferenceResult>> waiters = new ArrayList<>();
        ScheduledFuture<?> deadline;

        PendingBatch(long id) {
            this.id = id;
        }

        void add(InferenceRequest request, CompletableFuture<InferenceResult> waiter) {
            if (requests.isEmpty()) {
                createdAt = Instant.now();
            }
            requests.add(request);
            waiters.add(waiter);
        }

        int size() {
            return requests.size();
        }
    }

    private record ClosedBatch(Batch batch, List<CompletableFuture<InferenceResult>> waiters) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String workerId;
        private int maxBatchSize = 32;
        private Duration timeout = Duration.ofMillis(20);
        private int executionThreads = 2;
        private ComputeEngine engine;

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder executionThreads(int executionThreads) {
            this.executionThreads = executionThreads;
            return this;
        }

        public Builder engine(ComputeEngine engine) {
            this.engine = engine;
            return this;
        }

        public BatchQueue build() {
            return new BatchQueue(this);
        }
    }
}
