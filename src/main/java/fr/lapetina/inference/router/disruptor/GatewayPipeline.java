package fr.lapetina.inference.router.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.inference.router.disruptor.exception.BackpressureException;
import fr.lapetina.inference.router.disruptor.handlers.CompletionHandler;
import fr.lapetina.inference.router.disruptor.handlers.DispatchHandler;
import fr.lapetina.inference.router.disruptor.handlers.MetricsHandler;
import fr.lapetina.inference.router.disruptor.handlers.RateLimitHandler;
import fr.lapetina.inference.router.disruptor.handlers.RoutingHandler;
import fr.lapetina.inference.router.disruptor.handlers.ValidationHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.GatewayRequestEventFactory;
import fr.lapetina.inference.router.domain.event.PendingOutcome;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.http.RequestForwarder;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline the gateway runs every inference request through.
 *
 * <p>Stages, each on its own consumer thread:
 * <pre>
 * Validation → Routing (hash ring) → Admission (global in-flight cap) → Dispatch → Metrics → Completion
 * </pre>
 *
 * <p>MULTI producer: HTTP handler threads publish concurrently. A full ring buffer
 * is reported to the publisher with {@link BackpressureException} instead of
 * blocking it. The dispatch stage only starts the forward; the caller's future is
 * completed from the HTTP client's callback, so a slow worker never holds a
 * consumer thread.
 */
public final class GatewayPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayPipeline.class);

    private final Disruptor<GatewayRequestEvent> disruptor;
    private final RingBuffer<GatewayRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final GatewayStats stats;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final Set<PendingOutcome> unfinished = ConcurrentHashMap.newKeySet();

    private final ValidationHandler validationHandler;
    private final RoutingHandler routingHandler;
    private final RateLimitHandler rateLimitHandler;
    private final DispatchHandler dispatchHandler;
    private final MetricsHandler metricsHandler;
    private final CompletionHandler completionHandler;

    private GatewayPipeline(Builder builder) {
        this.stats = builder.stats;
        this.clock = builder.clock;
        this.shutdownGrace = builder.shutdownGrace;

        this.disruptor = new Disruptor<>(
                new GatewayRequestEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("gateway-pipeline"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        this.ringBuffer = disruptor.getRingBuffer();

        this.validationHandler = new ValidationHandler(builder.maxKeyLength, clock);
        this.routingHandler = new RoutingHandler(builder.registry, stats, clock);
        this.rateLimitHandler = new RateLimitHandler(builder.maxGlobalInFlight);
        this.dispatchHandler = new DispatchHandler(builder.forwarder, rateLimitHandler, stats,
                builder.metricsRegistry, clock);
        this.metricsHandler = new MetricsHandler(builder.metricsRegistry,
                rateLimitHandler::getGlobalInFlight, ringBuffer::remainingCapacity);
        this.completionHandler = new CompletionHandler();

        disruptor
                .handleEventsWith(validationHandler)
                .then(routingHandler)
                .then(rateLimitHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        log.info("GatewayPipeline created: ringBufferSize={}, waitStrategy={}, maxGlobalInFlight={}",
                builder.ringBufferSize, builder.waitStrategy, builder.maxGlobalInFlight);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("GatewayPipeline started");
        }
    }

    /**
     * Publishes a request into the pipeline.
     *
     * @return future completed with what the gateway did with the request; never
     *         completes exceptionally
     * @throws BackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public CompletableFuture<ForwardOutcome> submit(InferenceRequest request) {
        stats.recordRequest();
        if (!running.get()) {
            stats.recordFailure();
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            stats.recordFailure();
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        PendingOutcome pending = new PendingOutcome(request.requestId(), stats::recordFailure);
        unfinished.add(pending);
        pending.future().whenComplete((outcome, throwable) -> unfinished.remove(pending));

        try {
            ringBuffer.get(sequence).initialize(request, pending, clock.instant());
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);
        return pending.future();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getGlobalInFlight() {
        return rateLimitHandler.getGlobalInFlight();
    }

    public boolean isRunning() {
        return running.get();
    }

    public RateLimitHandler getRateLimitHandler() {
        return rateLimitHandler;
    }

    /**
     * Drains the ring buffer and stops the consumer threads, then gives forwards
     * already started the shutdown grace period to finish. Requests still
     * unanswered after that are failed with {@link ErrorType#CAPACITY_ERROR}.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down GatewayPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("GatewayPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("GatewayPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
            awaitUnfinished();
            failUnfinished();
        }
    }

    private void awaitUnfinished() {
        CompletableFuture<?>[] futures = unfinished.stream()
                .map(PendingOutcome::future)
                .toArray(CompletableFuture[]::new);
        if (futures.length == 0) {
            return;
        }
        log.info("Waiting up to {}ms for {} in-flight requests", shutdownGrace.toMillis(), futures.length);
        try {
            CompletableFuture.allOf(futures).get(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | CancellationException e) {
            // A caller cancelled its own future; the others are done
            log.debug("In-flight wait ended by a cancelled request", e);
        } catch (java.util.concurrent.TimeoutException e) {
            log.warn("{} requests still in flight after {}ms", unfinished.size(), shutdownGrace.toMillis());
        }
    }

    private void failUnfinished() {
        int failed = 0;
        for (PendingOutcome pending : List.copyOf(unfinished)) {
            InferenceResult error = InferenceResult.error(pending.requestId(), null, ErrorType.CAPACITY_ERROR,
                    "Pipeline stopped before the request completed", 0);
            if (pending.resolve(new ForwardOutcome(error, RequestState.FAILED_TERMINAL, 0, List.of()))) {
                failed++;
            }
        }
        unfinished.clear();
        if (failed > 0) {
            log.warn("Failed {} unfinished requests on shutdown", failed);
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name == null ? "" : name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Resolves the caller with an internal error when a handler throws, so that no
     * request is left hanging.
     */
    private class PipelineExceptionHandler implements ExceptionHandler<GatewayRequestEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, GatewayRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getState() == RequestState.FORWARDED) {
                // The forward callback answers the caller and frees the slot
                return;
            }
            if (event.isAdmitted()) {
                rateLimitHandler.releaseSlot();
                event.revokeAdmission();
            }
            // Later stages skip the event instead of dispatching it
            event.reject(RequestState.FAILED_TERMINAL, ErrorType.INTERNAL_ERROR, ex.toString());

            PendingOutcome pending = event.getPending();
            if (pending != null) {
                String requestId = event.getRequest() != null ? event.getRequest().requestId() : "unknown";
                InferenceResult error = InferenceResult.error(requestId, null, ErrorType.INTERNAL_ERROR,
                        ex.toString(), 0);
                pending.resolve(new ForwardOutcome(error, RequestState.FAILED_TERMINAL, 0, List.of()));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxGlobalInFlight = 1000;
        private int maxKeyLength = 1024;
        private WorkerRegistry registry;
        private RequestForwarder forwarder;
        private GatewayStats stats;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private Duration shutdownGrace = Duration.ofSeconds(5);

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxGlobalInFlight(int max) {
            this.maxGlobalInFlight = max;
            return this;
        }

        public Builder maxKeyLength(int maxKeyLength) {
            this.maxKeyLength = maxKeyLength;
            return this;
        }

        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder forwarder(RequestForwarder forwarder) {
            this.forwarder = forwarder;
            return this;
        }

        public Builder stats(GatewayStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxGlobalInFlight = config.getDisruptor().getMaxGlobalInFlight();
            this.maxKeyLength = config.getValidation().getMaxRoutingKeyLength();
            return this;
        }

        public GatewayPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("WorkerRegistry is required");
            }
            if (forwarder == null) {
                throw new IllegalStateException("RequestForwarder is required");
            }
            if (stats == null) {
                throw new IllegalStateException("GatewayStats is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new GatewayPipeline(this);
        }
    }
}
