package fr.lapetina.inference.router.infrastructure.metrics;

import fr.lapetina.inference.router.batch.BatchQueue;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics registry using Micrometer, shared by the gateway and the workers.
 *
 * Provides:
 * - Forwarding latency timers and outcome counters per worker
 * - Retry counters kept apart from first attempts
 * - Batch queue meters on workers
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final JvmGcMetrics gcMetrics;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Meter>> nodeGauges = new ConcurrentHashMap<>();

    // Global gauges
    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger activeNodes = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_requests_total", globalInFlight, AtomicInteger::get)
                .description("Total number of in-flight gateway requests")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the gateway ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_ring_nodes", activeNodes, AtomicInteger::get)
                .description("Number of physical nodes on the hash ring")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_router");
    }

    /**
     * Increments the request counter for a node/state combination.
     */
    public void incrementRequestCount(String nodeId, RequestState state) {
        String key = nodeId + ":" + state.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests by final state")
                        .tag("node", nodeId)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records end-to-end request latency for the node that served it.
     */
    public void recordLatency(String nodeId, Duration latency) {
        latencyTimers.computeIfAbsent(nodeId, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("node", nodeId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records stage-specific latency (validation, routing, forwarding, batch wait).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String nodeId, ErrorType errorType) {
        String key = nodeId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("node", nodeId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a fallback attempt on a ring successor.
     */
    public void incrementRetryCount(String nodeId, boolean succeeded) {
        String outcome = succeeded ? "success" : "failure";
        retryCounters.computeIfAbsent(nodeId + ":" + outcome, k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Fallback attempts on ring successors")
                        .tag("node", nodeId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for node health status.
     */
    public void registerNodeHealth(String nodeId, Supplier<Number> healthValue) {
        Gauge gauge = Gauge.builder(prefix + "_node_health", healthValue)
                .description("Node health status (0=DOWN, 1=DEGRADED, 2=UP)")
                .tag("node", nodeId)
                .register(registry);
        nodeGauges.computeIfAbsent(nodeId, k -> new CopyOnWriteArrayList<>()).add(gauge);
    }

    /**
     * Removes the gauges of a node that left the ring.
     */
    public void removeNodeGauges(String nodeId) {
        List<Meter> meters = nodeGauges.remove(nodeId);
        if (meters != null) {
            meters.forEach(registry::remove);
        }
    }

    /**
     * Exposes a worker's batch queue counters.
     */
    public void bindBatchQueue(BatchQueue queue) {
        String worker = queue.getWorkerId();
        Gauge.builder(prefix + "_batch_queue_depth", queue, BatchQueue::queueDepth)
                .description("Requests waiting in the pending batch")
                .tag("worker", worker)
                .register(registry);
        Gauge.builder(prefix + "_batch_executing", queue, BatchQueue::executingBatches)
                .description("Batches currently executing")
                .tag("worker", worker)
                .register(registry);
        FunctionCounter.builder(prefix + "_batch_requests_total", queue, q -> q.metrics().totalRequests())
                .description("Requests accepted by the batch queue")
                .tag("worker", worker)
                .register(registry);
        batchCounter(queue, "size", q -> q.metrics().fullBatches());
        batchCounter(queue, "timeout", q -> q.metrics().timeoutBatches());
        batchCounter(queue, "shutdown", q -> q.metrics().shutdownBatches());
        FunctionCounter.builder(prefix + "_batches_failed_total", queue, q -> q.metrics().failedBatches())
                .description("Batches whose execution failed")
                .tag("worker", worker)
                .register(registry);
        Gauge.builder(prefix + "_batch_avg_size", queue, q -> q.metrics().avgBatchSize())
                .description("Average size of closed batches")
                .tag("worker", worker)
                .register(registry);
    }

    private void batchCounter(BatchQueue queue, String reason,
                              ToDoubleFunction<BatchQueue> value) {
        FunctionCounter.builder(prefix + "_batches_total", queue, value)
                .description("Closed batches by close reason")
                .tag("worker", queue.getWorkerId())
                .tag("reason", reason)
                .register(registry);
    }

    /**
     * Updates the global in-flight counter.
     */
    public void setGlobalInFlight(int value) {
        globalInFlight.set(value);
    }

    /**
     * Updates the ring buffer remaining capacity.
     */
    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Updates the number of nodes on the ring.
     */
    public void setActiveNodes(int value) {
        activeNodes.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
