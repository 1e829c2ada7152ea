package fr.lapetina.inference.router.worker;

import fr.lapetina.inference.router.batch.BatchQueue;
import fr.lapetina.inference.router.batch.ComputeEngine;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * One worker process: a batch queue in front of a compute engine, served over HTTP.
 * A worker knows nothing about the ring or the other workers.
 *
 * <p>Usage:
 * <pre>{@code
 * try (WorkerNode worker = WorkerNode.create(config, "worker_8001", 8001).start()) {
 *     // serve until shutdown
 * }
 * }</pre>
 */
public final class WorkerNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerNode.class);

    private final String nodeId;
    private final MetricsRegistry metricsRegistry;
    private final BatchQueue batchQueue;
    private final WorkerService service;
    private final WorkerHttpServer httpServer;

    private WorkerNode(RouterConfig config, String nodeId, int port, ComputeEngine engine) throws IOException {
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID is required");
        RouterConfig.BatchConfig batch = config.getBatch();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.batchQueue = BatchQueue.builder()
                .workerId(nodeId)
                .maxBatchSize(batch.getMaxBatchSize())
                .timeout(Duration.ofMillis(batch.getTimeoutMs()))
                .executionThreads(batch.getExecutionThreads())
                .engine(engine)
                .build();
        if (config.getMetrics().isEnabled()) {
            metricsRegistry.bindBatchQueue(batchQueue);
        }

        this.service = new WorkerService(nodeId, batchQueue,
                Duration.ofMillis(batch.getResultTimeoutMs()), metricsRegistry);
        this.httpServer = new WorkerHttpServer(
                config.getServer().getHost(),
                port,
                config.getServer().getBacklog(),
                config.getServer().getHandlerThreads(),
                service,
                metricsRegistry
        );
    }

    /**
     * Creates a worker backed by the simulated compute engine.
     *
     * @param port port to listen on, 0 for an ephemeral one
     */
    public static WorkerNode create(RouterConfig config, String nodeId, int port) throws IOException {
        return new WorkerNode(config, nodeId, port, SimulatedComputeEngine.fromConfig(config.getCompute()));
    }

    /**
     * Creates a worker backed by the given compute engine.
     */
    public static WorkerNode create(RouterConfig config, String nodeId, int port, ComputeEngine engine)
            throws IOException {
        return new WorkerNode(config, nodeId, port, engine);
    }

    /**
     * Default node id for a port, {@code worker_<port>}.
     */
    public static String defaultNodeId(int port) {
        return "worker_" + port;
    }

    public WorkerNode start() {
        httpServer.start();
        log.info("Worker started: nodeId={}, port={}, maxBatchSize={}, batchTimeoutMs={}",
                nodeId, getPort(), batchQueue.getMaxBatchSize(), batchQueue.getTimeout().toMillis());
        return this;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public String getBaseUrl() {
        return "http://localhost:" + getPort();
    }

    public WorkerService getService() {
        return service;
    }

    public BatchQueue getBatchQueue() {
        return batchQueue;
    }

    @Override
    public void close() {
        log.info("Stopping worker: nodeId={}", nodeId);

        // Flush the pending batch while the server can still answer its callers
        try {
            batchQueue.close();
        } catch (Exception e) {
            log.warn("Error closing batch queue", e);
        }

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("Worker stopped: nodeId={}", nodeId);
    }
}
