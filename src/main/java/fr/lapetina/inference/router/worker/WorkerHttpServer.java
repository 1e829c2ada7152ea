package fr.lapetina.inference.router.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.inference.router.api.JsonExchange;
import fr.lapetina.inference.router.api.dto.ApiRequest;
import fr.lapetina.inference.router.api.dto.ApiResponse;
import fr.lapetina.inference.router.batch.BatchMetrics;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Worker HTTP surface using the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /infer - Run one request through the batch queue
 * - GET /stats - Queue depth, processed counts and batch metrics
 * - GET /health - Liveness probe used by the gateway
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class WorkerHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final JsonExchange json;
    private final WorkerService service;
    private final MetricsRegistry metricsRegistry;

    public WorkerHttpServer(
            String host,
            int port,
            int backlog,
            int handlerThreads,
            WorkerService service,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.service = service;
        this.metricsRegistry = metricsRegistry;
        this.json = new JsonExchange();

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = JsonExchange.handlerPool("worker-http-" + service.getNodeId(), handlerThreads);
        server.setExecutor(executor);

        server.createContext("/infer", new InferHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("Worker HTTP server configured: nodeId={}, port={}", service.getNodeId(), getPort());
    }

    public void start() {
        server.start();
        log.info("Worker HTTP server started: nodeId={}, port={}", service.getNodeId(), getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Worker HTTP server stopped: nodeId={}", service.getNodeId());
    }

    static int statusFor(InferenceResult result) {
        if (result.isSuccess()) {
            return 200;
        }
        return switch (result.errorType()) {
            case CLIENT_ERROR, VALIDATION_ERROR -> 400;
            case CAPACITY_ERROR -> 503;
            case TIMEOUT -> 504;
            default -> 500;
        };
    }

    // ==================== INFER HANDLER ====================

    private class InferHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!json.requireMethod(exchange, "POST")) {
                    return;
                }

                ApiRequest apiRequest;
                try {
                    apiRequest = json.readJson(exchange, ApiRequest.class);
                } catch (JsonProcessingException e) {
                    json.sendJson(exchange, 400,
                            ApiResponse.error(null, ErrorType.CLIENT_ERROR, "Malformed request body: " + e.getOriginalMessage()));
                    return;
                }
                if (apiRequest == null || apiRequest.getPayload() == null) {
                    json.sendJson(exchange, 400,
                            ApiResponse.error(apiRequest != null ? apiRequest.getRequestId() : null,
                                    ErrorType.CLIENT_ERROR, "Missing payload"));
                    return;
                }

                InferenceRequest request = apiRequest.toInferenceRequest();
                MDC.put("requestId", request.requestId());

                InferenceResult result = service.infer(request);
                if (result.isSuccess()) {
                    log.debug("Request served: requestId={}, batchId={}, batchSize={}, latencyMs={}",
                            result.requestId(), result.batchId(), result.batchSize(), result.latencyMs());
                }
                json.sendJson(exchange, statusFor(result), ApiResponse.fromResult(result));

            } catch (RuntimeException e) {
                log.error("Error handling inference request", e);
                json.sendJson(exchange, 500, ApiResponse.error(MDC.get("requestId"), ErrorType.INTERNAL_ERROR,
                        "Internal server error: " + e.getMessage()));
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }

            BatchMetrics batch = service.getBatchMetrics();
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("node_id", service.getNodeId());
            stats.put("queue_depth", service.getQueueDepth());
            stats.put("total_requests", service.getTotalRequests());
            stats.put("total_processed", service.getTotalProcessed());
            stats.put("total_failed", service.getTotalFailed());
            stats.put("active_requests", service.getActiveRequests());
            stats.put("batch_metrics", batchMetrics(batch));
            json.sendJson(exchange, 200, stats);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }

            boolean healthy = service.isAcceptingRequests();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("healthy", healthy);
            health.put("node_id", service.getNodeId());
            health.put("active_requests", service.getActiveRequests());
            health.put("total_requests", service.getTotalRequests());
            health.put("queue_depth", service.getQueueDepth());
            json.sendJson(exchange, healthy ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }
            json.sendText(exchange, 200, "text/plain; version=0.0.4", metricsRegistry.scrape());
        }
    }

    private static Map<String, Object> batchMetrics(BatchMetrics batch) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_requests", batch.totalRequests());
        metrics.put("total_batches", batch.totalBatches());
        metrics.put("avg_batch_size", batch.avgBatchSize());
        metrics.put("full_batches", batch.fullBatches());
        metrics.put("timeout_batches", batch.timeoutBatches());
        metrics.put("shutdown_batches", batch.shutdownBatches());
        metrics.put("failed_batches", batch.failedBatches());
        return metrics;
    }
}
