package fr.lapetina.inference.router.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.inference.router.api.dto.ApiRequest;
import fr.lapetina.inference.router.api.dto.ApiResponse;
import fr.lapetina.inference.router.disruptor.GatewayPipeline;
import fr.lapetina.inference.router.disruptor.exception.BackpressureException;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.NodeHealth;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.ring.DuplicateNodeException;
import fr.lapetina.inference.router.domain.ring.HashRing;
import fr.lapetina.inference.router.domain.ring.UnknownNodeException;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.http.WorkerHttpClient;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * Gateway HTTP surface using the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /infer - Route one request to its ring owner
 * - GET /stats - Per-node counts and load-balance coefficient of variation
 * - GET /health - Gateway and worker health
 * - GET /metrics - Prometheus metrics endpoint
 * - /admin/* - Ring membership and configuration reload
 */
public final class GatewayHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayHttpServer.class);

    private static final int RING_SAMPLE_KEYS = 10_000;

    private final HttpServer server;
    private final ExecutorService executor;
    private final JsonExchange json;
    private final GatewayPipeline pipeline;
    private final WorkerRegistry registry;
    private final WorkerHttpClient httpClient;
    private final GatewayStats stats;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final DoubleSupplier maxLoadBalanceCv;
    private final Duration responseTimeout;
    private final Clock clock;

    private GatewayHttpServer(Builder builder) throws IOException {
        this.pipeline = builder.pipeline;
        this.registry = builder.registry;
        this.httpClient = builder.httpClient;
        this.stats = builder.stats;
        this.metricsRegistry = builder.metricsRegistry;
        this.configLoader = builder.configLoader;
        this.maxLoadBalanceCv = builder.maxLoadBalanceCv;
        this.responseTimeout = builder.responseTimeout;
        this.clock = builder.clock;
        this.json = new JsonExchange();

        this.server = HttpServer.create(new InetSocketAddress(builder.host, builder.port), builder.backlog);
        this.executor = JsonExchange.handlerPool("gateway-http", builder.handlerThreads);
        server.setExecutor(executor);

        server.createContext("/infer", new InferHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("Gateway HTTP server configured on port {}", getPort());
    }

    public void start() {
        server.start();
        log.info("Gateway HTTP server started on port {}", getPort());
    }

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
        log.info("Gateway HTTP server stopped");
    }

    static int statusFor(InferenceResult result) {
        if (result.isSuccess()) {
            return 200;
        }
        return switch (result.errorType()) {
            case CLIENT_ERROR, VALIDATION_ERROR -> 400;
            case NO_AVAILABLE_NODE, CAPACITY_ERROR, CIRCUIT_OPEN -> 503;
            case FORWARDING_TIMEOUT, TIMEOUT -> 504;
            case CONNECTION_ERROR, WORKER_ERROR, BATCH_EXECUTION_ERROR -> 502;
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
                    json.sendJson(exchange, 400, ApiResponse.error(null, ErrorType.CLIENT_ERROR,
                            "Malformed request body: " + e.getOriginalMessage()));
                    return;
                }
                if (apiRequest == null) {
                    apiRequest = new ApiRequest();
                }
                if (apiRequest.getRequestId() == null) {
                    apiRequest.setRequestId(exchange.getRequestHeaders().getFirst("X-Request-ID"));
                }

                InferenceRequest request = apiRequest.toInferenceRequest().arrivedAt(clock.instant());
                MDC.put("requestId", request.requestId());

                CompletableFuture<ForwardOutcome> future;
                try {
                    future = pipeline.submit(request);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: requestId={}, reason={}", request.requestId(), e.getReason());
                    json.sendJson(exchange, 503, ApiResponse.error(request.requestId(), ErrorType.CAPACITY_ERROR,
                            e.getMessage()));
                    return;
                }

                ForwardOutcome outcome = await(future, request);
                ApiResponse response = ApiResponse.fromResult(outcome.result());
                if (outcome.attempts() > 0) {
                    response.setAttempts(outcome.attempts());
                }
                json.sendJson(exchange, statusFor(outcome.result()), response);

            } catch (RuntimeException e) {
                log.error("Error handling inference request", e);
                json.sendJson(exchange, 500, ApiResponse.error(MDC.get("requestId"), ErrorType.INTERNAL_ERROR,
                        "Internal server error: " + e.getMessage()));
            } finally {
                MDC.clear();
            }
        }

        private ForwardOutcome await(CompletableFuture<ForwardOutcome> future, InferenceRequest request) {
            try {
                return future.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("No outcome in time: requestId={}, timeoutMs={}", request.requestId(), responseTimeout.toMillis());
                return failed(request, ErrorType.TIMEOUT, "No response within " + responseTimeout.toMillis() + "ms");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failed(request, ErrorType.INTERNAL_ERROR, "Interrupted");
            } catch (ExecutionException e) {
                log.error("Pipeline failed: requestId={}", request.requestId(), e.getCause());
                return failed(request, ErrorType.INTERNAL_ERROR, String.valueOf(e.getCause()));
            }
        }

        private ForwardOutcome failed(InferenceRequest request, ErrorType type, String message) {
            long latencyMs = Duration.between(request.arrivalTime(), clock.instant()).toMillis();
            return new ForwardOutcome(InferenceResult.error(request.requestId(), null, type, message, latencyMs),
                    RequestState.FAILED_TERMINAL, 0, List.of());
        }
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }
            json.sendJson(exchange, 200, stats.snapshot(registry.getWorkerIds(), maxLoadBalanceCv.getAsDouble()));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }

            List<WorkerEndpoint> workers = registry.getAllWorkers();
            Map<String, Object> health = new LinkedHashMap<>();
            String status = overallHealth(workers);
            health.put("status", status);
            health.put("timestamp", Instant.now(clock).toString());

            List<Map<String, Object>> nodes = new ArrayList<>();
            for (WorkerEndpoint worker : workers) {
                Map<String, Object> node = new LinkedHashMap<>();
                node.put("id", worker.getId());
                node.put("health", worker.getHealth().name());
                node.put("circuit", httpClient.getCircuitBreaker(worker.getId()).getState().name());
                nodes.add(node);
            }
            health.put("nodes", nodes);

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("running", pipeline.isRunning());
            pipelineStats.put("global_in_flight", pipeline.getGlobalInFlight());
            pipelineStats.put("ring_buffer_remaining", pipeline.getRemainingCapacity());
            health.put("pipeline", pipelineStats);

            json.sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }

        private String overallHealth(List<WorkerEndpoint> workers) {
            if (workers.isEmpty() || !pipeline.isRunning()) {
                return "DOWN";
            }
            long up = workers.stream().filter(w -> w.getHealth() == NodeHealth.UP).count();
            if (up == 0) {
                return "DOWN";
            }
            return up < workers.size() ? "DEGRADED" : "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!json.requireMethod(exchange, "GET")) {
                return;
            }
            metricsRegistry.setGlobalInFlight(pipeline.getGlobalInFlight());
            metricsRegistry.setRingBufferRemaining((int) pipeline.getRemainingCapacity());
            metricsRegistry.setActiveNodes(registry.size());
            json.sendText(exchange, 200, "text/plain; version=0.0.4", metricsRegistry.scrape());
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getRawPath();
            String method = exchange.getRequestMethod().toUpperCase();

            try {
                if (path.equals("/admin/nodes") && method.equals("GET")) {
                    handleListNodes(exchange);
                } else if (path.equals("/admin/nodes") && method.equals("POST")) {
                    handleAddNode(exchange);
                } else if (path.matches("/admin/nodes/[^/]+") && method.equals("DELETE")) {
                    handleRemoveNode(exchange,
                            URLDecoder.decode(path.substring("/admin/nodes/".length()), StandardCharsets.UTF_8));
                } else if (path.equals("/admin/reload") && method.equals("POST")) {
                    handleReloadConfig(exchange);
                } else {
                    json.sendError(exchange, 404, "Not Found");
                }
            } catch (RuntimeException e) {
                log.error("Error in admin handler", e);
                json.sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleListNodes(HttpExchange exchange) throws IOException {
            HashRing ring = registry.getRing();
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (WorkerEndpoint worker : registry.getAllWorkers()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", worker.getId());
                info.put("url", worker.getBaseUrl().toString());
                info.put("health", worker.getHealth().name());
                info.put("circuit", httpClient.getCircuitBreaker(worker.getId()).getState().name());
                info.put("consecutive_failures", worker.getConsecutiveFailures());
                info.put("virtual_nodes", ring.virtualNodesOf(worker.getId()).size());
                nodes.add(info);
            }

            Map<String, Object> ringInfo = new LinkedHashMap<>();
            ringInfo.put("physical_nodes", ring.size());
            ringInfo.put("virtual_nodes", ring.virtualNodeCount());
            ringInfo.put("virtual_nodes_per_physical", ring.getVirtualNodesPerPhysical());
            ringInfo.put("sampled_load_cv", ring.sampledLoadCv(RING_SAMPLE_KEYS));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("nodes", nodes);
            body.put("ring", ringInfo);
            json.sendJson(exchange, 200, body);
        }

        private void handleAddNode(HttpExchange exchange) throws IOException {
            RouterConfig.WorkerConfig node;
            try {
                node = json.readJson(exchange, RouterConfig.WorkerConfig.class);
            } catch (JsonProcessingException e) {
                json.sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
                return;
            }
            if (node == null || node.getUrl() == null || node.getUrl().isBlank()) {
                json.sendError(exchange, 400, "Missing 'url' field");
                return;
            }

            URI url;
            try {
                url = URI.create(node.getUrl());
            } catch (IllegalArgumentException e) {
                json.sendError(exchange, 400, "Invalid url: " + node.getUrl());
                return;
            }
            if (!"http".equalsIgnoreCase(url.getScheme()) || url.getHost() == null) {
                json.sendError(exchange, 400, "Invalid url: " + node.getUrl());
                return;
            }

            try {
                WorkerEndpoint added = registry.addWorker(
                        WorkerEndpoint.builder().id(node.effectiveId()).baseUrl(url).build());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("id", added.getId());
                body.put("url", added.getBaseUrl().toString());
                body.put("physical_nodes", registry.size());
                json.sendJson(exchange, 201, body);
            } catch (DuplicateNodeException e) {
                json.sendError(exchange, 409, e.getMessage());
            }
        }

        private void handleRemoveNode(HttpExchange exchange, String nodeId) throws IOException {
            try {
                registry.removeWorker(nodeId);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("id", nodeId);
                body.put("physical_nodes", registry.size());
                json.sendJson(exchange, 200, body);
            } catch (UnknownNodeException e) {
                json.sendError(exchange, 404, e.getMessage());
            }
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            if (configLoader == null) {
                json.sendError(exchange, 409, "No configuration file to reload");
                return;
            }
            RouterConfig config = configLoader.reload();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Configuration reloaded");
            body.put("workers", config.getWorkers().size());
            body.put("physical_nodes", registry.size());
            json.sendJson(exchange, 200, body);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8000;
        private int backlog = 100;
        private int handlerThreads = 64;
        private GatewayPipeline pipeline;
        private WorkerRegistry registry;
        private WorkerHttpClient httpClient;
        private GatewayStats stats;
        private MetricsRegistry metricsRegistry;
        private ConfigLoader configLoader;
        private DoubleSupplier maxLoadBalanceCv = () -> 0.10;
        private Duration responseTimeout = Duration.ofSeconds(30);
        private Clock clock = Clock.systemUTC();

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder backlog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder handlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
            return this;
        }

        public Builder pipeline(GatewayPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder httpClient(WorkerHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder stats(GatewayStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        /**
         * Optional: without a loader {@code POST /admin/reload} answers 409.
         */
        public Builder configLoader(ConfigLoader configLoader) {
            this.configLoader = configLoader;
            return this;
        }

        public Builder maxLoadBalanceCv(DoubleSupplier maxLoadBalanceCv) {
            this.maxLoadBalanceCv = maxLoadBalanceCv;
            return this;
        }

        /**
         * Upper bound on how long a handler thread waits for an outcome.
         */
        public Builder responseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GatewayHttpServer build() throws IOException {
            if (pipeline == null || registry == null || httpClient == null || stats == null || metricsRegistry == null) {
                throw new IllegalStateException("pipeline, registry, httpClient, stats and metricsRegistry are required");
            }
            return new GatewayHttpServer(this);
        }
    }
}
