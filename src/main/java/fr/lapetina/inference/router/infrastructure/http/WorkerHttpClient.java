package fr.lapetina.inference.router.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.router.api.JsonExchange;
import fr.lapetina.inference.router.api.dto.ApiRequest;
import fr.lapetina.inference.router.api.dto.ApiResponse;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for forwarding requests to workers.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O, with a circuit breaker per
 * worker. Futures returned by {@link #forward} never complete exceptionally: every
 * failure is turned into an error {@link InferenceResult}.
 */
public class WorkerHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private final Duration forwardTimeout;
    private final Duration healthCheckTimeout;
    private final int failureThreshold;
    private final Duration circuitBreakerRecoveryTimeout;
    private final Clock clock;

    public WorkerHttpClient(
            Duration connectTimeout,
            Duration forwardTimeout,
            Duration healthCheckTimeout,
            int failureThreshold,
            Duration circuitBreakerRecoveryTimeout,
            Clock clock
    ) {
        this.forwardTimeout = forwardTimeout;
        this.healthCheckTimeout = healthCheckTimeout;
        this.failureThreshold = failureThreshold;
        this.circuitBreakerRecoveryTimeout = circuitBreakerRecoveryTimeout;
        this.clock = clock;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = JsonExchange.createObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public WorkerHttpClient() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(10), Duration.ofSeconds(2), 5, Duration.ofSeconds(30),
                Clock.systemUTC());
    }

    /**
     * Forwards a request to a worker's {@code /infer} endpoint.
     *
     * @param worker  Target worker
     * @param request Request to forward
     * @return future with the worker's result or an error result
     */
    public CompletableFuture<InferenceResult> forward(WorkerEndpoint worker, InferenceRequest request) {
        CircuitBreaker breaker = getOrCreateCircuitBreaker(worker.getId());

        if (!breaker.allowRequest()) {
            log.warn("Request blocked by circuit breaker: workerId={}, requestId={}",
                    worker.getId(), request.requestId());
            return CompletableFuture.completedFuture(InferenceResult.error(
                    request.requestId(), worker.getId(), ErrorType.CIRCUIT_OPEN,
                    "Circuit breaker is open for worker: " + worker.getId(), 0));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(worker.resolve("/infer"))
                    .timeout(forwardTimeout)
                    .header("Content-Type", "application/json")
                    .header("X-Request-ID", request.requestId())
                    .POST(HttpRequest.BodyPublishers.ofByteArray(
                            objectMapper.writeValueAsBytes(ApiRequest.fromInferenceRequest(request))))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: workerId={}, requestId={}", worker.getId(), request.requestId(), e);
            return CompletableFuture.completedFuture(InferenceResult.error(
                    request.requestId(), worker.getId(), ErrorType.CLIENT_ERROR,
                    "Failed to build request: " + e.getMessage(), 0));
        }

        Instant startTime = clock.instant();
        log.debug("Forwarding request: workerId={}, requestId={}, uri={}",
                worker.getId(), request.requestId(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(worker, request, response, startTime, breaker))
                .exceptionally(ex -> handleException(worker, request, ex, startTime, breaker));
    }

    private InferenceResult handleResponse(
            WorkerEndpoint worker,
            InferenceRequest request,
            HttpResponse<String> response,
            Instant startTime,
            CircuitBreaker breaker
    ) {
        long latencyMs = Duration.between(startTime, clock.instant()).toMillis();
        int statusCode = response.statusCode();
        ApiResponse body = parseBody(response.body());

        if (statusCode >= 200 && statusCode < 300) {
            if (body == null) {
                breaker.recordFailure();
                log.warn("Unreadable worker response: workerId={}, requestId={}", worker.getId(), request.requestId());
                return InferenceResult.error(request.requestId(), worker.getId(), ErrorType.WORKER_ERROR,
                        "Unreadable response from worker", latencyMs);
            }
            InferenceResult result = body.toResult(request.requestId());
            if (!result.isSuccess()) {
                // Batch failures come back as 2xx with an error document
                breaker.recordFailure();
                log.warn("Worker reported a failure: workerId={}, requestId={}, errorType={}, error={}",
                        worker.getId(), request.requestId(), result.errorType(), result.errorMessage());
                return result;
            }
            breaker.recordSuccess();
            worker.recordSuccess();
            return result;
        }

        // 4xx means the worker is up and refused the request itself
        if (statusCode >= 500) {
            breaker.recordFailure();
        }
        log.warn("Worker returned an error: workerId={}, requestId={}, status={}, latencyMs={}",
                worker.getId(), request.requestId(), statusCode, latencyMs);

        if (body != null && (body.getErrorType() != null || body.getError() != null)) {
            InferenceResult parsed = body.toResult(request.requestId());
            return InferenceResult.error(parsed.requestId(),
                    parsed.workerId() != null ? parsed.workerId() : worker.getId(),
                    parsed.errorType(), parsed.errorMessage(), latencyMs);
        }
        ErrorType errorType = statusCode >= 400 && statusCode < 500 ? ErrorType.CLIENT_ERROR : ErrorType.WORKER_ERROR;
        return InferenceResult.error(request.requestId(), worker.getId(), errorType, "HTTP " + statusCode, latencyMs);
    }

    private ApiResponse parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ApiResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("Worker body is not a result document: {}", e.getOriginalMessage());
            return null;
        }
    }

    private InferenceResult handleException(
            WorkerEndpoint worker,
            InferenceRequest request,
            Throwable ex,
            Instant startTime,
            CircuitBreaker breaker
    ) {
        breaker.recordFailure();
        long latencyMs = Duration.between(startTime, clock.instant()).toMillis();

        Throwable cause = unwrap(ex);
        ErrorType errorType = classifyException(cause);
        String message = cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");

        if (errorType == ErrorType.INTERNAL_ERROR) {
            log.error("Forwarding failed unexpectedly: workerId={}, requestId={}", worker.getId(), request.requestId(), ex);
        } else {
            log.warn("Forwarding failed: workerId={}, requestId={}, errorType={}, error={}",
                    worker.getId(), request.requestId(), errorType, message);
        }

        return InferenceResult.error(request.requestId(), worker.getId(), errorType, message, latencyMs);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static ErrorType classifyException(Throwable cause) {
        // HttpConnectTimeoutException extends HttpTimeoutException: test it first
        if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
            return ErrorType.CONNECTION_ERROR;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorType.FORWARDING_TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorType.CONNECTION_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    private CircuitBreaker getOrCreateCircuitBreaker(String workerId) {
        return circuitBreakers.computeIfAbsent(workerId, id ->
                new CircuitBreaker(id, failureThreshold, circuitBreakerRecoveryTimeout, 1, clock)
        );
    }

    /**
     * Gets the circuit breaker for a worker, creating it if needed.
     */
    public CircuitBreaker getCircuitBreaker(String workerId) {
        return getOrCreateCircuitBreaker(workerId);
    }

    /**
     * Resets the circuit breaker for a worker.
     */
    public void resetCircuitBreaker(String workerId) {
        CircuitBreaker breaker = circuitBreakers.get(workerId);
        if (breaker != null) {
            breaker.forceState(CircuitBreaker.State.CLOSED);
        }
    }

    /**
     * Forgets the circuit breaker of a worker that left the ring.
     */
    public void removeCircuitBreaker(String workerId) {
        circuitBreakers.remove(workerId);
    }

    /**
     * Probes a worker's {@code /health} endpoint.
     */
    public CompletableFuture<Boolean> healthCheck(WorkerEndpoint worker) {
        URI uri = worker.resolve("/health");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(healthCheckTimeout)
                .GET()
                .build();

        log.debug("Health check started: workerId={}, uri={}", worker.getId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() == 200;
                    if (healthy) {
                        log.debug("Health check passed: workerId={}", worker.getId());
                    } else {
                        log.warn("Health check failed: workerId={}, status={}", worker.getId(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: workerId={}, error={}", worker.getId(), unwrap(ex).toString());
                    return false;
                });
    }

    @Override
    public void close() {
        circuitBreakers.clear();
    }
}
