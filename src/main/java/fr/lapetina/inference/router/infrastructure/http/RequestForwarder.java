package fr.lapetina.inference.router.infrastructure.http;

import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.ring.EmptyRingException;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.domain.routing.RetryPolicy;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Forwards a routed request to its owner and applies the retry policy.
 *
 * <p>The first attempt always goes to the ring owner. A fallback attempt is only
 * made when the policy is enabled and the failure is retryable; it goes to the next
 * distinct worker clockwise on the ring. Every attempt is recorded in the per-node
 * stats, fallback attempts separately from first attempts.
 */
public final class RequestForwarder {

    private static final Logger log = LoggerFactory.getLogger(RequestForwarder.class);

    private final WorkerRegistry registry;
    private final WorkerHttpClient httpClient;
    private final GatewayStats stats;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private volatile RetryPolicy retryPolicy;

    public RequestForwarder(
            WorkerRegistry registry,
            WorkerHttpClient httpClient,
            RetryPolicy retryPolicy,
            GatewayStats stats,
            MetricsRegistry metrics,
            Clock clock
    ) {
        this.registry = registry;
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
        this.stats = stats;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Forwards a request whose owner has already been resolved.
     *
     * @return never completes exceptionally
     */
    public CompletableFuture<ForwardOutcome> forward(InferenceRequest request, WorkerEndpoint owner) {
        RetryPolicy policy = retryPolicy;
        List<WorkerEndpoint> candidates = candidatesFor(request, owner, policy);
        CompletableFuture<ForwardOutcome> outcome = new CompletableFuture<>();
        attempt(request, candidates, policy, 1, new ArrayList<>(), outcome);
        return outcome;
    }

    private List<WorkerEndpoint> candidatesFor(InferenceRequest request, WorkerEndpoint owner, RetryPolicy policy) {
        List<WorkerEndpoint> candidates = new ArrayList<>();
        candidates.add(owner);
        if (!policy.enabled() || policy.maxAttempts() < 2) {
            return candidates;
        }
        try {
            for (WorkerEndpoint worker : registry.candidates(request.routingKey(), policy.maxAttempts())) {
                if (candidates.size() >= policy.maxAttempts()) {
                    break;
                }
                if (!worker.getId().equals(owner.getId())) {
                    candidates.add(worker);
                }
            }
        } catch (EmptyRingException e) {
            log.debug("Ring emptied after routing: requestId={}, owner={}", request.requestId(), owner.getId());
        }
        return candidates;
    }

    private void attempt(
            InferenceRequest request,
            List<WorkerEndpoint> candidates,
            RetryPolicy policy,
            int attempt,
            List<String> tried,
            CompletableFuture<ForwardOutcome> outcome
    ) {
        WorkerEndpoint worker = candidates.get(attempt - 1);
        tried.add(worker.getId());
        Instant start = clock.instant();

        httpClient.forward(worker, request)
                .exceptionally(ex -> InferenceResult.error(request.requestId(), worker.getId(),
                        ErrorType.INTERNAL_ERROR, ex.toString(), 0))
                .thenAccept(result -> {
                    long attemptLatencyMs = Duration.between(start, clock.instant()).toMillis();
                    record(worker, attempt, result, attemptLatencyMs);

                    if (result.isSuccess()) {
                        outcome.complete(new ForwardOutcome(endToEnd(request, result),
                                RequestState.COMPLETED, attempt, tried));
                        return;
                    }

                    metrics.incrementRequestCount(worker.getId(), RequestState.FAILED);
                    int next = attempt + 1;
                    if (policy.isRetryable(result.errorType()) && policy.allowsAttempt(next)
                            && next <= candidates.size()) {
                        metrics.incrementRequestCount(candidates.get(next - 1).getId(), RequestState.RETRIED);
                        Duration backoff = policy.backoffBefore(next);
                        log.info("Retrying on ring successor: requestId={}, failedNode={}, nextNode={}, attempt={}, errorType={}, backoffMs={}",
                                request.requestId(), worker.getId(), candidates.get(next - 1).getId(),
                                next, result.errorType(), backoff.toMillis());
                        Executor delayed = CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS);
                        CompletableFuture.runAsync(() -> attempt(request, candidates, policy, next, tried, outcome), delayed)
                                .exceptionally(ex -> failInternally(request, worker, attempt, tried, outcome, ex));
                        return;
                    }

                    outcome.complete(new ForwardOutcome(endToEnd(request, result),
                            RequestState.FAILED_TERMINAL, attempt, tried));
                })
                .exceptionally(ex -> failInternally(request, worker, attempt, tried, outcome, ex));
    }

    private Void failInternally(
            InferenceRequest request,
            WorkerEndpoint worker,
            int attempt,
            List<String> tried,
            CompletableFuture<ForwardOutcome> outcome,
            Throwable ex
    ) {
        log.error("Forwarding pipeline failed: requestId={}, nodeId={}", request.requestId(), worker.getId(), ex);
        InferenceResult error = InferenceResult.error(request.requestId(), worker.getId(),
                ErrorType.INTERNAL_ERROR, ex.toString(), 0);
        outcome.complete(new ForwardOutcome(endToEnd(request, error), RequestState.FAILED_TERMINAL, attempt, tried));
        return null;
    }

    private void record(WorkerEndpoint worker, int attempt, InferenceResult result, long latencyMs) {
        String nodeId = worker.getId();
        boolean success = result.isSuccess();
        if (attempt == 1) {
            stats.recordFirstAttempt(nodeId, success, latencyMs);
        } else {
            stats.recordRetry(nodeId, success, latencyMs);
            metrics.incrementRetryCount(nodeId, success);
        }
        if (success) {
            metrics.recordLatency(nodeId, Duration.ofMillis(latencyMs));
        } else {
            metrics.incrementErrorCount(nodeId, result.errorType());
        }
    }

    private InferenceResult endToEnd(InferenceRequest request, InferenceResult result) {
        return result.withLatencyMs(Duration.between(request.arrivalTime(), clock.instant()).toMillis());
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        RetryPolicy previous = this.retryPolicy;
        this.retryPolicy = retryPolicy;
        if (!retryPolicy.equals(previous)) {
            log.info("Retry policy changed: {} -> {}", previous, retryPolicy);
        }
    }
}
