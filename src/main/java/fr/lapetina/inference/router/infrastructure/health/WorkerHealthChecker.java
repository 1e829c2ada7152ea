package fr.lapetina.inference.router.infrastructure.health;

import fr.lapetina.inference.router.domain.model.NodeHealth;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.infrastructure.http.CircuitBreaker;
import fr.lapetina.inference.router.infrastructure.http.WorkerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for workers.
 *
 * Periodically polls each worker's {@code /health} and updates its status, taking
 * the circuit breaker state into account. Health is informational: it never moves
 * a worker on or off the ring.
 */
public final class WorkerHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerHealthChecker.class);

    private final WorkerRegistry registry;
    private final WorkerHttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final int degradedThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WorkerHealthChecker(
            WorkerRegistry registry,
            WorkerHttpClient httpClient,
            Duration checkInterval,
            int degradedThreshold
    ) {
        this.registry = registry;
        this.httpClient = httpClient;
        this.checkInterval = checkInterval;
        this.degradedThreshold = degradedThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking, with a first round right away.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllWorkers,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Checks every registered worker.
     *
     * @return completes when every probe has been handled
     */
    public CompletableFuture<Void> checkAllWorkers() {
        List<WorkerEndpoint> workers = registry.getAllWorkers();
        log.debug("Starting health check cycle: workerCount={}", workers.size());

        CompletableFuture<?>[] checks = workers.stream()
                .map(this::checkWorker)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks);
    }

    /**
     * Probes a single worker and updates its health.
     */
    public CompletableFuture<NodeHealth> checkWorker(WorkerEndpoint worker) {
        log.debug("Health check started: workerId={}, currentHealth={}, consecutiveFailures={}",
                worker.getId(), worker.getHealth(), worker.getConsecutiveFailures());

        return httpClient.healthCheck(worker)
                .thenApply(healthy -> healthy ? onHealthy(worker) : onUnhealthy(worker));
    }

    private NodeHealth onHealthy(WorkerEndpoint worker) {
        worker.resetFailures();
        CircuitBreaker breaker = httpClient.getCircuitBreaker(worker.getId());
        NodeHealth health;
        if (breaker.getState() == CircuitBreaker.State.OPEN) {
            // Responds but recent forwards failed
            log.info("Health check passed but circuit breaker open: workerId={}, setting DEGRADED", worker.getId());
            health = NodeHealth.DEGRADED;
        } else {
            health = NodeHealth.UP;
        }
        registry.updateWorkerHealth(worker.getId(), health);
        return health;
    }

    private NodeHealth onUnhealthy(WorkerEndpoint worker) {
        int failures = worker.recordFailure();

        NodeHealth health;
        if (failures >= degradedThreshold * 2) {
            health = NodeHealth.DOWN;
        } else if (failures >= degradedThreshold) {
            health = NodeHealth.DEGRADED;
        } else {
            health = worker.getHealth();
        }

        log.warn("Health check failed: workerId={}, consecutiveFailures={}, health={}",
                worker.getId(), failures, health);
        registry.updateWorkerHealth(worker.getId(), health);
        return health;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
