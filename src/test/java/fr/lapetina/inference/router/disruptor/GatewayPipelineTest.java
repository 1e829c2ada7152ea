package fr.lapetina.inference.router.disruptor;

import fr.lapetina.inference.router.disruptor.handlers.DispatchHandler;
import fr.lapetina.inference.router.disruptor.handlers.RoutingHandler;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.domain.routing.RetryPolicy;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.http.RequestForwarder;
import fr.lapetina.inference.router.infrastructure.http.StubWorkerHttpClient;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayPipelineTest {

    private WorkerRegistry registry;
    private GatewayStats stats;
    private MetricsRegistry metrics;
    private StubWorkerHttpClient client;
    private GatewayPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new WorkerRegistry(50);
        registry.addWorker("w1", "http://localhost:9001");
        registry.addWorker("w2", "http://localhost:9002");
        stats = new GatewayStats();
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metrics.close();
        if (client != null) {
            client.close();
        }
    }

    private GatewayPipeline start(StubWorkerHttpClient httpClient, Clock pipelineClock, Duration shutdownGrace) {
        client = httpClient;
        RequestForwarder forwarder = new RequestForwarder(registry, httpClient, RetryPolicy.disabled(),
                stats, metrics, Clock.systemUTC());
        pipeline = GatewayPipeline.builder()
                .ringBufferSize(64)
                .registry(registry)
                .forwarder(forwarder)
                .stats(stats)
                .metricsRegistry(metrics)
                .clock(pipelineClock)
                .shutdownGrace(shutdownGrace)
                .build();
        pipeline.start();
        return pipeline;
    }

    private List<ForwardOutcome> submitAll(int count) throws Exception {
        List<CompletableFuture<ForwardOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(pipeline.submit(InferenceRequest.of("req-" + i, i)));
        }
        List<ForwardOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<ForwardOutcome> future : futures) {
            outcomes.add(future.get(5, TimeUnit.SECONDS));
        }
        return outcomes;
    }

    @Test
    @DisplayName("should answer and count once when routing throws")
    void shouldCountRoutingFailureOnce() throws Exception {
        start(new StubWorkerHttpClient(), new FailingClock(RoutingHandler.class), Duration.ofSeconds(1));

        List<ForwardOutcome> outcomes = submitAll(5);
        // Drains every stage, so any late count would show up below
        pipeline.close();

        assertThat(outcomes).allSatisfy(outcome -> {
            assertThat(outcome.finalState()).isEqualTo(RequestState.FAILED_TERMINAL);
            assertThat(outcome.result().errorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        });
        assertThat(stats.getTotalRequests()).isEqualTo(5);
        assertThat(stats.getTotalFailures()).isEqualTo(5);
        assertThat(client.calls()).isEmpty();
    }

    @Test
    @DisplayName("should release the slot and skip forwarding when dispatch throws")
    void shouldNotForwardAfterDispatchFailure() throws Exception {
        start(new StubWorkerHttpClient(), new FailingClock(DispatchHandler.class), Duration.ofSeconds(1));

        List<ForwardOutcome> outcomes = submitAll(5);
        pipeline.close();

        assertThat(outcomes).extracting(ForwardOutcome::finalState).containsOnly(RequestState.FAILED_TERMINAL);
        assertThat(pipeline.getGlobalInFlight()).isZero();
        assertThat(stats.getTotalFailures()).isEqualTo(5);
        assertThat(client.calls()).isEmpty();
    }

    @Test
    @DisplayName("should fail requests still in flight when closed")
    void shouldFailInFlightRequestsOnClose() throws Exception {
        HangingWorkerHttpClient hanging = new HangingWorkerHttpClient();
        start(hanging, Clock.systemUTC(), Duration.ofMillis(50));

        CompletableFuture<ForwardOutcome> future = pipeline.submit(InferenceRequest.of("req-1", 1));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (hanging.pending.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(hanging.pending).hasSize(1);
        assertThat(future).isNotDone();

        pipeline.close();

        ForwardOutcome outcome = future.get(1, TimeUnit.SECONDS);
        assertThat(outcome.finalState()).isEqualTo(RequestState.FAILED_TERMINAL);
        assertThat(outcome.result().errorType()).isEqualTo(ErrorType.CAPACITY_ERROR);
        assertThat(outcome.result().requestId()).isEqualTo("req-1");
        assertThat(stats.getTotalFailures()).isEqualTo(1);

        // A worker answering after shutdown changes nothing
        hanging.pending.get(0).complete(InferenceResult.error("req-1", "w1", ErrorType.WORKER_ERROR, "late", 1));
        assertThat(future.get()).isSameAs(outcome);
        assertThat(stats.getTotalFailures()).isEqualTo(1);
        assertThat(pipeline.getGlobalInFlight()).isZero();
    }

    @Test
    @DisplayName("should let forwards finish within the shutdown grace period")
    void shouldWaitForForwardsOnClose() throws Exception {
        HangingWorkerHttpClient hanging = new HangingWorkerHttpClient();
        start(hanging, Clock.systemUTC(), Duration.ofSeconds(5));

        CompletableFuture<ForwardOutcome> future = pipeline.submit(InferenceRequest.of("req-1", 1));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (hanging.pending.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        CompletableFuture<InferenceResult> forward = hanging.pending.get(0);
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS).execute(() -> forward.complete(
                InferenceResult.success("req-1", Map.of("ok", true), "w1", 1, 1L, 1)));

        pipeline.close();

        assertThat(future).isDone();
        assertThat(future.get().isSuccess()).isTrue();
        assertThat(stats.getTotalFailures()).isZero();
    }

    /**
     * Clock that throws when read from inside the given pipeline stage.
     */
    private static final class FailingClock extends Clock {
        private final String failingClass;

        FailingClock(Class<?> failingClass) {
            this.failingClass = failingClass.getName();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            boolean inStage = StackWalker.getInstance()
                    .walk(frames -> frames.anyMatch(f -> f.getClassName().equals(failingClass)));
            if (inStage) {
                throw new IllegalStateException("clock unavailable");
            }
            return Instant.now();
        }
    }

    private static final class HangingWorkerHttpClient extends StubWorkerHttpClient {
        final List<CompletableFuture<InferenceResult>> pending = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<InferenceResult> forward(WorkerEndpoint worker, InferenceRequest request) {
            CompletableFuture<InferenceResult> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        }
    }
}
