package fr.lapetina.inference.router.infrastructure.http;

import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.routing.ForwardOutcome;
import fr.lapetina.inference.router.domain.routing.RetryPolicy;
import fr.lapetina.inference.router.infrastructure.health.WorkerRegistry;
import fr.lapetina.inference.router.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.router.infrastructure.stats.GatewayStats;
import fr.lapetina.inference.router.infrastructure.stats.NodeStats;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RequestForwarderTest {

    private static final String KEY = "customer-42";

    private StubWorkerHttpClient client;
    private WorkerRegistry registry;
    private GatewayStats stats;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        client = new StubWorkerHttpClient();
        registry = new WorkerRegistry(50);
        registry.addWorker("w1", "http://localhost:9001");
        registry.addWorker("w2", "http://localhost:9002");
        registry.addWorker("w3", "http://localhost:9003");
        stats = new GatewayStats();
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
        client.close();
    }

    private RequestForwarder forwarder(RetryPolicy policy) {
        return new RequestForwarder(registry, client, policy, stats, metrics, Clock.systemUTC());
    }

    private ForwardOutcome forward(RequestForwarder forwarder) throws Exception {
        InferenceRequest request = InferenceRequest.builder().requestId("r1").routingKey(KEY).payload("p").build();
        WorkerEndpoint owner = registry.route(KEY);
        return forwarder.forward(request, owner).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should serve a request on its ring owner")
    void shouldForwardToOwner() throws Exception {
        String owner = registry.route(KEY).getId();

        ForwardOutcome outcome = forward(forwarder(RetryPolicy.disabled()));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.finalState()).isEqualTo(RequestState.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.nodesTried()).containsExactly(owner);
        assertThat(outcome.result().workerId()).isEqualTo(owner);
        assertThat(stats.getNode(owner).getRequestsHandled()).isEqualTo(1);
    }

    @Test
    @DisplayName("should return the owner's failure as is when retry is disabled")
    void shouldNotRetryWhenDisabled() throws Exception {
        String owner = registry.route(KEY).getId();
        client.failWith(owner, ErrorType.CONNECTION_ERROR);

        ForwardOutcome outcome = forward(forwarder(RetryPolicy.disabled()));

        assertThat(outcome.finalState()).isEqualTo(RequestState.FAILED_TERMINAL);
        assertThat(outcome.result().errorType()).isEqualTo(ErrorType.CONNECTION_ERROR);
        assertThat(client.calls()).containsExactly(owner);
        assertThat(stats.getNode(owner).getRequestsFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fall back to the next ring successor and count it as a retry")
    void shouldRetryOnSuccessor() throws Exception {
        List<String> successors = registry.getRing().successors(KEY, 3);
        client.failWith(successors.get(0), ErrorType.CONNECTION_ERROR);
        RetryPolicy policy = new RetryPolicy(true, 3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0);

        ForwardOutcome outcome = forward(forwarder(policy));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.wasRetried()).isTrue();
        assertThat(outcome.nodesTried()).containsExactly(successors.get(0), successors.get(1));
        assertThat(outcome.result().workerId()).isEqualTo(successors.get(1));

        NodeStats fallback = stats.getNode(successors.get(1));
        assertThat(fallback.getRetriesHandled()).isEqualTo(1);
        assertThat(fallback.getRequestsHandled()).isZero();
        assertThat(stats.getNode(successors.get(0)).getRequestsFailed()).isEqualTo(1);
        assertThat(stateCount(successors.get(0), RequestState.FAILED)).isEqualTo(1.0);
        assertThat(stateCount(successors.get(1), RequestState.RETRIED)).isEqualTo(1.0);
    }

    private double stateCount(String nodeId, RequestState state) {
        Counter counter = metrics.getRegistry().find("test_requests_total")
                .tag("node", nodeId)
                .tag("state", state.name())
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    @DisplayName("should stop after the maximum number of attempts")
    void shouldBoundAttempts() throws Exception {
        for (String id : List.of("w1", "w2", "w3")) {
            client.failWith(id, ErrorType.WORKER_ERROR);
        }
        RetryPolicy policy = new RetryPolicy(true, 2, Duration.ZERO, Duration.ZERO, 1.0);

        ForwardOutcome outcome = forward(forwarder(policy));

        assertThat(outcome.finalState()).isEqualTo(RequestState.FAILED_TERMINAL);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(client.calls()).hasSize(2).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should not retry a client error")
    void shouldNotRetryClientError() throws Exception {
        String owner = registry.route(KEY).getId();
        client.failWith(owner, ErrorType.CLIENT_ERROR);
        RetryPolicy policy = new RetryPolicy(true, 3, Duration.ZERO, Duration.ZERO, 1.0);

        ForwardOutcome outcome = forward(forwarder(policy));

        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.result().errorType()).isEqualTo(ErrorType.CLIENT_ERROR);
    }

    @Test
    @DisplayName("should apply a new retry policy to later requests")
    void shouldSwapPolicy() throws Exception {
        String owner = registry.route(KEY).getId();
        client.failWith(owner, ErrorType.CONNECTION_ERROR);
        RequestForwarder forwarder = forwarder(RetryPolicy.disabled());

        assertThat(forward(forwarder).isSuccess()).isFalse();

        forwarder.setRetryPolicy(new RetryPolicy(true, 2, Duration.ZERO, Duration.ZERO, 1.0));

        assertThat(forward(forwarder).isSuccess()).isTrue();
    }
}
