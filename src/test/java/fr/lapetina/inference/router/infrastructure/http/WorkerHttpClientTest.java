package fr.lapetina.inference.router.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerHttpClientTest {

    @Test
    @DisplayName("should classify connect failures as CONNECTION_ERROR")
    void shouldClassifyConnectFailures() {
        assertThat(WorkerHttpClient.classifyException(new ConnectException("refused")))
                .isEqualTo(ErrorType.CONNECTION_ERROR);
        assertThat(WorkerHttpClient.classifyException(new HttpConnectTimeoutException("connect timed out")))
                .isEqualTo(ErrorType.CONNECTION_ERROR);
        assertThat(WorkerHttpClient.classifyException(new IOException("reset")))
                .isEqualTo(ErrorType.CONNECTION_ERROR);
    }

    @Test
    @DisplayName("should classify request timeouts as FORWARDING_TIMEOUT")
    void shouldClassifyTimeouts() {
        assertThat(WorkerHttpClient.classifyException(new HttpTimeoutException("request timed out")))
                .isEqualTo(ErrorType.FORWARDING_TIMEOUT);
        assertThat(WorkerHttpClient.classifyException(new TimeoutException()))
                .isEqualTo(ErrorType.FORWARDING_TIMEOUT);
    }

    @Test
    @DisplayName("should classify anything else as INTERNAL_ERROR")
    void shouldClassifyUnexpected() {
        assertThat(WorkerHttpClient.classifyException(new IllegalStateException("bug")))
                .isEqualTo(ErrorType.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("should keep one circuit breaker per worker until removed")
    void shouldManageBreakers() {
        try (WorkerHttpClient client = new WorkerHttpClient()) {
            CircuitBreaker first = client.getCircuitBreaker("w1");
            assertThat(client.getCircuitBreaker("w1")).isSameAs(first);

            client.removeCircuitBreaker("w1");

            assertThat(client.getCircuitBreaker("w1")).isNotSameAs(first);
        }
    }

    @Test
    @DisplayName("should open the breaker on error documents sent with a 2xx status")
    void shouldCountErrorBodiesAsFailures() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        byte[] body = "{\"request_id\":\"r\",\"worker_id\":\"w1\",\"error_type\":\"BATCH_EXECUTION_ERROR\",\"error\":\"engine crashed\"}"
                .getBytes(StandardCharsets.UTF_8);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/infer", exchange -> {
            hits.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();

        WorkerEndpoint worker = WorkerEndpoint.builder()
                .id("w1")
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .build();
        try (WorkerHttpClient client = new WorkerHttpClient(Duration.ofSeconds(1), Duration.ofSeconds(2),
                Duration.ofSeconds(1), 3, Duration.ofSeconds(30), Clock.systemUTC())) {
            for (int i = 0; i < 3; i++) {
                InferenceResult result = client.forward(worker, InferenceRequest.of("r" + i, i))
                        .get(5, TimeUnit.SECONDS);
                assertThat(result.errorType()).isEqualTo(ErrorType.BATCH_EXECUTION_ERROR);
                assertThat(result.errorMessage()).isEqualTo("engine crashed");
            }

            assertThat(client.getCircuitBreaker("w1").getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(worker.getLastSuccessfulRequest()).isZero();

            InferenceResult blocked = client.forward(worker, InferenceRequest.of("r3", 3)).get(5, TimeUnit.SECONDS);
            assertThat(blocked.errorType()).isEqualTo(ErrorType.CIRCUIT_OPEN);
            assertThat(hits.get()).isEqualTo(3);
        } finally {
            server.stop(0);
        }
    }
}
