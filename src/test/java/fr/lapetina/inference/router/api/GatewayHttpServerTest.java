package fr.lapetina.inference.router.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceResult;
import fr.lapetina.inference.router.integration.TestGatewayFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayHttpServerTest {

    @Nested
    @DisplayName("Status mapping")
    class StatusTests {

        private int statusOf(ErrorType type) {
            return GatewayHttpServer.statusFor(InferenceResult.error("r", null, type, "x", 0));
        }

        @Test
        @DisplayName("should map each error type to its HTTP status")
        void shouldMapErrors() {
            assertThat(GatewayHttpServer.statusFor(InferenceResult.success("r", "out", "w", 1, 1, 1)))
                    .isEqualTo(200);
            assertThat(statusOf(ErrorType.CLIENT_ERROR)).isEqualTo(400);
            assertThat(statusOf(ErrorType.VALIDATION_ERROR)).isEqualTo(400);
            assertThat(statusOf(ErrorType.NO_AVAILABLE_NODE)).isEqualTo(503);
            assertThat(statusOf(ErrorType.CAPACITY_ERROR)).isEqualTo(503);
            assertThat(statusOf(ErrorType.CIRCUIT_OPEN)).isEqualTo(503);
            assertThat(statusOf(ErrorType.FORWARDING_TIMEOUT)).isEqualTo(504);
            assertThat(statusOf(ErrorType.TIMEOUT)).isEqualTo(504);
            assertThat(statusOf(ErrorType.CONNECTION_ERROR)).isEqualTo(502);
            assertThat(statusOf(ErrorType.BATCH_EXECUTION_ERROR)).isEqualTo(502);
            assertThat(statusOf(ErrorType.INTERNAL_ERROR)).isEqualTo(500);
        }
    }

    @Nested
    @DisplayName("Endpoints")
    class EndpointTests {

        private final ObjectMapper mapper = new ObjectMapper();
        private final HttpClient http = HttpClient.newHttpClient();
        private TestGatewayFactory factory;
        private GatewayHttpServer server;

        @BeforeEach
        void setUp() throws IOException {
            factory = TestGatewayFactory.withWorkers("w1", "w2");
            server = factory.createHttpServer(0);
            server.start();
        }

        @AfterEach
        void tearDown() {
            server.close();
            factory.close();
        }

        private HttpResponse<String> send(String method, String path, String body) throws Exception {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path));
            builder.method(method, body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(body));
            builder.header("Content-Type", "application/json");
            return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        }

        @Test
        @DisplayName("should serve an inference request")
        void shouldInfer() throws Exception {
            HttpResponse<String> response = send("POST", "/infer",
                    "{\"request_id\":\"abc\",\"payload\":{\"x\":[1,2]}}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("request_id").asText()).isEqualTo("abc");
            assertThat(body.get("worker_id").asText())
                    .isEqualTo(factory.getWorkerRegistry().getRing().lookup("abc"));
            assertThat(body.get("attempts").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 400 to a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            HttpResponse<String> response = send("POST", "/infer", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(response.body()).get("error_type").asText()).isEqualTo("CLIENT_ERROR");
        }

        @Test
        @DisplayName("should expose the load balance statistics")
        void shouldServeStats() throws Exception {
            send("POST", "/infer", "{\"payload\":1}");

            JsonNode stats = mapper.readTree(send("GET", "/stats", null).body());

            assertThat(stats.get("total_requests").asLong()).isEqualTo(1);
            assertThat(stats.has("load_balance_cv")).isTrue();
            assertThat(stats.get("nodes").has("w1")).isTrue();
            assertThat(stats.get("nodes").has("w2")).isTrue();
        }

        @Test
        @DisplayName("should report health of every node")
        void shouldServeHealth() throws Exception {
            HttpResponse<String> response = send("GET", "/health", null);

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode health = mapper.readTree(response.body());
            assertThat(health.get("status").asText()).isEqualTo("UP");
            assertThat(health.get("nodes")).hasSize(2);
            assertThat(health.get("pipeline").get("running").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should add and remove nodes through the admin API")
        void shouldManageNodes() throws Exception {
            HttpResponse<String> added = send("POST", "/admin/nodes",
                    "{\"id\":\"w3\",\"url\":\"http://localhost:19010\"}");
            assertThat(added.statusCode()).isEqualTo(201);
            assertThat(send("POST", "/admin/nodes",
                    "{\"id\":\"w3\",\"url\":\"http://localhost:19011\"}").statusCode()).isEqualTo(409);

            JsonNode listing = mapper.readTree(send("GET", "/admin/nodes", null).body());
            assertThat(listing.get("nodes")).hasSize(3);
            assertThat(listing.get("ring").get("virtual_nodes").asInt()).isEqualTo(300);

            assertThat(send("DELETE", "/admin/nodes/w3", null).statusCode()).isEqualTo(200);
            assertThat(send("DELETE", "/admin/nodes/w3", null).statusCode()).isEqualTo(404);
            assertThat(factory.getWorkerRegistry().getWorkerIds()).containsExactly("w1", "w2");
        }

        @Test
        @DisplayName("should refuse a reload without a configuration file")
        void shouldRefuseReload() throws Exception {
            assertThat(send("POST", "/admin/reload", null).statusCode()).isEqualTo(409);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldServeMetrics() throws Exception {
            send("POST", "/infer", "{\"payload\":1}");

            HttpResponse<String> response = send("GET", "/metrics", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("inference_router_ring_nodes");
        }
    }
}
