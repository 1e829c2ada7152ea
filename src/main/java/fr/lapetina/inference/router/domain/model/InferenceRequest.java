package fr.lapetina.inference.router.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single inference request as it travels from the gateway to a worker's batch queue.
 * Immutable and thread-safe.
 *
 * <p>The payload is opaque to the router: it is whatever JSON value the client sent
 * (map, list, number, string) and is only interpreted by the compute engine.
 */
public record InferenceRequest(
        String requestId,
        String routingKey,
        Object payload,
        Instant arrivalTime
) {
    public InferenceRequest {
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (routingKey == null || routingKey.isBlank()) {
            routingKey = requestId;
        }
        if (arrivalTime == null) {
            arrivalTime = Instant.now();
        }
    }

    /**
     * Creates a request whose routing key is its own id.
     */
    public static InferenceRequest of(String requestId, Object payload) {
        return new InferenceRequest(requestId, null, payload, null);
    }

    /**
     * Creates a request with a generated id.
     */
    public static InferenceRequest ofPayload(Object payload) {
        return new InferenceRequest(null, null, payload, null);
    }

    /**
     * Returns a copy stamped with a new arrival time, used when a worker receives
     * a forwarded request and starts its own latency clock.
     */
    public InferenceRequest arrivedAt(Instant instant) {
        return new InferenceRequest(requestId, routingKey, payload, Objects.requireNonNull(instant));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String routingKey;
        private Object payload;
        private Instant arrivalTime;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder arrivalTime(Instant arrivalTime) {
            this.arrivalTime = arrivalTime;
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(requestId, routingKey, payload, arrivalTime);
        }
    }
}
