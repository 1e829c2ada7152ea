package fr.lapetina.inference.router.batch;

import fr.lapetina.inference.router.domain.model.InferenceRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A closed batch handed to the {@link ComputeEngine}.
 * Requests are in the order they were submitted to the queue.
 */
public record Batch(
        long batchId,
        List<InferenceRequest> requests,
        Instant createdAt,
        Instant closedAt,
        BatchCloseReason closeReason
) {
    public Batch {
        requests = List.copyOf(Objects.requireNonNull(requests, "Requests are required"));
        Objects.requireNonNull(createdAt, "Creation time is required");
    }

    public int size() {
        return requests.size();
    }

    /**
     * Time between the first request joining the batch and the batch closing.
     */
    public Duration age() {
        return closedAt == null ? Duration.ZERO : Duration.between(createdAt, closedAt);
    }
}
