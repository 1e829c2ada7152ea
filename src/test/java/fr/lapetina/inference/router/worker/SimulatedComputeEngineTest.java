package fr.lapetina.inference.router.worker;

import fr.lapetina.inference.router.batch.Batch;
import fr.lapetina.inference.router.batch.BatchCloseReason;
import fr.lapetina.inference.router.batch.ComputeException;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimulatedComputeEngineTest {

    private static Batch batchOf(Object... payloads) {
        List<InferenceRequest> requests = new ArrayList<>();
        for (int i = 0; i < payloads.length; i++) {
            requests.add(InferenceRequest.of("r" + i, payloads[i]));
        }
        Instant now = Instant.now();
        return new Batch(1, requests, now, now, BatchCloseReason.SIZE);
    }

    @Test
    @DisplayName("should return one normalized score vector per request")
    @SuppressWarnings("unchecked")
    void shouldReturnNormalizedScores() throws ComputeException {
        SimulatedComputeEngine engine = new SimulatedComputeEngine(0, 0, 5, 0.0);

        List<Object> outputs = engine.execute(batchOf("a", "b", "c"));

        assertThat(outputs).hasSize(3);
        Map<String, Object> first = (Map<String, Object>) outputs.get(0);
        List<Double> scores = (List<Double>) first.get("scores");
        assertThat(scores).hasSize(5);
        assertThat(scores.stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
        assertThat((Integer) first.get("top_class")).isBetween(0, 4);
        assertThat(first.get("output_shape")).isEqualTo(List.of(5));
    }

    @Test
    @DisplayName("should give the same output for the same payload whatever the batch")
    void shouldBeDeterministicPerPayload() throws ComputeException {
        SimulatedComputeEngine engine = new SimulatedComputeEngine(0, 0, 10, 0.0);

        Object alone = engine.execute(batchOf("same")).get(0);
        Object inBatch = engine.execute(batchOf("other", "same", "third")).get(1);

        assertThat(inBatch).isEqualTo(alone);
    }

    @Test
    @DisplayName("should fail the whole batch when the failure rate triggers")
    void shouldInjectFailures() {
        SimulatedComputeEngine engine = new SimulatedComputeEngine(0, 0, 3, 1.0);

        assertThatThrownBy(() -> engine.execute(batchOf("x", "y")))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("Injected failure");
    }

    @Test
    @DisplayName("should reject a class count below one")
    void shouldValidateClassCount() {
        assertThatThrownBy(() -> new SimulatedComputeEngine(0, 0, 0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
