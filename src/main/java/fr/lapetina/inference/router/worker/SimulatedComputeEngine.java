package fr.lapetina.inference.router.worker;

import fr.lapetina.inference.router.batch.Batch;
import fr.lapetina.inference.router.batch.ComputeEngine;
import fr.lapetina.inference.router.batch.ComputeException;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in for a model: sleeps for a batch-size dependent time and returns a
 * normalized class score vector per request.
 *
 * <p>Scores are derived from the payload only, so the same payload always yields the
 * same output whatever batch it lands in.
 */
public final class SimulatedComputeEngine implements ComputeEngine {

    private final long baseLatencyMicros;
    private final long perItemLatencyMicros;
    private final int numClasses;
    private final double failureRate;

    public SimulatedComputeEngine(long baseLatencyMs, long perItemLatencyMicros, int numClasses, double failureRate) {
        if (numClasses < 1) {
            throw new IllegalArgumentException("numClasses must be >= 1, got " + numClasses);
        }
        this.baseLatencyMicros = Math.max(0, baseLatencyMs) * 1000;
        this.perItemLatencyMicros = Math.max(0, perItemLatencyMicros);
        this.numClasses = numClasses;
        this.failureRate = failureRate;
    }

    public static SimulatedComputeEngine fromConfig(RouterConfig.ComputeConfig config) {
        return new SimulatedComputeEngine(
                config.getBaseLatencyMs(),
                config.getPerItemLatencyMicros(),
                config.getNumClasses(),
                config.getFailureRate()
        );
    }

    @Override
    public List<Object> execute(Batch batch) throws ComputeException {
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw new ComputeException("Injected failure for batch " + batch.batchId());
        }

        long latencyMicros = baseLatencyMicros + perItemLatencyMicros * batch.size();
        try {
            TimeUnit.MICROSECONDS.sleep(latencyMicros);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputeException("Interrupted while executing batch " + batch.batchId(), e);
        }

        List<Object> outputs = new ArrayList<>(batch.size());
        for (InferenceRequest request : batch.requests()) {
            outputs.add(score(request.payload()));
        }
        return outputs;
    }

    private Map<String, Object> score(Object payload) {
        SplittableRandom random = new SplittableRandom(Objects.hashCode(payload));
        double[] raw = new double[numClasses];
        double sum = 0;
        for (int i = 0; i < numClasses; i++) {
            raw[i] = random.nextDouble() + 1e-9;
            sum += raw[i];
        }

        List<Double> scores = new ArrayList<>(numClasses);
        int topClass = 0;
        for (int i = 0; i < numClasses; i++) {
            scores.add(raw[i] / sum);
            if (raw[i] > raw[topClass]) {
                topClass = i;
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("scores", scores);
        output.put("top_class", topClass);
        output.put("output_shape", List.of(numClasses));
        return output;
    }
}
