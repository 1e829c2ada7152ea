package fr.lapetina.inference.router.domain.model;

import java.util.Objects;

/**
 * Outcome of one inference request: either an output produced by a worker's
 * compute engine or an error. Exactly one result is delivered per request.
 * Immutable and thread-safe.
 */
public record InferenceResult(
        String requestId,
        Object output,
        String workerId,
        long latencyMs,
        Long batchId,
        int batchSize,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResult {
        Objects.requireNonNull(requestId, "Request ID is required");
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Creates a successful result for a request that was executed in a batch.
     */
    public static InferenceResult success(
            String requestId,
            Object output,
            String workerId,
            long latencyMs,
            long batchId,
            int batchSize
    ) {
        return new InferenceResult(requestId, output, workerId, latencyMs, batchId, batchSize, null, null);
    }

    /**
     * Creates an error result.
     */
    public static InferenceResult error(
            String requestId,
            String workerId,
            ErrorType errorType,
            String errorMessage,
            long latencyMs
    ) {
        return new InferenceResult(requestId, null, workerId, latencyMs, null, 0,
                Objects.requireNonNull(errorType, "Error type is required"), errorMessage);
    }

    /**
     * Returns a copy with the latency replaced, used by the gateway to report
     * end-to-end latency rather than the worker-side one.
     */
    public InferenceResult withLatencyMs(long newLatencyMs) {
        return new InferenceResult(requestId, output, workerId, newLatencyMs, batchId, batchSize,
                errorType, errorMessage);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private Object output;
        private String workerId;
        private long latencyMs;
        private Long batchId;
        private int batchSize;
        private ErrorType errorType;
        private String errorMessage;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder output(Object output) {
            this.output = output;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder batchId(Long batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public InferenceResult build() {
            return new InferenceResult(requestId, output, workerId, latencyMs, batchId, batchSize,
                    errorType, errorMessage);
        }
    }
}
