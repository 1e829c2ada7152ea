package fr.lapetina.inference.router.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceResult;

/**
 * Inference response body returned by the workers and relayed by the gateway.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiResponse {

    @JsonProperty("request_id")
    private String requestId;

    private Object output;

    @JsonProperty("worker_id")
    private String workerId;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("batch_id")
    private Long batchId;

    @JsonProperty("batch_size")
    private Integer batchSize;

    private Integer attempts;

    private String error;

    @JsonProperty("error_type")
    private String errorType;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public Object getOutput() { return output; }
    public void setOutput(Object output) { this.output = output; }

    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }

    public long getLatencyMs() { return latencyMs; }
    public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }

    public Long getBatchId() { return batchId; }
    public void setBatchId(Long batchId) { this.batchId = batchId; }

    public Integer getBatchSize() { return batchSize; }
    public void setBatchSize(Integer batchSize) { this.batchSize = batchSize; }

    public Integer getAttempts() { return attempts; }
    public void setAttempts(Integer attempts) { this.attempts = attempts; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    /**
     * Creates the API response for a result.
     */
    public static ApiResponse fromResult(InferenceResult result) {
        ApiResponse api = new ApiResponse();
        api.setRequestId(result.requestId());
        api.setOutput(result.output());
        api.setWorkerId(result.workerId());
        api.setLatencyMs(result.latencyMs());
        api.setBatchId(result.batchId());
        if (result.isSuccess()) {
            api.setBatchSize(result.batchSize());
        } else {
            api.setError(result.errorMessage());
            api.setErrorType(result.errorType().name());
        }
        return api;
    }

    /**
     * Creates an error body with no result behind it (malformed request, backpressure).
     */
    public static ApiResponse error(String requestId, ErrorType errorType, String message) {
        ApiResponse api = new ApiResponse();
        api.setRequestId(requestId);
        api.setError(message);
        api.setErrorType(errorType.name());
        return api;
    }

    /**
     * Converts a worker's response body back to a domain result. An unknown or
     * missing error type on a failed body becomes {@link ErrorType#WORKER_ERROR}.
     */
    public InferenceResult toResult(String fallbackRequestId) {
        String id = requestId != null ? requestId : fallbackRequestId;
        if (error == null && errorType == null) {
            return InferenceResult.builder()
                    .requestId(id)
                    .output(output)
                    .workerId(workerId)
                    .latencyMs(latencyMs)
                    .batchId(batchId)
                    .batchSize(batchSize != null ? batchSize : 0)
                    .build();
        }
        return InferenceResult.error(id, workerId, parseErrorType(errorType),
                error != null ? error : "Worker reported " + errorType, latencyMs);
    }

    private static ErrorType parseErrorType(String value) {
        if (value == null) {
            return ErrorType.WORKER_ERROR;
        }
        try {
            return ErrorType.valueOf(value);
        } catch (IllegalArgumentException e) {
            return ErrorType.WORKER_ERROR;
        }
    }
}
