package fr.lapetina.inference.router.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.router.domain.model.InferenceRequest;

/**
 * Inference request body accepted by both the gateway and the workers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiRequest {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("routing_key")
    private String routingKey;

    private Object payload;

    public ApiRequest() {
    }

    public ApiRequest(String requestId, String routingKey, Object payload) {
        this.requestId = requestId;
        this.routingKey = routingKey;
        this.payload = payload;
    }

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getRoutingKey() { return routingKey; }
    public void setRoutingKey(String routingKey) { this.routingKey = routingKey; }

    public Object getPayload() { return payload; }
    public void setPayload(Object payload) { this.payload = payload; }

    /**
     * Converts to domain InferenceRequest. A missing id is generated and a missing
     * routing key defaults to the id.
     */
    public InferenceRequest toInferenceRequest() {
        return InferenceRequest.builder()
                .requestId(requestId)
                .routingKey(routingKey)
                .payload(payload)
                .build();
    }

    /**
     * Body forwarded by the gateway to a worker.
     */
    public static ApiRequest fromInferenceRequest(InferenceRequest request) {
        return new ApiRequest(request.requestId(), request.routingKey(), request.payload());
    }
}
