package fr.lapetina.inference.router.domain.routing;

import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.InferenceResult;

import java.util.List;

/**
 * What the gateway did with one request.
 *
 * @param result     result returned to the client
 * @param finalState {@link RequestState#COMPLETED} or {@link RequestState#FAILED_TERMINAL}
 * @param attempts   number of forwarding attempts made
 * @param nodesTried workers tried, owner first
 */
public record ForwardOutcome(
        InferenceResult result,
        RequestState finalState,
        int attempts,
        List<String> nodesTried
) {
    public ForwardOutcome {
        nodesTried = List.copyOf(nodesTried);
    }

    public boolean isSuccess() {
        return finalState == RequestState.COMPLETED;
    }

    public boolean wasRetried() {
        return attempts > 1;
    }
}
