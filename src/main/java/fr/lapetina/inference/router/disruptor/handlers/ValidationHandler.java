package fr.lapetina.inference.router.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.router.domain.event.GatewayRequestEvent;
import fr.lapetina.inference.router.domain.event.RequestState;
import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.domain.model.InferenceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * First stage handler: validates incoming inference requests.
 *
 * Validates:
 * - Request is not null
 * - Payload is present
 * - Request id and routing key are within the length limit
 */
public final class ValidationHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final int maxKeyLength;
    private final Clock clock;

    public ValidationHandler(int maxKeyLength, Clock clock) {
        this.maxKeyLength = maxKeyLength;
        this.clock = clock;
    }

    public static ValidationHandler withDefaults() {
        return new ValidationHandler(1024, Clock.systemUTC());
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        InferenceRequest request = event.getRequest();

        try {
            validate(request);
            event.markValidated(clock.instant());
            log.debug("Request validated: requestId={}, sequence={}", request.requestId(), sequence);
        } catch (ValidationException e) {
            event.reject(RequestState.VALIDATION_FAILED, ErrorType.VALIDATION_ERROR, e.getMessage());
            log.warn("Validation failed: requestId={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null", e.getMessage(), sequence);
        }
    }

    private void validate(InferenceRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }
        if (request.payload() == null) {
            throw new ValidationException("Payload is required");
        }
        if (request.requestId().length() > maxKeyLength) {
            throw new ValidationException("Request id exceeds maximum length of " + maxKeyLength);
        }
        if (request.routingKey().length() > maxKeyLength) {
            throw new ValidationException("Routing key exceeds maximum length of " + maxKeyLength);
        }
    }

    private static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
