package fr.lapetina.inference.router.domain.routing;

import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Bounded fallback policy of the gateway.
 *
 * <p>When disabled, a failed forward is returned to the client as is: the key stays
 * tied to its owner. When enabled, a retryable failure is retried on the next
 * distinct ring successor, up to {@code maxAttempts} attempts in total.
 *
 * @param enabled           whether fallback attempts are made at all
 * @param maxAttempts       total attempts including the first one
 * @param initialBackoff    pause before the first fallback attempt
 * @param maxBackoff        upper bound of the pause
 * @param backoffMultiplier growth of the pause between fallback attempts
 */
public record RetryPolicy(
        boolean enabled,
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier
) {
    private static final Set<ErrorType> RETRYABLE = EnumSet.of(
            ErrorType.FORWARDING_TIMEOUT,
            ErrorType.CONNECTION_ERROR,
            ErrorType.WORKER_ERROR,
            ErrorType.CIRCUIT_OPEN,
            ErrorType.BATCH_EXECUTION_ERROR,
            ErrorType.TIMEOUT,
            ErrorType.CAPACITY_ERROR
    );

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ZERO;
        }
        if (maxBackoff == null) {
            maxBackoff = initialBackoff;
        }
        if (backoffMultiplier < 1.0) {
            backoffMultiplier = 1.0;
        }
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, 1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public static RetryPolicy fromConfig(RouterConfig.RetryConfig config) {
        if (!config.isEnabled()) {
            return disabled();
        }
        return new RetryPolicy(
                true,
                config.getMaxAttempts(),
                Duration.ofMillis(config.getInitialBackoffMs()),
                Duration.ofMillis(config.getMaxBackoffMs()),
                config.getBackoffMultiplier()
        );
    }

    /**
     * Whether attempt number {@code attempt} (1-based) may be made.
     */
    public boolean allowsAttempt(int attempt) {
        return attempt == 1 || (enabled && attempt <= maxAttempts);
    }

    /**
     * Whether a failure of this type may be retried on another node.
     */
    public boolean isRetryable(ErrorType errorType) {
        return enabled && errorType != null && RETRYABLE.contains(errorType);
    }

    /**
     * Pause before attempt number {@code attempt} (1-based); zero for the first.
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 2);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
