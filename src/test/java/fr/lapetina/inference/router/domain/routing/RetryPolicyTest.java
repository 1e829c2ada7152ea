package fr.lapetina.inference.router.domain.routing;

import fr.lapetina.inference.router.domain.model.ErrorType;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("should allow only the first attempt when disabled")
    void shouldOnlyAllowFirstAttemptWhenDisabled() {
        RetryPolicy policy = RetryPolicy.disabled();

        assertThat(policy.allowsAttempt(1)).isTrue();
        assertThat(policy.allowsAttempt(2)).isFalse();
        assertThat(policy.isRetryable(ErrorType.CONNECTION_ERROR)).isFalse();
    }

    @Test
    @DisplayName("should be disabled by default configuration")
    void shouldBeDisabledByDefault() {
        assertThat(RetryPolicy.fromConfig(new RouterConfig.RetryConfig()).enabled()).isFalse();
    }

    @Test
    @DisplayName("should bound attempts and retry only node-side failures")
    void shouldBoundAttempts() {
        RetryPolicy policy = new RetryPolicy(true, 3, Duration.ofMillis(10), Duration.ofMillis(25), 2.0);

        assertThat(policy.allowsAttempt(3)).isTrue();
        assertThat(policy.allowsAttempt(4)).isFalse();
        assertThat(policy.isRetryable(ErrorType.CONNECTION_ERROR)).isTrue();
        assertThat(policy.isRetryable(ErrorType.CIRCUIT_OPEN)).isTrue();
        assertThat(policy.isRetryable(ErrorType.CLIENT_ERROR)).isFalse();
        assertThat(policy.isRetryable(ErrorType.VALIDATION_ERROR)).isFalse();
        assertThat(policy.isRetryable(null)).isFalse();
    }

    @Test
    @DisplayName("should grow the backoff geometrically up to the maximum")
    void shouldComputeBackoff() {
        RetryPolicy policy = new RetryPolicy(true, 5, Duration.ofMillis(10), Duration.ofMillis(25), 2.0);

        assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ZERO);
        assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofMillis(10));
        assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.backoffBefore(4)).isEqualTo(Duration.ofMillis(25));
    }

    @Test
    @DisplayName("should reject fewer than one attempt")
    void shouldValidateAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(true, 0, null, null, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
