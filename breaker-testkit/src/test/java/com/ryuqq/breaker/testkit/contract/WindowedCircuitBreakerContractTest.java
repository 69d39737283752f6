package com.ryuqq.breaker.testkit.contract;

import com.ryuqq.breaker.core.protection.BreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.WindowedCircuitBreaker;
import com.ryuqq.breaker.core.statemachine.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the circuit breaker contract against {@link WindowedCircuitBreaker}.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
class WindowedCircuitBreakerContractTest extends AbstractCircuitBreakerContractTest {

    @Override
    protected CircuitBreaker createBreaker(BreakerConfig config, Clock clock) {
        return new WindowedCircuitBreaker(config, clock);
    }

    @Test
    void idleBreaker_ForgetsFailuresOlderThanTheWindow() {
        // Given
        report(false, false, false, false, false);

        // When
        clock.advance(Duration.ofSeconds(10));

        // Then
        assertBreakerState(CircuitBreakerState.CLOSED);
        assertWindowEmpty();
    }

    @Test
    void reopenedBreaker_WaitsAFullRetryTimeoutAgain() {
        // Given
        halfOpenBreaker();
        report(false);

        // When
        clock.advanceMillis(100);

        // Then
        assertBreakerState(CircuitBreakerState.OPEN);
        clock.advanceMillis(100);
        assertBreakerState(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void window_KeepsCountingAfterRecovery() {
        // Given
        halfOpenBreaker();
        report(true, true, true);
        assertBreakerState(CircuitBreakerState.CLOSED);

        // When
        report(true, false);

        // Then
        assertEquals(1, breaker.inspectBucket(breaker.cursor()).successCount());
        assertEquals(1, breaker.inspectBucket(breaker.cursor()).failureCount());
    }
}
