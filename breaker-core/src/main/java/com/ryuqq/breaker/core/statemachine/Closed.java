package com.ryuqq.breaker.core.statemachine;

/**
 * 정상 상태.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public record Closed() implements BreakerState {

    /**
     * 공유 인스턴스.
     */
    public static final Closed INSTANCE = new Closed();

    @Override
    public CircuitBreakerState kind() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public String toString() {
        return "Closed";
    }
}
