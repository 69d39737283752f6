package com.ryuqq.breaker.core.statemachine;

/**
 * 반개방 상태 (복구 시험 중).
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public record HalfOpen() implements BreakerState {

    /**
     * 공유 인스턴스.
     */
    public static final HalfOpen INSTANCE = new HalfOpen();

    @Override
    public CircuitBreakerState kind() {
        return CircuitBreakerState.HALF_OPEN;
    }

    @Override
    public String toString() {
        return "HalfOpen";
    }
}
