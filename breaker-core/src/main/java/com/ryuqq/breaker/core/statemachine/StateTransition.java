package com.ryuqq.breaker.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Circuit Breaker의 상태 전이가 허용된 규칙을 따르는지
 * 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED</li>
 *   <li>HALF_OPEN → OPEN</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>OPEN에서 CLOSED로 바로 돌아갈 수 없음 (반드시 HALF_OPEN을 거침)</li>
 *   <li>같은 상태로의 전이는 전이가 아님</li>
 * </ul>
 *
 * <p>수동 reset은 이 규칙을 따르지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태 종류
     * @param to 전이할 상태 종류
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * <p>검증을 통과한 경우에만 새로운 상태를 반환합니다.</p>
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BreakerState transition(BreakerState current, BreakerState next) {
        if (current == null || next == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + current + ", to: " + next + ")");
        }
        validate(current.kind(), next.kind());
        return next;
    }
}
