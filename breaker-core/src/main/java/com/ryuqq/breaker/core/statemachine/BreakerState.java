package com.ryuqq.breaker.core.statemachine;

/**
 * Circuit Breaker의 현재 상태.
 *
 * <p>세 가지 상태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Closed}: 정상, 결과를 윈도우에 기록</li>
 *   <li>{@link Open}: 차단, 개방된 시각을 보유</li>
 *   <li>{@link HalfOpen}: 복구 시험 중</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 구현 타입이 이 세 가지로 제한됩니다.
 * 분기는 {@link #kind()}로 합니다.</p>
 *
 * <pre>
 * switch (state.kind()) {
 *     case CLOSED -&gt; callDependency();
 *     case OPEN -&gt; useFallback();
 *     case HALF_OPEN -&gt; callDependency();
 * }
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public sealed interface BreakerState permits Closed, Open, HalfOpen {

    /**
     * 상태 종류 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState kind();

    /**
     * CLOSED 상태인지 확인.
     *
     * @return CLOSED 여부
     */
    default boolean isClosed() {
        return this instanceof Closed;
    }

    /**
     * OPEN 상태인지 확인.
     *
     * @return OPEN 여부
     */
    default boolean isOpen() {
        return this instanceof Open;
    }

    /**
     * HALF_OPEN 상태인지 확인.
     *
     * @return HALF_OPEN 여부
     */
    default boolean isHalfOpen() {
        return this instanceof HalfOpen;
    }
}
