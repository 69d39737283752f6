package com.ryuqq.breaker.core.statemachine;

import java.time.Duration;
import java.time.Instant;

/**
 * 차단 상태.
 *
 * <p>개방된 시각을 보유하며, {@code retryTimeout} 경과 여부 판단에 사용됩니다.</p>
 *
 * @param openedAt OPEN으로 전이한 시각
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public record Open(Instant openedAt) implements BreakerState {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException openedAt이 null인 경우
     */
    public Open {
        if (openedAt == null) {
            throw new IllegalArgumentException("openedAt cannot be null");
        }
    }

    @Override
    public CircuitBreakerState kind() {
        return CircuitBreakerState.OPEN;
    }

    /**
     * retryTimeout이 지났는지 확인.
     *
     * <p>{@code now - openedAt >= retryTimeout}이면 true입니다.</p>
     *
     * @param now 현재 시각
     * @param retryTimeout OPEN 유지 시간
     * @return HALF_OPEN으로 전이할 수 있으면 true
     */
    public boolean retryDue(Instant now, Duration retryTimeout) {
        return Duration.between(openedAt, now).compareTo(retryTimeout) >= 0;
    }

    /**
     * HALF_OPEN 전이까지 남은 시간.
     *
     * <p>{@code openedAt + retryTimeout}을 계산하지 않으므로 아주 긴 retryTimeout에도
     * 오버플로가 없습니다.</p>
     *
     * @param now 현재 시각
     * @param retryTimeout OPEN 유지 시간
     * @return 남은 시간 (이미 지났으면 {@link Duration#ZERO})
     */
    public Duration remaining(Instant now, Duration retryTimeout) {
        Duration elapsed = Duration.between(openedAt, now);
        if (elapsed.isNegative()) {
            return retryTimeout;
        }
        Duration left = retryTimeout.minus(elapsed);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
