package com.ryuqq.breaker.core.statemachine;

/**
 * Circuit Breaker 상태 종류.
 *
 * <p>{@link BreakerState}의 분기(switch)용 식별자입니다.
 * OPEN의 개방 시각 같은 부가 정보는 {@link BreakerState} 쪽에 있습니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (에러율 &gt; errorThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (retryTimeout 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 trialSuccessRequired회 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>결과를 윈도우에 기록하고, 에러율이 임계값을 초과하면 OPEN으로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>보고된 결과는 무시됩니다. retryTimeout이 지나면 HALF_OPEN으로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 요청으로 복구 확인).
     *
     * <p>연속 성공이 기준에 도달하면 CLOSED, 실패가 한 번이라도 나오면 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
