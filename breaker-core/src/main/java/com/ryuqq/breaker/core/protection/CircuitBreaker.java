package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.statemachine.BreakerState;
import com.ryuqq.breaker.core.window.BucketSnapshot;

import java.time.Instant;

/**
 * Circuit Breaker SPI.
 *
 * <p>의존 대상 호출의 최근 실패율을 추적하고, 임계값 초과 시 빠르게 실패(Fail-Fast)하도록
 * 호출 여부를 판단합니다. Breaker는 보호 대상 작업을 직접 실행하지 않습니다.
 * 호출자가 작업을 실행하고 결과만 보고합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 결과를 윈도우에 기록</li>
 *   <li>OPEN: 요청 차단, 보고된 결과 무시</li>
 *   <li>HALF_OPEN: 시험 요청으로 복구 확인</li>
 * </ul>
 *
 * <p><strong>지연 평가:</strong></p>
 * <p>백그라운드 타이머가 없습니다. {@link #reportOutcome(boolean)}과 {@link #currentState()}가
 * 호출될 때마다 경과 시간에 따른 전이(OPEN → HALF_OPEN, 버킷 만료)를 먼저 반영합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = new WindowedCircuitBreaker(new BreakerConfig());
 *
 * if (!cb.tryAcquire()) {
 *     // Circuit Breaker OPEN 상태
 *     return fallback();
 * }
 *
 * try {
 *     Result result = dependency.call();
 *     cb.recordSuccess();
 *     return result;
 * } catch (Exception e) {
 *     cb.recordFailure();
 *     throw e;
 * }
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <p>구현체는 스레드 안전하지 않습니다. 여러 스레드가 공유하는 경우
 * 호출자가 모든 접근을 직렬화해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 결과 보고 (현재 시각 기준).
     *
     * @param success 성공 여부
     * @see #reportOutcome(boolean, Instant)
     */
    void reportOutcome(boolean success);

    /**
     * 호출 결과 보고.
     *
     * <p>먼저 {@code now} 기준으로 시간에 따른 전이를 반영한 뒤, 그 결과 상태에 따라 처리합니다.</p>
     *
     * <ul>
     *   <li>CLOSED: 윈도우에 기록, 실패라면 다시 평가 (OPEN 전이 가능)</li>
     *   <li>OPEN: 무시 (윈도우와 시험 성공 수 모두 변하지 않음)</li>
     *   <li>HALF_OPEN 성공: 시험 성공 수 증가 후 다시 평가 (CLOSED 전이 가능)</li>
     *   <li>HALF_OPEN 실패: 즉시 OPEN 전이, 시험 성공 수 0으로 초기화</li>
     * </ul>
     *
     * @param success 성공 여부
     * @param now 보고 시각
     */
    void reportOutcome(boolean success, Instant now);

    /**
     * 성공 보고.
     */
    default void recordSuccess() {
        reportOutcome(true);
    }

    /**
     * 실패 보고.
     */
    default void recordFailure() {
        reportOutcome(false);
    }

    /**
     * 현재 상태 조회 (현재 시각 기준).
     *
     * @return 지연 전이가 반영된 상태
     */
    BreakerState currentState();

    /**
     * 현재 상태 조회.
     *
     * <p>시간에 따른 전이를 반영한 뒤 상태를 반환합니다.
     * 반환값이 OPEN이면 호출자는 보호 대상 작업을 건너뛰어야 합니다.</p>
     *
     * @param now 조회 시각
     * @return 지연 전이가 반영된 상태
     */
    BreakerState currentState(Instant now);

    /**
     * 요청 통과 허용 여부 확인.
     *
     * <p>지연 평가 후 상태가 OPEN이면 false, 그 외에는 true를 반환합니다.</p>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    default boolean tryAcquire() {
        return !currentState().isOpen();
    }

    /**
     * 최근 에러율 조회.
     *
     * <p>현재 진행 중인 버킷을 제외한 완료된 버킷들의 실패 비율입니다.
     * 관측 수가 minEvalSize 미만이면 0.0입니다. 상태를 바꾸지 않습니다.</p>
     *
     * @return 0.0 ~ 100.0, 소수점 둘째 자리
     */
    double errorRate();

    /**
     * 버킷 조회 (진단 및 시각화용).
     *
     * @param index 버킷 인덱스 (0 ~ capacity - 1)
     * @return 버킷 스냅샷
     * @throws IndexOutOfBoundsException 범위를 벗어난 인덱스
     */
    BucketSnapshot inspectBucket(int index);

    /**
     * 현재 진행 중인 버킷 인덱스.
     *
     * @return cursor
     */
    int cursor();

    /**
     * HALF_OPEN에서 누적된 연속 성공 수.
     *
     * @return 시험 성공 수 (HALF_OPEN이 아니면 0)
     */
    int trialSuccess();

    /**
     * 설정 조회.
     *
     * @return 불변 설정
     */
    BreakerConfig configuration();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>윈도우와 시험 성공 수를 모두 초기화합니다. 자동 전이 규칙을 따르지 않으므로
     * 수동 복구나 테스트 목적으로만 사용해야 합니다.</p>
     */
    void reset();
}
