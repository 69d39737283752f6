package com.ryuqq.breaker.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p>이 record는 {@link WindowedCircuitBreaker}의 윈도우 크기와 상태 전이 기준을 담고 있습니다.
 * Breaker가 생성된 뒤에는 바뀌지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>capacity: 버킷 개수 (기본 5)</li>
 *   <li>span: 버킷 하나가 담당하는 시간 (기본 200초)</li>
 *   <li>minEvalSize: 에러율을 계산하기 위한 최소 관측 수 (기본 100)</li>
 *   <li>errorThreshold: OPEN 전이 기준 에러율, 퍼센트 (기본 10.0)</li>
 *   <li>retryTimeout: OPEN 유지 시간 (기본 60초)</li>
 *   <li>trialSuccessRequired: HALF_OPEN에서 CLOSED로 가기 위한 연속 성공 수 (기본 20)</li>
 * </ul>
 *
 * <p><strong>검증 범위:</strong></p>
 * <p>윈도우를 구성할 수 없는 값(capacity &lt; 1, 양수가 아닌 span, 음수 retryTimeout)만 거부합니다.
 * {@code minEvalSize = 0}, {@code errorThreshold = 0}, {@code trialSuccessRequired = 0}은
 * 공격적이지만 유효한 설정입니다.</p>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠른 차단: errorThreshold 감소, minEvalSize 감소</li>
 *   <li>노이즈 내성: minEvalSize 증가, capacity 증가</li>
 *   <li>보수적 복구: retryTimeout 증가, trialSuccessRequired 증가</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 * @param capacity 버킷 개수 (1 이상이어야 함)
 * @param span 버킷 하나의 시간 폭 (양수여야 함)
 * @param minEvalSize 최소 관측 수
 * @param errorThreshold OPEN 전이 기준 에러율 (초과 시 OPEN)
 * @param retryTimeout OPEN 유지 시간 (음수 불가)
 * @param trialSuccessRequired HALF_OPEN 연속 성공 기준
 */
public record BreakerConfig(
    int capacity,
    Duration span,
    int minEvalSize,
    double errorThreshold,
    Duration retryTimeout,
    int trialSuccessRequired
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: capacity=5, span=200s, minEvalSize=100, errorThreshold=10.0,
     * retryTimeout=60s, trialSuccessRequired=20</p>
     */
    public BreakerConfig() {
        this(5, Duration.ofSeconds(200), 100, 10.0, Duration.ofSeconds(60), 20);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BreakerConfig {
        if (capacity < 1) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        if (span.isZero() || span.isNegative()) {
            throw new IllegalArgumentException(
                "span must be positive (current: " + span + ")"
            );
        }
        if (Double.isNaN(errorThreshold)) {
            throw new IllegalArgumentException("errorThreshold cannot be NaN");
        }
        if (retryTimeout == null) {
            throw new IllegalArgumentException("retryTimeout cannot be null");
        }
        if (retryTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "retryTimeout must not be negative (current: " + retryTimeout + ")"
            );
        }
    }

    /**
     * capacity만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withCapacity(int capacity) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }

    /**
     * span만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withSpan(Duration span) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }

    /**
     * minEvalSize만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withMinEvalSize(int minEvalSize) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }

    /**
     * errorThreshold만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withErrorThreshold(double errorThreshold) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }

    /**
     * retryTimeout만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withRetryTimeout(Duration retryTimeout) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }

    /**
     * trialSuccessRequired만 변경한 새 인스턴스 생성.
     */
    public BreakerConfig withTrialSuccessRequired(int trialSuccessRequired) {
        return new BreakerConfig(capacity, span, minEvalSize, errorThreshold, retryTimeout, trialSuccessRequired);
    }
}
