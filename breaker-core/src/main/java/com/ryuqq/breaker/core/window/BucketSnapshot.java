package com.ryuqq.breaker.core.window;

/**
 * 버킷 조회 결과 (불변 record).
 *
 * <p>진단 및 시각화 용도로 {@link WindowedCounter#inspect(int)}가 반환합니다.
 * 반환 이후 버킷이 갱신되어도 이 값은 바뀌지 않습니다.</p>
 *
 * @param successCount 성공 횟수 (0 이상)
 * @param failureCount 실패 횟수 (0 이상)
 * @author Breaker Team
 * @since 1.0.0
 */
public record BucketSnapshot(long successCount, long failureCount) {

    /**
     * 비어 있는 버킷.
     */
    public static final BucketSnapshot EMPTY = new BucketSnapshot(0, 0);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 카운트가 음수인 경우
     */
    public BucketSnapshot {
        if (successCount < 0) {
            throw new IllegalArgumentException(
                "successCount must be non-negative (current: " + successCount + ")"
            );
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException(
                "failureCount must be non-negative (current: " + failureCount + ")"
            );
        }
    }

    /**
     * 전체 관측 수.
     *
     * @return successCount + failureCount
     */
    public long total() {
        return successCount + failureCount;
    }

    /**
     * 관측이 하나도 없는지 확인.
     *
     * @return 비어 있으면 true
     */
    public boolean isEmpty() {
        return total() == 0;
    }
}
