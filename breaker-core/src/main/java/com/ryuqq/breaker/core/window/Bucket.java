package com.ryuqq.breaker.core.window;

/**
 * 한 span 동안 관측된 성공/실패 집계.
 *
 * <p>{@link WindowedCounter}만 변경하며, 외부에는 {@link BucketSnapshot}으로만 노출됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
final class Bucket {

    private long successCount;
    private long failureCount;

    void addSuccess() {
        successCount++;
    }

    void addFailure() {
        failureCount++;
    }

    long successCount() {
        return successCount;
    }

    long failureCount() {
        return failureCount;
    }

    long total() {
        return successCount + failureCount;
    }

    /**
     * 집계를 0으로 초기화 (eviction).
     */
    void clear() {
        successCount = 0;
        failureCount = 0;
    }

    BucketSnapshot snapshot() {
        return new BucketSnapshot(successCount, failureCount);
    }
}
