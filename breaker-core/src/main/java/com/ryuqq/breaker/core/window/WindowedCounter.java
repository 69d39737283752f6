package com.ryuqq.breaker.core.window;

import java.time.Duration;
import java.time.Instant;

/**
 * 시간 구간(span)별 성공/실패 집계를 유지하는 고정 크기 원형 버퍼.
 *
 * <p>버킷 {@code capacity}개를 미리 할당하고, cursor가 가리키는 버킷을
 * "현재"(아직 진행 중인) 버킷으로 취급합니다. 현재 버킷은 에러율 계산에서
 * 항상 제외됩니다.</p>
 *
 * <p><strong>Advance 알고리즘:</strong></p>
 * <pre>
 * target = floor((now - origin) / span)     // origin 기준 절대 span 인덱스
 * steps  = target - lastSpanIndex
 * steps &lt;= 0          → 변경 없음 (같은 now로 두 번 호출해도 멱등)
 * steps &gt;= capacity   → 모든 버킷 초기화
 * otherwise          → cursor+1 .. cursor+steps 버킷 초기화 (도착 버킷 포함)
 * cursor = (cursor + steps) % capacity
 * </pre>
 *
 * <p>건너뛴 span 수만큼 인덱스 연산으로 처리하므로, 비용은 경과 시간이 아니라
 * {@code capacity}에 비례합니다. 호출 간격이 길어도 절대 인덱스를 기준으로
 * 계산하므로 cursor가 밀리지 않습니다.</p>
 *
 * <p><strong>스레드 안전하지 않음:</strong> 동시 접근 시 호출자가 직렬화해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class WindowedCounter {

    private final Bucket[] buckets;
    private final Duration span;

    private Instant origin;
    private long spanIndex;
    private int cursor;

    /**
     * 생성자.
     *
     * @param capacity 버킷 수 (1 이상)
     * @param span 버킷 하나가 담당하는 시간 (양수)
     * @param origin span 인덱스 계산 기준 시각
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WindowedCounter(int capacity, Duration span, Instant origin) {
        if (capacity < 1) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        if (span == null || span.isZero() || span.isNegative()) {
            throw new IllegalArgumentException("span must be positive (current: " + span + ")");
        }
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }

        this.buckets = new Bucket[capacity];
        for (int i = 0; i < capacity; i++) {
            buckets[i] = new Bucket();
        }
        this.span = span;
        this.origin = origin;
        this.spanIndex = 0;
        this.cursor = 0;
    }

    /**
     * 경과한 span 수만큼 cursor를 전진시키고 지나간 버킷을 초기화.
     *
     * <p>{@code now}가 마지막 advance 시점보다 이전이거나 같은 span 안이면 아무것도 하지 않습니다.</p>
     *
     * @param now 현재 시각
     * @throws IllegalArgumentException now가 null인 경우
     */
    public void advance(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }

        long target = spanIndexAt(now);
        long steps = target - spanIndex;
        if (steps <= 0) {
            return;
        }

        int capacity = buckets.length;
        if (steps >= capacity) {
            for (Bucket bucket : buckets) {
                bucket.clear();
            }
        } else {
            for (int i = 1; i <= steps; i++) {
                buckets[(cursor + i) % capacity].clear();
            }
        }

        cursor = (int) ((cursor + steps % capacity) % capacity);
        spanIndex = target;
    }

    /**
     * 성공 기록.
     *
     * @param now 현재 시각
     */
    public void recordSuccess(Instant now) {
        advance(now);
        buckets[cursor].addSuccess();
    }

    /**
     * 실패 기록.
     *
     * @param now 현재 시각
     */
    public void recordFailure(Instant now) {
        advance(now);
        buckets[cursor].addFailure();
    }

    /**
     * 완료된 버킷(현재 버킷 제외)의 에러율 계산.
     *
     * <p>관측 합계가 0이거나 {@code minEvalSize} 미만이면 0을 반환합니다.
     * 그 외에는 {@code 100 × failures / total}을 소수점 둘째 자리로 반올림합니다.</p>
     *
     * @param minEvalSize 평가에 필요한 최소 관측 수
     * @return 에러율 (0.0 ~ 100.0)
     */
    public double errorRate(int minEvalSize) {
        long failures = 0;
        long total = 0;

        for (int i = 0; i < buckets.length; i++) {
            if (i == cursor) {
                continue;
            }
            failures += buckets[i].failureCount();
            total += buckets[i].total();
        }

        if (total == 0 || total < minEvalSize) {
            return 0.0;
        }
        return Math.round(failures * 10_000.0 / total) / 100.0;
    }

    /**
     * 특정 버킷 조회.
     *
     * @param index 버킷 인덱스 (0 이상, capacity 미만)
     * @return 버킷 스냅샷
     * @throws IndexOutOfBoundsException 인덱스가 범위를 벗어난 경우
     */
    public BucketSnapshot inspect(int index) {
        if (index < 0 || index >= buckets.length) {
            throw new IndexOutOfBoundsException(
                "bucket index out of range (index: " + index + ", capacity: " + buckets.length + ")"
            );
        }
        return buckets[index].snapshot();
    }

    /**
     * 모든 버킷을 비우고 cursor를 0으로 되돌림.
     *
     * <p>이후 span 인덱스는 {@code origin}을 기준으로 다시 계산됩니다.</p>
     *
     * @param origin 새 기준 시각
     * @throws IllegalArgumentException origin이 null인 경우
     */
    public void reset(Instant origin) {
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        for (Bucket bucket : buckets) {
            bucket.clear();
        }
        this.origin = origin;
        this.spanIndex = 0;
        this.cursor = 0;
    }

    public int capacity() {
        return buckets.length;
    }

    public int cursor() {
        return cursor;
    }

    public Duration span() {
        return span;
    }

    private long spanIndexAt(Instant now) {
        Duration elapsed = Duration.between(origin, now);
        if (elapsed.isNegative()) {
            return 0;
        }
        return elapsed.dividedBy(span);
    }
}
