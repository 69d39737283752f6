package com.ryuqq.breaker.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WindowedCounter 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("WindowedCounter 테스트")
class WindowedCounterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration SPAN = Duration.ofSeconds(1);

    private static Instant at(long millis) {
        return T0.plusMillis(millis);
    }

    /**
     * 0 ~ 4번 버킷에 각각 (i + 1)개의 실패를 기록하고 cursor를 4에 둔다.
     */
    private static WindowedCounter filledCounter() {
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);
        for (int i = 0; i < 5; i++) {
            for (int n = 0; n <= i; n++) {
                counter.recordFailure(at(i * 1000L));
            }
        }
        return counter;
    }

    @Test
    @DisplayName("같은 시각으로 두 번 호출해도 두 번째는 아무것도 바꾸지 않는다")
    void advance_같은_시각_멱등() {
        // given
        WindowedCounter counter = filledCounter();
        counter.advance(at(6_500));
        int cursor = counter.cursor();
        BucketSnapshot[] before = snapshots(counter);

        // when
        counter.advance(at(6_500));

        // then
        assertThat(counter.cursor()).isEqualTo(cursor);
        assertThat(snapshots(counter)).containsExactly(before);
    }

    @Test
    @DisplayName("같은 span 안의 이후 시각은 cursor를 움직이지 않는다")
    void advance_같은_span_안에서는_정지() {
        // given
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);
        counter.recordSuccess(at(1_000));

        // when
        counter.advance(at(1_999));

        // then
        assertThat(counter.cursor()).isEqualTo(1);
        assertThat(counter.inspect(1)).isEqualTo(new BucketSnapshot(1, 0));
    }

    @Test
    @DisplayName("capacity 만큼 한 칸씩 전진하면 모든 버킷이 비워진다")
    void advance_capacity번_전진_후_모두_초기화() {
        // given
        WindowedCounter counter = filledCounter();

        // when
        for (int i = 5; i < 10; i++) {
            counter.advance(at(i * 1000L));
        }

        // then
        assertThat(snapshots(counter)).allMatch(BucketSnapshot::isEmpty);
        assertThat(counter.cursor()).isEqualTo(4);
    }

    @Test
    @DisplayName("capacity 이상을 한 번에 건너뛰면 모든 버킷이 비워진다")
    void advance_capacity_이상_건너뛰기() {
        // given
        WindowedCounter counter = filledCounter();

        // when
        counter.advance(at(42_000));

        // then
        assertThat(snapshots(counter)).allMatch(BucketSnapshot::isEmpty);
        assertThat(counter.cursor()).isEqualTo(42 % 5);
    }

    @Test
    @DisplayName("k < capacity 만큼 건너뛰면 지나간 버킷과 도착 버킷만 비워진다")
    void advance_일부_건너뛰기() {
        // given (cursor = 4)
        WindowedCounter counter = filledCounter();

        // when (4 -> 1, 0번과 1번을 지나감)
        counter.advance(at(6_000));

        // then
        assertThat(counter.cursor()).isEqualTo(1);
        assertThat(counter.inspect(0).isEmpty()).isTrue();
        assertThat(counter.inspect(1).isEmpty()).isTrue();
        assertThat(counter.inspect(2)).isEqualTo(new BucketSnapshot(0, 3));
        assertThat(counter.inspect(3)).isEqualTo(new BucketSnapshot(0, 4));
        assertThat(counter.inspect(4)).isEqualTo(new BucketSnapshot(0, 5));
    }

    @Test
    @DisplayName("span 경계는 기준 시각에서 계산되므로 드문 호출에도 밀리지 않는다")
    void advance_기준_시각_기반_인덱스() {
        // given
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);
        counter.recordFailure(at(900));

        // when (마지막 기록에서 200ms 후지만 span 경계를 넘음)
        counter.advance(at(1_100));

        // then
        assertThat(counter.cursor()).isEqualTo(1);
        assertThat(counter.inspect(0)).isEqualTo(new BucketSnapshot(0, 1));
    }

    @Test
    @DisplayName("이전 시각으로는 되돌아가지 않는다")
    void advance_과거_시각_무시() {
        // given
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);
        counter.recordFailure(at(3_000));

        // when
        counter.advance(at(1_000));
        counter.recordSuccess(at(1_000));

        // then
        assertThat(counter.cursor()).isEqualTo(3);
        assertThat(counter.inspect(3)).isEqualTo(new BucketSnapshot(1, 1));
    }

    @Test
    @DisplayName("현재 버킷은 에러율 계산에서 제외된다")
    void errorRate_현재_버킷_제외() {
        // given
        WindowedCounter counter = new WindowedCounter(3, SPAN, T0);
        counter.recordFailure(at(0));
        counter.recordFailure(at(0));

        // when & then
        assertThat(counter.errorRate(0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("관측 수가 minEvalSize 미만이면 100% 실패여도 0.0")
    void errorRate_minEvalSize_미만() {
        // given
        WindowedCounter counter = new WindowedCounter(3, SPAN, T0);
        counter.recordFailure(at(0));
        counter.recordFailure(at(0));
        counter.recordFailure(at(0));
        counter.advance(at(1_000));

        // when & then
        assertThat(counter.errorRate(4)).isEqualTo(0.0);
        assertThat(counter.errorRate(3)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("minEvalSize가 0이어도 관측이 없으면 0.0")
    void errorRate_관측_없음() {
        // given
        WindowedCounter counter = new WindowedCounter(3, SPAN, T0);

        // when & then
        assertThat(counter.errorRate(0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("소수점 둘째 자리로 반올림한다")
    void errorRate_반올림() {
        // given
        WindowedCounter oneThird = new WindowedCounter(2, SPAN, T0);
        oneThird.recordFailure(at(0));
        oneThird.recordSuccess(at(0));
        oneThird.recordSuccess(at(0));
        oneThird.advance(at(1_000));

        WindowedCounter twoThirds = new WindowedCounter(2, SPAN, T0);
        twoThirds.recordFailure(at(0));
        twoThirds.recordFailure(at(0));
        twoThirds.recordSuccess(at(0));
        twoThirds.advance(at(1_000));

        // when & then
        assertThat(oneThird.errorRate(0)).isEqualTo(33.33);
        assertThat(twoThirds.errorRate(0)).isEqualTo(66.67);
    }

    @Test
    @DisplayName("여러 완료 버킷을 합산한다")
    void errorRate_완료_버킷_합산() {
        // given
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);
        counter.recordFailure(at(0));
        counter.recordSuccess(at(0));
        counter.recordFailure(at(1_000));
        counter.recordFailure(at(1_000));
        counter.recordSuccess(at(2_000));

        // when (cursor = 2, 0번과 1번만 합산: 3F / 4)
        double rate = counter.errorRate(0);

        // then
        assertThat(rate).isEqualTo(75.0);
    }

    @Test
    @DisplayName("범위를 벗어난 버킷 조회는 IndexOutOfBoundsException")
    void inspect_범위_밖() {
        // given
        WindowedCounter counter = new WindowedCounter(5, SPAN, T0);

        // when & then
        assertThatThrownBy(() -> counter.inspect(5))
            .isInstanceOf(IndexOutOfBoundsException.class)
            .hasMessageContaining("index: 5")
            .hasMessageContaining("capacity: 5");
        assertThatThrownBy(() -> counter.inspect(-1))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("reset은 모든 버킷을 비우고 새 기준 시각에서 다시 시작한다")
    void reset_새_기준_시각() {
        // given
        WindowedCounter counter = filledCounter();

        // when
        counter.reset(at(10_500));

        // then
        assertThat(counter.cursor()).isZero();
        assertThat(snapshots(counter)).allMatch(BucketSnapshot::isEmpty);

        counter.advance(at(11_400));
        assertThat(counter.cursor()).isZero();
        counter.advance(at(11_500));
        assertThat(counter.cursor()).isEqualTo(1);
    }

    @Test
    @DisplayName("capacity가 1 미만이면 IllegalArgumentException")
    void constructor_capacity_검증() {
        assertThatThrownBy(() -> new WindowedCounter(0, SPAN, T0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be positive");
    }

    @Test
    @DisplayName("span이 0이면 IllegalArgumentException")
    void constructor_span_검증() {
        assertThatThrownBy(() -> new WindowedCounter(3, Duration.ZERO, T0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("span must be positive");
    }

    private static BucketSnapshot[] snapshots(WindowedCounter counter) {
        BucketSnapshot[] result = new BucketSnapshot[counter.capacity()];
        for (int i = 0; i < result.length; i++) {
            result[i] = counter.inspect(i);
        }
        return result;
    }
}
