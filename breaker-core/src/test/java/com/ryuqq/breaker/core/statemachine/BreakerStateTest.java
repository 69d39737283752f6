package com.ryuqq.breaker.core.statemachine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BreakerState sealed 계층 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("BreakerState 테스트")
class BreakerStateTest {

    private static final Instant OPENED_AT = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("각 상태는 자신의 kind와 isX 판별을 가진다")
    void kind_와_판별_메서드() {
        // given
        BreakerState closed = Closed.INSTANCE;
        BreakerState open = new Open(OPENED_AT);
        BreakerState halfOpen = HalfOpen.INSTANCE;

        // then
        assertEquals(CircuitBreakerState.CLOSED, closed.kind());
        assertEquals(CircuitBreakerState.OPEN, open.kind());
        assertEquals(CircuitBreakerState.HALF_OPEN, halfOpen.kind());

        assertTrue(closed.isClosed());
        assertFalse(closed.isOpen());
        assertTrue(open.isOpen());
        assertFalse(open.isHalfOpen());
        assertTrue(halfOpen.isHalfOpen());
        assertFalse(halfOpen.isClosed());
    }

    @Test
    @DisplayName("Open은 openedAt이 null이면 생성할 수 없다")
    void open_null_거부() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Open(null)
        );
        assertEquals("openedAt cannot be null", exception.getMessage());
    }

    @Test
    @DisplayName("retryTimeout이 정확히 지난 시점부터 retryDue")
    void open_retryDue_경계() {
        // given
        Open open = new Open(OPENED_AT);
        Duration timeout = Duration.ofMillis(200);

        // then
        assertFalse(open.retryDue(OPENED_AT.plusMillis(199), timeout));
        assertTrue(open.retryDue(OPENED_AT.plusMillis(200), timeout));
        assertTrue(open.retryDue(OPENED_AT, Duration.ZERO));
    }

    @Test
    @DisplayName("남은 시간은 음수가 되지 않는다")
    void open_remaining() {
        // given
        Open open = new Open(OPENED_AT);
        Duration timeout = Duration.ofSeconds(60);

        // then
        assertEquals(Duration.ofSeconds(45), open.remaining(OPENED_AT.plusSeconds(15), timeout));
        assertEquals(Duration.ZERO, open.remaining(OPENED_AT.plusSeconds(90), timeout));
    }

    @Test
    @DisplayName("아주 긴 retryTimeout에도 오버플로 없이 계속 OPEN을 유지한다")
    void open_최대_retryTimeout_오버플로_없음() {
        // given
        Open open = new Open(OPENED_AT);
        Duration timeout = Duration.ofSeconds(Long.MAX_VALUE);
        Instant now = OPENED_AT.plusSeconds(2);

        // then
        assertFalse(assertDoesNotThrow(() -> open.retryDue(now, timeout)));
        assertEquals(timeout.minusSeconds(2), assertDoesNotThrow(() -> open.remaining(now, timeout)));
    }

    @Test
    @DisplayName("openedAt 이전 시각이면 남은 시간은 retryTimeout 전체")
    void open_remaining_openedAt_이전() {
        // given
        Open open = new Open(OPENED_AT);
        Duration timeout = Duration.ofSeconds(Long.MAX_VALUE);

        // then
        assertFalse(open.retryDue(OPENED_AT.minusSeconds(5), timeout));
        assertEquals(timeout, open.remaining(OPENED_AT.minusSeconds(5), timeout));
    }

    @Test
    @DisplayName("같은 시각에 열린 Open은 동등하다")
    void open_동등성() {
        assertEquals(new Open(OPENED_AT), new Open(OPENED_AT));
        assertNotEquals(new Open(OPENED_AT), new Open(OPENED_AT.plusMillis(1)));
        assertEquals(Closed.INSTANCE, new Closed());
    }
}
