package com.ryuqq.breaker.cli;

import com.ryuqq.breaker.core.protection.BreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.statemachine.BreakerState;
import com.ryuqq.breaker.core.statemachine.Open;
import com.ryuqq.breaker.core.window.BucketSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Circuit Breaker 터미널 렌더러.
 *
 * <p>Breaker의 읽기 전용 접근자만 사용하여 한 프레임을 문자열로 그립니다.
 * 판단 로직은 없습니다.</p>
 *
 * <p><strong>프레임 구성:</strong></p>
 * <pre>
 * Status: Closed
 * Error Rate: 20.00% (threshold: 39.99%)
 * Current Bucket: B1
 * ┌─────────────────┐  ┏━━━━━━━━━━━━━━━━━┓  ┌─────────────────┐
 * │ B0   004   001  │─▶┃ B1   000   005  ┃─▶│ B2   000   000  │
 * └─────────────────┘  ┗━━━━━━━━━━━━━━━━━┛  └─────────────────┘
 * </pre>
 *
 * <ul>
 *   <li>상태 배지: Closed는 그대로, Open은 빨간 배경, Half Open은 노란 배경</li>
 *   <li>상태별 보조 줄: Closed는 현재 버킷, Open은 HALF_OPEN까지 남은 시간, Half Open은 시험 성공 진행도</li>
 *   <li>버킷 상자는 한 줄에 {@value #BOXES_PER_ROW}개, 현재 버킷은 굵은 테두리</li>
 *   <li>{@value #MAX_SHOWN_COUNT}를 넘는 개수는 {@code 999+}로 표시해 상자 폭을 유지</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class BreakerRenderer {

    static final int BOXES_PER_ROW = 3;

    static final int MAX_SHOWN_COUNT = 999;

    private static final String RESET = "\u001b[0m";
    private static final String RED_BACKGROUND = "\u001b[41m";
    private static final String GREEN_BACKGROUND = "\u001b[42m";
    private static final String YELLOW_BACKGROUND = "\u001b[43m";
    private static final String CLEAR_SCREEN = "\u001b[H\u001b[2J";

    private static final String LIGHT_TOP = "┌─────────────────┐";
    private static final String LIGHT_BOTTOM = "└─────────────────┘";
    private static final String HEAVY_TOP = "┏━━━━━━━━━━━━━━━━━┓";
    private static final String HEAVY_BOTTOM = "┗━━━━━━━━━━━━━━━━━┛";

    private final boolean ansi;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param ansi ANSI 색상 및 화면 지우기 사용 여부
     * @param clock 상태 조회와 남은 시간 계산에 쓰는 시간 소스
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public BreakerRenderer(boolean ansi, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.ansi = ansi;
        this.clock = clock;
    }

    /**
     * 한 프레임 렌더링.
     *
     * <p>상태 조회가 지연 전이를 일으킬 수 있으므로 호출자는 Breaker 접근을 직렬화해야 합니다.</p>
     *
     * @param breaker 그릴 Breaker
     * @return 여러 줄 문자열 (마지막 줄바꿈 없음)
     */
    public String render(CircuitBreaker breaker) {
        Instant now = clock.instant();
        BreakerState state = breaker.currentState(now);
        BreakerConfig config = breaker.configuration();

        StringBuilder frame = new StringBuilder();
        frame.append("Status: ").append(badge(state)).append('\n');
        frame.append(format("Error Rate: %.2f%% (threshold: %.2f%%)",
            breaker.errorRate(), config.errorThreshold())).append('\n');
        frame.append(indicator(breaker, state, config, now)).append('\n');
        frame.append(buckets(breaker, config.capacity()));
        return frame.toString();
    }

    /**
     * 화면 지우기 시퀀스.
     *
     * @return ANSI 사용 시 커서 이동 및 화면 지우기, 아니면 빈 문자열
     */
    public String clearScreen() {
        return ansi ? CLEAR_SCREEN : "";
    }

    private String badge(BreakerState state) {
        return switch (state.kind()) {
            case CLOSED -> "Closed";
            case OPEN -> paint(RED_BACKGROUND, " Open ");
            case HALF_OPEN -> paint(YELLOW_BACKGROUND, " Half Open ");
        };
    }

    private String indicator(CircuitBreaker breaker, BreakerState state, BreakerConfig config, Instant now) {
        return switch (state.kind()) {
            case CLOSED -> format("Current Bucket: B%d", breaker.cursor());
            case OPEN -> format("Retry in: %.1fs", seconds(((Open) state).remaining(now, config.retryTimeout())));
            case HALF_OPEN -> format("Trial Success: %d/%d",
                breaker.trialSuccess(), config.trialSuccessRequired());
        };
    }

    private String buckets(CircuitBreaker breaker, int capacity) {
        int cursor = breaker.cursor();
        StringBuilder rows = new StringBuilder();

        for (int rowStart = 0; rowStart < capacity; rowStart += BOXES_PER_ROW) {
            StringBuilder top = new StringBuilder();
            StringBuilder middle = new StringBuilder();
            StringBuilder bottom = new StringBuilder();
            int rowEnd = Math.min(rowStart + BOXES_PER_ROW, capacity);

            for (int index = rowStart; index < rowEnd; index++) {
                if (index > rowStart) {
                    top.append("  ");
                    middle.append("─▶");
                    bottom.append("  ");
                }
                boolean current = index == cursor;
                top.append(current ? HEAVY_TOP : LIGHT_TOP);
                middle.append(box(index, breaker.inspectBucket(index), current));
                bottom.append(current ? HEAVY_BOTTOM : LIGHT_BOTTOM);
            }

            if (rowStart > 0) {
                rows.append('\n');
            }
            rows.append(top).append('\n').append(middle).append('\n').append(bottom);
        }
        return rows.toString();
    }

    private String box(int index, BucketSnapshot bucket, boolean current) {
        String side = current ? "┃" : "│";
        return side
            + format(" B%-2d ", index)
            + paint(GREEN_BACKGROUND, count(bucket.successCount()))
            + " "
            + paint(RED_BACKGROUND, count(bucket.failureCount()))
            + " "
            + side;
    }

    // 상자 폭은 고정이므로 세 자리를 넘는 값은 999+로 표시
    private static String count(long value) {
        return value > MAX_SHOWN_COUNT ? " " + MAX_SHOWN_COUNT + "+" : format(" %03d ", value);
    }

    // toMillis()는 아주 긴 Duration에서 오버플로하므로 초 단위로 변환
    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    private String paint(String colour, String text) {
        return ansi ? colour + text + RESET : text;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
