package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.statemachine.BreakerState;
import com.ryuqq.breaker.core.statemachine.Closed;
import com.ryuqq.breaker.core.statemachine.HalfOpen;
import com.ryuqq.breaker.core.statemachine.Open;
import com.ryuqq.breaker.core.statemachine.StateTransition;
import com.ryuqq.breaker.core.window.BucketSnapshot;
import com.ryuqq.breaker.core.window.WindowedCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 시간 분할 윈도우 기반 Circuit Breaker 구현.
 *
 * <p>{@link WindowedCounter}를 근거로 에러율을 계산하고, 세 가지 상태를 오가며
 * 호출 허용 여부를 판단합니다.</p>
 *
 * <p><strong>상태 머신:</strong></p>
 * <pre>
 * | 상태       | 평가 (시간 기반)                         | 성공 보고                  | 실패 보고                    |
 * |------------|------------------------------------------|----------------------------|------------------------------|
 * | Closed     | advance 후 errorRate &gt; threshold → Open | 윈도우에 기록              | 윈도우에 기록 후 재평가      |
 * | Open       | now - openedAt &gt;= retryTimeout → HalfOpen | 무시                       | 무시                         |
 * | HalfOpen   | trial &gt;= required → 윈도우 리셋, Closed  | trial 증가 후 재평가       | 즉시 Open(now), trial = 0    |
 * </pre>
 *
 * <p><strong>지연 평가:</strong></p>
 * <p>스케줄러나 백그라운드 스레드를 쓰지 않습니다. 결과 보고와 상태 조회가 항상 먼저
 * 시간 기반 평가를 수행하므로, 아무도 조회하지 않은 동안 놓친 전이도 다음 호출에서 반영됩니다.
 * 평가 한 번에 전이는 최대 한 단계입니다.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <p>스레드 안전하지 않습니다. 공유 시 호출자가 접근을 직렬화해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class WindowedCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(WindowedCircuitBreaker.class);

    private final BreakerConfig config;
    private final Clock clock;
    private final WindowedCounter counter;
    private BreakerState state;
    private int trialSuccess;

    /**
     * 시스템 UTC 시계를 사용하는 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WindowedCircuitBreaker(BreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * <p>생성 시각이 윈도우의 기준 시각(origin)이 됩니다.</p>
     *
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public WindowedCircuitBreaker(BreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.counter = new WindowedCounter(config.capacity(), config.span(), clock.instant());
        this.state = Closed.INSTANCE;
        this.trialSuccess = 0;
    }

    @Override
    public void reportOutcome(boolean success) {
        reportOutcome(success, clock.instant());
    }

    @Override
    public void reportOutcome(boolean success, Instant now) {
        requireNow(now);
        evaluate(now);

        switch (state.kind()) {
            case OPEN -> log.debug("Outcome ignored while breaker is OPEN (success: {})", success);
            case HALF_OPEN -> {
                if (success) {
                    trialSuccess++;
                    evaluate(now);
                } else {
                    transitionTo(new Open(now));
                }
            }
            case CLOSED -> {
                if (success) {
                    counter.recordSuccess(now);
                } else {
                    counter.recordFailure(now);
                    evaluate(now);
                }
            }
        }
    }

    @Override
    public BreakerState currentState() {
        return currentState(clock.instant());
    }

    @Override
    public BreakerState currentState(Instant now) {
        requireNow(now);
        evaluate(now);
        return state;
    }

    @Override
    public double errorRate() {
        return counter.errorRate(config.minEvalSize());
    }

    @Override
    public BucketSnapshot inspectBucket(int index) {
        return counter.inspect(index);
    }

    @Override
    public int cursor() {
        return counter.cursor();
    }

    @Override
    public int trialSuccess() {
        return trialSuccess;
    }

    @Override
    public BreakerConfig configuration() {
        return config;
    }

    @Override
    public void reset() {
        BreakerState previous = state;
        counter.reset(clock.instant());
        trialSuccess = 0;
        state = Closed.INSTANCE;
        log.info("Circuit breaker manually reset: {} → {}", previous, state);
    }

    /**
     * 시간 기반 전이 평가 (최대 한 단계).
     */
    private void evaluate(Instant now) {
        switch (state.kind()) {
            case CLOSED -> {
                counter.advance(now);
                if (errorRate() > config.errorThreshold()) {
                    transitionTo(new Open(now));
                }
            }
            case OPEN -> {
                Open open = (Open) state;
                if (open.retryDue(now, config.retryTimeout())) {
                    transitionTo(HalfOpen.INSTANCE);
                }
            }
            case HALF_OPEN -> {
                if (trialSuccess >= config.trialSuccessRequired()) {
                    counter.reset(now);
                    transitionTo(Closed.INSTANCE);
                }
            }
        }
    }

    private void transitionTo(BreakerState next) {
        BreakerState previous = state;
        state = StateTransition.transition(previous, next);
        // HALF_OPEN 밖으로 나가거나 OPEN으로 들어갈 때 시험 성공 수는 항상 0
        trialSuccess = 0;
        log.info("Circuit breaker state transition: {} → {} (errorRate: {}%, threshold: {}%)",
            previous.kind(), next.kind(), errorRate(), config.errorThreshold());
    }

    private static void requireNow(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
    }
}
