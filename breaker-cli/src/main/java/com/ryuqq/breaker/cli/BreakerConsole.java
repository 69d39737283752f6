package com.ryuqq.breaker.cli;

import com.ryuqq.breaker.core.protection.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Circuit Breaker 대화형 콘솔 (REPL).
 *
 * <p>사용자가 입력한 명령으로 결과를 보고하고, 매번 프레임을 다시 그립니다.</p>
 *
 * <p><strong>명령:</strong></p>
 * <ul>
 *   <li>{@code s}, {@code success}: 성공 보고</li>
 *   <li>{@code f}, {@code failure}: 실패 보고</li>
 *   <li>빈 줄: 다시 그리기</li>
 *   <li>{@code q}, {@code quit}, {@code exit}: 종료</li>
 * </ul>
 *
 * <p><strong>자동 재생:</strong></p>
 * <p>활성화하면 단일 스레드 스케줄러가 {@link #AUTOPLAY_INTERVAL}마다 프레임을 다시 그려
 * 시간 경과에 따른 전이(버킷 이동, OPEN → HALF_OPEN)를 보여줍니다.
 * Breaker는 스레드 안전하지 않으므로 모든 Breaker 접근과 출력은 하나의 lock으로 직렬화합니다.
 * 스케줄러는 루프가 끝나면 종료됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class BreakerConsole {

    private static final Logger log = LoggerFactory.getLogger(BreakerConsole.class);

    /**
     * 자동 재생 간격.
     */
    static final Duration AUTOPLAY_INTERVAL = Duration.ofSeconds(1);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final CircuitBreaker breaker;
    private final BreakerRenderer renderer;
    private final BufferedReader in;
    private final PrintWriter out;
    private final Supplier<ScheduledExecutorService> schedulerFactory;
    private final Object lock = new Object();

    /**
     * 생성자.
     *
     * @param breaker 조작할 Breaker
     * @param renderer 프레임 렌더러
     * @param in 명령 입력
     * @param out 프레임 출력
     */
    public BreakerConsole(CircuitBreaker breaker, BreakerRenderer renderer, Reader in, PrintWriter out) {
        this(breaker, renderer, in, out, BreakerConsole::newAutoplayScheduler);
    }

    BreakerConsole(
        CircuitBreaker breaker,
        BreakerRenderer renderer,
        Reader in,
        PrintWriter out,
        Supplier<ScheduledExecutorService> schedulerFactory
    ) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        if (in == null || out == null) {
            throw new IllegalArgumentException("in and out cannot be null");
        }
        this.breaker = breaker;
        this.renderer = renderer;
        this.in = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        this.out = out;
        this.schedulerFactory = schedulerFactory;
    }

    /**
     * 입력이 끝나거나 종료 명령이 올 때까지 루프 실행.
     *
     * @param autoplay 자동 재생 여부
     * @return 정상 종료면 true, 입력 읽기에 실패하면 false
     */
    public boolean run(boolean autoplay) {
        log.info("Console started: config={}, autoplay={}", breaker.configuration(), autoplay);

        redraw();
        ScheduledExecutorService scheduler = autoplay ? startAutoplay() : null;

        try {
            String line;
            while ((line = in.readLine()) != null) {
                Command command = Command.parse(line);
                if (command == Command.QUIT) {
                    break;
                }
                handle(command, line);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to read console input", e);
            return false;
        } finally {
            if (scheduler != null) {
                stopAutoplay(scheduler);
            }
            log.info("Console stopped");
        }
    }

    private void handle(Command command, String line) {
        switch (command) {
            case SUCCESS -> report(true);
            case FAILURE -> report(false);
            case REDRAW -> redraw();
            case UNKNOWN -> {
                log.warn("Unknown console command: {}", line.trim());
                synchronized (lock) {
                    out.println("Unknown command '" + line.trim() + "'. Use s (success), f (failure), Enter (redraw) or q (quit).");
                    out.flush();
                }
            }
            case QUIT -> throw new IllegalStateException("QUIT is handled by the loop");
        }
    }

    private void report(boolean success) {
        synchronized (lock) {
            boolean allowed = breaker.tryAcquire();
            breaker.reportOutcome(success);
            draw();
            String outcome = success ? "Success" : "Failure";
            out.println(allowed ? "> " + outcome : "> " + outcome + " (breaker is Open, outcome ignored)");
            out.flush();
        }
    }

    private void redraw() {
        synchronized (lock) {
            draw();
            out.flush();
        }
    }

    // lock을 잡은 상태에서만 호출
    private void draw() {
        out.print(renderer.clearScreen());
        out.println(renderer.render(breaker));
        out.println();
        out.println("s = success, f = failure, Enter = redraw, q = quit");
    }

    private ScheduledExecutorService startAutoplay() {
        ScheduledExecutorService scheduler = schedulerFactory.get();
        long intervalMs = AUTOPLAY_INTERVAL.toMillis();
        scheduler.scheduleAtFixedRate(this::autoplayTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("Autoplay started (interval: {}ms)", intervalMs);
        return scheduler;
    }

    /**
     * 자동 재생 한 주기.
     *
     * <p>실패는 로깅만 하며 스케줄러로 전파하지 않습니다. 다음 주기는 예정대로 실행됩니다.</p>
     */
    private void autoplayTick() {
        try {
            redraw();
        } catch (Exception e) {
            log.error("Autoplay redraw failed", e);
        }
    }

    private void stopAutoplay(ScheduledExecutorService scheduler) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ScheduledExecutorService newAutoplayScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "breaker-autoplay");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 콘솔 명령.
     */
    enum Command {
        SUCCESS, FAILURE, REDRAW, QUIT, UNKNOWN;

        static Command parse(String line) {
            String normalized = line.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "s", "success" -> SUCCESS;
                case "f", "failure" -> FAILURE;
                case "" -> REDRAW;
                case "q", "quit", "exit" -> QUIT;
                default -> UNKNOWN;
            };
        }
    }
}
