package com.ryuqq.breaker.cli;

import com.ryuqq.breaker.core.protection.BreakerConfig;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.WindowedCircuitBreaker;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Circuit Breaker 시각화 CLI.
 *
 * <p>플래그로 {@link BreakerConfig}를 만들고, {@link WindowedCircuitBreaker}를 생성한 뒤
 * {@link BreakerConsole}에서 대화형으로 결과를 보고합니다.</p>
 *
 * <p>사용 예시:
 * <pre>
 * breaker -b 5 -s 1 -m 4 -e 39.99 -r 1 -t 3
 * &gt; s
 * &gt; f
 * &gt; q
 * </pre>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 정상 종료, --help, --version</li>
 *   <li>1: 구조적으로 잘못된 설정 (예: --buffer_size 0) 또는 입력 읽기 실패</li>
 *   <li>2: 플래그 파싱 실패 (숫자가 아닌 값 등)</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@Command(name = "breaker",
         mixinStandardHelpOptions = true,
         version = "Breaker 1.0.0",
         description = "Interactive visualiser for a windowed circuit breaker",
         sortOptions = false)
public class BreakerCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-b", "--buffer_size"},
            description = "Number of buckets in the window (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int bufferSize;

    @Option(names = {"-m", "--min_eval_size"},
            description = "Minimum completed observations before the error rate counts (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
    private int minEvalSize;

    @Option(names = {"-e", "--error_threshold"},
            description = "Error rate in percent above which the breaker opens (default: ${DEFAULT-VALUE})",
            defaultValue = "10.0")
    private double errorThreshold;

    @Option(names = {"-r", "--retry_timeout"},
            description = "Seconds an open breaker waits before probing (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private long retryTimeoutSeconds;

    @Option(names = {"-s", "--buffer_span_duration"},
            description = "Seconds each bucket covers (default: ${DEFAULT-VALUE})",
            defaultValue = "200")
    private long spanSeconds;

    @Option(names = {"-t", "--trial_success_required"},
            description = "Consecutive half-open successes needed to close (default: ${DEFAULT-VALUE})",
            defaultValue = "20")
    private int trialSuccessRequired;

    @Option(names = {"-a", "--noautoplay"},
            description = "Disable the once-per-second automatic redraw")
    private boolean noAutoplay;

    @Option(names = "--no-color",
            description = "Render without ANSI colours")
    private boolean noColor;

    private final Reader input;
    private final Clock clock;

    /**
     * 표준 입력과 시스템 UTC 시계를 사용하는 생성자.
     */
    public BreakerCli() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8), Clock.systemUTC());
    }

    BreakerCli(Reader input, Clock clock) {
        this.input = input;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BreakerCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        BreakerConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        CircuitBreaker breaker = new WindowedCircuitBreaker(config, clock);
        BreakerRenderer renderer = new BreakerRenderer(!noColor, clock);
        BreakerConsole console = new BreakerConsole(breaker, renderer, input, out);

        return console.run(!noAutoplay) ? 0 : 1;
    }

    /**
     * 파싱된 플래그로 설정 생성.
     *
     * @return 설정
     * @throws IllegalArgumentException 구조적으로 잘못된 값인 경우
     */
    BreakerConfig toConfig() {
        return new BreakerConfig(
            bufferSize,
            Duration.ofSeconds(spanSeconds),
            minEvalSize,
            errorThreshold,
            Duration.ofSeconds(retryTimeoutSeconds),
            trialSuccessRequired
        );
    }

    boolean autoplay() {
        return !noAutoplay;
    }

    boolean color() {
        return !noColor;
    }
}
