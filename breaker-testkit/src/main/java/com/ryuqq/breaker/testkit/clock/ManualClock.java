package com.ryuqq.breaker.testkit.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Clock} that only moves when told to.
 *
 * <p>Lets tests drive the lazy, time-based transitions of a breaker without sleeping.</p>
 *
 * <pre>
 * ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
 * CircuitBreaker breaker = new WindowedCircuitBreaker(config, clock);
 * clock.advance(Duration.ofSeconds(1));
 * </pre>
 *
 * <p>{@link #withZone(ZoneId)} returns a view in another zone that shares this clock's
 * instant, so advancing either one moves both.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class ManualClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    /**
     * Creates a UTC clock frozen at {@code start}.
     *
     * @param start the initial instant
     * @throws IllegalArgumentException if start is null
     */
    public ManualClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
        this.zone = ZoneOffset.UTC;
    }

    private ManualClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration how far to move, must not be negative
     * @return the new current instant
     * @throws IllegalArgumentException if duration is null or negative
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative (current: " + duration + ")");
        }
        return now.updateAndGet(current -> current.plus(duration));
    }

    /**
     * Moves the clock forward by the given number of milliseconds.
     *
     * @param millis milliseconds to move
     * @return the new current instant
     */
    public Instant advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }

    /**
     * Jumps to an arbitrary instant, backwards included.
     *
     * @param instant the new current instant
     * @throws IllegalArgumentException if instant is null
     */
    public void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a clock in the given zone that shares this clock's instant.
     *
     * @param zone the zone of the returned clock
     * @return this clock if the zone is unchanged, otherwise a linked copy
     * @throws IllegalArgumentException if zone is null
     */
    @Override
    public ManualClock withZone(ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        return zone.equals(this.zone) ? this : new ManualClock(now, zone);
    }
}
