package com.ryuqq.breaker.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose current instant is moved explicitly by the test.
 *
 * <p>Lets cooldowns and recent-failure windows be exercised without sleeping.
 * Reads and writes are volatile, so a background health-check thread sees the
 * time the test thread has set.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    /**
     * Creates a clock frozen at the given instant.
     *
     * @param start the initial instant
     */
    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration how far to move (must not be negative)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative (current: " + duration + ")");
        }
        now = now.plus(duration);
    }

    /**
     * Moves the clock forward by the given number of milliseconds.
     *
     * @param millis milliseconds to move
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Sets the clock to an arbitrary instant.
     *
     * @param instant the new instant
     */
    public void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
