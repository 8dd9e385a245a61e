package com.ryuqq.bay.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock whose current instant is moved explicitly by the test.
 *
 * <p>TTL and idle deadlines are evaluated against this clock, so contract tests can
 * cross expiry boundaries without sleeping. Readiness and lock budgets are measured
 * with {@link System#nanoTime()} and are not affected.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * Moves the clock forward.
     *
     * @param amount the amount to advance (non-negative)
     */
    public void advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount cannot be null or negative");
        }
        now = now.plus(amount);
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
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
