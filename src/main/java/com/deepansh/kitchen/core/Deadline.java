package com.deepansh.kitchen.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time after which no new agent is dispatched.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /** Time left, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
