package com.example.CostNavigator.util;

import java.time.Clock;
import java.time.Duration;

/**
 * Wall-clock deadline for one request. External calls size their own timeouts
 * from what is left so a slow collaborator cannot outlive the request.
 */
public final class RequestBudget {

    private final Clock clock;
    private final long deadlineMs;

    private RequestBudget(Clock clock, long deadlineMs) {
        this.clock = clock;
        this.deadlineMs = deadlineMs;
    }

    public static RequestBudget start(Duration total) {
        return start(total, Clock.systemUTC());
    }

    public static RequestBudget start(Duration total, Clock clock) {
        return new RequestBudget(clock, clock.millis() + total.toMillis());
    }

    public Duration remaining() {
        return Duration.ofMillis(Math.max(0, deadlineMs - clock.millis()));
    }

    public boolean exhausted() {
        return remaining().isZero();
    }

    /** The smaller of {@code cap} and what is left of the budget. */
    public Duration cap(Duration cap) {
        Duration left = remaining();
        return left.compareTo(cap) < 0 ? left : cap;
    }

    /** Remaining budget in whole seconds, rounded up and never below one. */
    public int remainingSecondsCeil() {
        long ms = remaining().toMillis();
        return (int) Math.max(1L, (ms + 999L) / 1000L);
    }
}
