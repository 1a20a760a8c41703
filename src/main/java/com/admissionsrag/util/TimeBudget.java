package com.admissionsrag.util;

/**
 * Wall-clock deadline for one request.
 */
public class TimeBudget {

    private final long deadlineMs;

    public TimeBudget(long totalMs) {
        this.deadlineMs = System.currentTimeMillis() + totalMs;
    }

    public static TimeBudget ofSeconds(long seconds) {
        return new TimeBudget(seconds * 1000L);
    }

    public long remainingMs() {
        return Math.max(0, deadlineMs - System.currentTimeMillis());
    }

    public boolean exhausted() {
        return remainingMs() <= 0;
    }
}
