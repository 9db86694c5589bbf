package com.shieldcore.security.ratelimit;

final class RateLimitState {

    private static final RateWindow[] WINDOWS = RateWindow.values();

    private final long[] counts = new long[WINDOWS.length];
    private final long[] windowStarts = new long[WINDOWS.length];
    // read by the cache expiry without holding the monitor
    private volatile long blockedUntil;
    private int violationCount;
    private long lastBlockEndedAt;

    RateLimitState(long now) {
        for (int i = 0; i < WINDOWS.length; i++) {
            windowStarts[i] = now;
        }
    }

    void roll(long now) {
        for (int i = 0; i < WINDOWS.length; i++) {
            if (now - windowStarts[i] >= WINDOWS[i].length().toMillis()) {
                counts[i] = 0;
                windowStarts[i] = now;
            }
        }
    }

    RateWindow firstExceeded(RateLimitPolicy policy) {
        for (int i = 0; i < WINDOWS.length; i++) {
            if (counts[i] + 1 > policy.limit(WINDOWS[i])) {
                return WINDOWS[i];
            }
        }
        return null;
    }

    void increment() {
        for (int i = 0; i < WINDOWS.length; i++) {
            counts[i]++;
        }
    }

    long count(RateWindow window) {
        return counts[window.ordinal()];
    }

    long remaining(RateWindow window, RateLimitPolicy policy) {
        return Math.max(0, policy.limit(window) - counts[window.ordinal()]);
    }

    long blockedUntil() {
        return blockedUntil;
    }

    boolean isBlocked(long now) {
        return blockedUntil > 0 && now < blockedUntil;
    }

    /**
     * Lifts an elapsed block, remembering when it ended for escalation.
     */
    void clearElapsedBlock(long now) {
        if (blockedUntil > 0 && now >= blockedUntil) {
            lastBlockEndedAt = blockedUntil;
            blockedUntil = 0;
        }
    }

    void release(long now) {
        if (blockedUntil > 0) {
            lastBlockEndedAt = Math.min(now, blockedUntil);
            blockedUntil = 0;
        }
    }

    int registerViolation(long now, long cooldownMillis) {
        boolean escalate = violationCount > 0
                && (blockedUntil > now || (lastBlockEndedAt > 0 && now - lastBlockEndedAt < cooldownMillis));
        violationCount = escalate ? violationCount + 1 : 1;
        return violationCount;
    }

    void blockUntil(long until) {
        blockedUntil = until;
    }

    int violationCount() {
        return violationCount;
    }
}
