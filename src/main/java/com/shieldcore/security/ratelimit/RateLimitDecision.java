package com.shieldcore.security.ratelimit;

import java.time.Duration;
import java.time.Instant;

public record RateLimitDecision(
        boolean allowed,
        long retryAfterSeconds,
        Instant blockedUntil,
        RateWindow trippedWindow,
        long remainingMinute,
        long remainingHour,
        long remainingDay,
        int violationCount,
        Duration blockDuration,
        boolean newViolation,
        boolean atCeiling
) {

    public static RateLimitDecision allow(long remainingMinute, long remainingHour, long remainingDay) {
        return new RateLimitDecision(true, 0, null, null, remainingMinute, remainingHour, remainingDay,
                0, Duration.ZERO, false, false);
    }

    /**
     * Decision used when rate limiting is switched off.
     */
    public static RateLimitDecision unlimited() {
        return allow(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);
    }

    public static RateLimitDecision stillBlocked(Instant blockedUntil, long retryAfterSeconds, int violationCount) {
        return new RateLimitDecision(false, Math.max(0, retryAfterSeconds), blockedUntil, null, 0, 0, 0,
                violationCount, Duration.ZERO, false, false);
    }

    public static RateLimitDecision violation(
            RateWindow window,
            Instant blockedUntil,
            Duration blockDuration,
            int violationCount,
            boolean atCeiling
    ) {
        return new RateLimitDecision(false, blockDuration.toSeconds(), blockedUntil, window, 0, 0, 0,
                violationCount, blockDuration, true, atCeiling);
    }

    public boolean blocked() {
        return !allowed;
    }
}
