package com.shieldcore.security;

import com.shieldcore.security.ratelimit.RateLimitDecision;

import java.time.Instant;

public record RateLimitCheck(
        Status status,
        long retryAfterSeconds,
        Instant blockedUntil,
        String reason,
        RateLimitDecision decision
) {

    public enum Status {
        ALLOWED,
        RATE_LIMITED,
        ACCESS_DENIED
    }

    public static RateLimitCheck allowed(RateLimitDecision decision) {
        return new RateLimitCheck(Status.ALLOWED, 0, null, null, decision);
    }

    public static RateLimitCheck rateLimited(RateLimitDecision decision) {
        String reason = decision.newViolation()
                ? "Rate limit exceeded"
                : "Temporarily blocked after exceeding the rate limit";
        return new RateLimitCheck(Status.RATE_LIMITED, decision.retryAfterSeconds(), decision.blockedUntil(),
                reason, decision);
    }

    public static RateLimitCheck accessDenied(Instant blockedUntil, long retryAfterSeconds) {
        return new RateLimitCheck(Status.ACCESS_DENIED, retryAfterSeconds, blockedUntil, "Access denied", null);
    }

    public boolean allowed() {
        return status == Status.ALLOWED;
    }
}
