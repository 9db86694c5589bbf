package com.shieldcore.security.ratelimit;

import java.time.Duration;

public record RateLimitPolicy(
        int requestsPerMinute,
        int requestsPerHour,
        int requestsPerDay,
        Duration baseBlock,
        Duration maxBlock,
        Duration escalationCooldown,
        Duration inactivityTtl
) {

    public static final int DEFAULT_PER_MINUTE = 60;
    public static final int DEFAULT_PER_HOUR = 1000;
    public static final int DEFAULT_PER_DAY = 10000;
    public static final Duration DEFAULT_BASE_BLOCK = Duration.ofMinutes(5);
    public static final Duration DEFAULT_MAX_BLOCK = Duration.ofHours(1);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(15);
    public static final Duration DEFAULT_INACTIVITY_TTL = Duration.ofHours(24);

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(
                DEFAULT_PER_MINUTE,
                DEFAULT_PER_HOUR,
                DEFAULT_PER_DAY,
                DEFAULT_BASE_BLOCK,
                DEFAULT_MAX_BLOCK,
                DEFAULT_COOLDOWN,
                DEFAULT_INACTIVITY_TTL
        );
    }

    public int limit(RateWindow window) {
        return switch (window) {
            case MINUTE -> requestsPerMinute;
            case HOUR -> requestsPerHour;
            case DAY -> requestsPerDay;
        };
    }

    /**
     * Block length for the n-th consecutive violation: the base doubled n-1 times, capped at the
     * maximum.
     */
    public Duration blockDuration(int violation) {
        Duration duration = baseBlock;
        for (int i = 1; i < violation && duration.compareTo(maxBlock) < 0; i++) {
            duration = duration.multipliedBy(2);
        }
        return duration.compareTo(maxBlock) > 0 ? maxBlock : duration;
    }
}
