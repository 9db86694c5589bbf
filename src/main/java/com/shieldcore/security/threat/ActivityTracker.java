package com.shieldcore.security.threat;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

class ActivityTracker {

    private final Cache<String, AtomicLong> counts;

    ActivityTracker(Duration inactivityTtl) {
        this.counts = Caffeine.newBuilder()
                .expireAfterAccess(inactivityTtl)
                .build();
    }

    long increment(String activityType, String identifier) {
        return counts.get(activityType + ":" + identifier, key -> new AtomicLong()).incrementAndGet();
    }

    long count(String activityType, String identifier) {
        AtomicLong count = counts.getIfPresent(activityType + ":" + identifier);
        return count == null ? 0 : count.get();
    }
}
