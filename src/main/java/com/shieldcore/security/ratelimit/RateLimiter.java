package com.shieldcore.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.shieldcore.security.access.AccessController;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Slf4j
public class RateLimiter {

    private final RateLimitPolicy policy;
    private final AccessController accessController;
    private final Clock clock;
    private final Cache<String, RateLimitState> states;

    public RateLimiter(RateLimitPolicy policy, AccessController accessController, Clock clock) {
        this.policy = policy;
        this.accessController = accessController;
        this.clock = clock;
        this.states = Caffeine.newBuilder()
                .expireAfter(new StateExpiry())
                .build();
    }

    public RateLimitDecision check(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier is required");
        }
        long now = clock.millis();
        RateLimitState state = states.get(identifier, key -> new RateLimitState(now));
        synchronized (state) {
            if (state.isBlocked(now)) {
                long retryAfter = TimeUnit.MILLISECONDS.toSeconds(state.blockedUntil() - now + 999);
                return RateLimitDecision.stillBlocked(Instant.ofEpochMilli(state.blockedUntil()), retryAfter,
                        state.violationCount());
            }
            state.clearElapsedBlock(now);
            state.roll(now);

            RateWindow exceeded = state.firstExceeded(policy);
            if (exceeded == null) {
                state.increment();
                return RateLimitDecision.allow(
                        state.remaining(RateWindow.MINUTE, policy),
                        state.remaining(RateWindow.HOUR, policy),
                        state.remaining(RateWindow.DAY, policy)
                );
            }

            int violation = state.registerViolation(now, policy.escalationCooldown().toMillis());
            Duration blockDuration = policy.blockDuration(violation);
            long until = now + blockDuration.toMillis();
            state.blockUntil(until);
            boolean atCeiling = blockDuration.compareTo(policy.maxBlock()) >= 0;
            accessController.blockAutomatically(identifier,
                    "rate limit exceeded (" + exceeded.name().toLowerCase(Locale.ROOT) + ")", blockDuration);
            log.info("rate limit exceeded: window={}, violation={}, blockSeconds={}",
                    exceeded, violation, blockDuration.toSeconds());
            return RateLimitDecision.violation(exceeded, Instant.ofEpochMilli(until), blockDuration, violation,
                    atCeiling);
        }
    }

    /**
     * Lifts an automatic block early. Counters are left as they are.
     */
    public void release(String identifier) {
        if (identifier == null) {
            return;
        }
        RateLimitState state = states.getIfPresent(identifier);
        if (state != null) {
            synchronized (state) {
                state.release(clock.millis());
            }
        }
        accessController.releaseAutomatic(identifier);
    }

    public boolean isBlocked(String identifier) {
        RateLimitState state = identifier == null ? null : states.getIfPresent(identifier);
        return state != null && state.isBlocked(clock.millis());
    }

    public long usage(String identifier, RateWindow window) {
        RateLimitState state = identifier == null ? null : states.getIfPresent(identifier);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.count(window);
        }
    }

    public long activeIdentifiers() {
        states.cleanUp();
        return states.estimatedSize();
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    private class StateExpiry implements Expiry<String, RateLimitState> {
        @Override
        public long expireAfterCreate(String key, RateLimitState value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, RateLimitState value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, RateLimitState value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        private long remainingNanos(RateLimitState value) {
            long ttlMillis = policy.inactivityTtl().toMillis();
            long blockMillis = value.blockedUntil() - clock.millis();
            return TimeUnit.MILLISECONDS.toNanos(Math.max(ttlMillis, blockMillis));
        }
    }
}
