package com.shieldcore.security.ratelimit;

import com.shieldcore.security.MutableClock;
import com.shieldcore.security.access.AccessController;
import com.shieldcore.security.access.BlockEntry;
import com.shieldcore.security.access.BlockOrigin;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    private final AccessController accessController = new AccessController(clock, List.of());

    @Test
    void requestsWithinLimitAreAllowedAndCounted() {
        RateLimiter limiter = limiter(3, 1000);

        RateLimitDecision first = limiter.check("client");
        assertTrue(first.allowed());
        assertEquals(2, first.remainingMinute());
        assertEquals(999, first.remainingHour());
        limiter.check("client");
        RateLimitDecision third = limiter.check("client");
        assertTrue(third.allowed());
        assertEquals(0, third.remainingMinute());
        assertEquals(3, limiter.usage("client", RateWindow.MINUTE));
    }

    @Test
    void firstViolationBlocksForBaseDuration() {
        RateLimiter limiter = limiter(3, 1000);
        exhaust(limiter, "client", 3);

        RateLimitDecision violation = limiter.check("client");

        assertFalse(violation.allowed());
        assertTrue(violation.newViolation());
        assertEquals(RateWindow.MINUTE, violation.trippedWindow());
        assertEquals(1, violation.violationCount());
        assertEquals(Duration.ofMinutes(5), violation.blockDuration());
        assertEquals(300, violation.retryAfterSeconds());
        assertFalse(violation.atCeiling());
        assertEquals(3, limiter.usage("client", RateWindow.MINUTE));

        BlockEntry entry = accessController.activeEntry("client", BlockOrigin.AUTOMATIC);
        assertNotNull(entry);
        assertEquals(violation.blockedUntil(), entry.expiresAt());
    }

    @Test
    void checksWhileBlockedFailWithoutTouchingCounters() {
        RateLimiter limiter = limiter(3, 1000);
        exhaust(limiter, "client", 3);
        limiter.check("client");

        clock.advance(Duration.ofMinutes(2));
        RateLimitDecision blocked = limiter.check("client");

        assertFalse(blocked.allowed());
        assertFalse(blocked.newViolation());
        assertEquals(180, blocked.retryAfterSeconds());
        assertEquals(3, limiter.usage("client", RateWindow.MINUTE));
        assertTrue(limiter.isBlocked("client"));
    }

    @Test
    void blockLiftsExactlyWhenItExpires() {
        RateLimiter limiter = limiter(3, 1000);
        exhaust(limiter, "client", 3);
        limiter.check("client");

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertFalse(limiter.check("client").allowed());

        clock.advance(Duration.ofMillis(1));
        assertTrue(limiter.check("client").allowed());
        assertFalse(limiter.isBlocked("client"));
    }

    @Test
    void repeatedViolationsDoubleUpToTheCeiling() {
        RateLimiter limiter = limiter(3, 1000);

        assertEquals(Duration.ofMinutes(5), violate(limiter).blockDuration());
        clock.advance(Duration.ofMinutes(5));

        RateLimitDecision second = violate(limiter);
        assertEquals(2, second.violationCount());
        assertEquals(Duration.ofMinutes(10), second.blockDuration());
        clock.advance(Duration.ofMinutes(10));

        RateLimitDecision third = violate(limiter);
        assertEquals(Duration.ofMinutes(20), third.blockDuration());
        assertTrue(third.atCeiling());
        clock.advance(Duration.ofMinutes(20));

        RateLimitDecision fourth = violate(limiter);
        assertEquals(4, fourth.violationCount());
        assertEquals(Duration.ofMinutes(20), fourth.blockDuration());
        assertTrue(fourth.atCeiling());
    }

    @Test
    void violationAfterCooldownStartsOver() {
        RateLimiter limiter = limiter(3, 1000);
        violate(limiter);
        clock.advance(Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(16));

        RateLimitDecision again = violate(limiter);

        assertEquals(1, again.violationCount());
        assertEquals(Duration.ofMinutes(5), again.blockDuration());
    }

    @Test
    void hourWindowTripsIndependently() {
        RateLimiter limiter = limiter(100, 5);
        exhaust(limiter, "client", 5);

        RateLimitDecision violation = limiter.check("client");

        assertEquals(RateWindow.HOUR, violation.trippedWindow());
        assertEquals(5, limiter.usage("client", RateWindow.DAY));
    }

    @Test
    void minuteWindowResetsAfterItElapses() {
        RateLimiter limiter = limiter(3, 1000);
        exhaust(limiter, "client", 3);

        clock.advance(Duration.ofMinutes(1));

        RateLimitDecision next = limiter.check("client");
        assertTrue(next.allowed());
        assertEquals(1, limiter.usage("client", RateWindow.MINUTE));
        assertEquals(4, limiter.usage("client", RateWindow.HOUR));
    }

    @Test
    void identifiersAreIndependent() {
        RateLimiter limiter = limiter(1, 1000);
        limiter.check("a");
        assertFalse(limiter.check("a").allowed());
        assertTrue(limiter.check("b").allowed());
        assertEquals(2, limiter.activeIdentifiers());
    }

    @Test
    void releaseLiftsAutomaticBlockOnly() {
        RateLimiter limiter = limiter(1, 1000);
        accessController.block("client", "manual", Duration.ofHours(1));
        violate(limiter, 1);

        limiter.release("client");

        assertFalse(limiter.isBlocked("client"));
        assertNull(accessController.activeEntry("client", BlockOrigin.AUTOMATIC));
        assertNotNull(accessController.activeEntry("client", BlockOrigin.MANUAL));
    }

    @Test
    void nullIdentifierIsRejected() {
        RateLimiter limiter = limiter(3, 1000);
        assertThrows(IllegalArgumentException.class, () -> limiter.check(null));
    }

    @Test
    void concurrentChecksNeverExceedTheLimit() throws Exception {
        RateLimiter limiter = limiter(100, 1000);
        int threads = 16;
        int perThread = 25;
        AtomicInteger allowed = new AtomicInteger();
        AtomicInteger violations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        RateLimitDecision decision = limiter.check("shared");
                        if (decision.allowed()) {
                            allowed.incrementAndGet();
                        } else if (decision.newViolation()) {
                            violations.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, allowed.get());
        assertEquals(1, violations.get());
        assertEquals(100, limiter.usage("shared", RateWindow.MINUTE));
    }

    private RateLimiter limiter(int perMinute, int perHour) {
        RateLimitPolicy policy = new RateLimitPolicy(perMinute, perHour, 10_000, Duration.ofMinutes(5),
                Duration.ofMinutes(20), Duration.ofMinutes(15), Duration.ofHours(24));
        return new RateLimiter(policy, accessController, clock);
    }

    private RateLimitDecision violate(RateLimiter limiter) {
        return violate(limiter, 3);
    }

    private RateLimitDecision violate(RateLimiter limiter, int limit) {
        exhaust(limiter, "client", limit);
        RateLimitDecision decision = limiter.check("client");
        assertTrue(decision.newViolation());
        return decision;
    }

    private static void exhaust(RateLimiter limiter, String identifier, int count) {
        for (int i = 0; i < count; i++) {
            assertTrue(limiter.check(identifier).allowed());
        }
    }
}
