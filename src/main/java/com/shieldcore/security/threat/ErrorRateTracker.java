package com.shieldcore.security.threat;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

class ErrorRateTracker {

    private final DetectionPolicy policy;
    private final Cache<String, OutcomeWindow> windows;

    ErrorRateTracker(DetectionPolicy policy) {
        this.policy = policy;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(policy.inactivityTtl())
                .build();
    }

    /**
     * Records one outcome. Returns the current failure ratio when this outcome pushed the window
     * over the threshold, or a negative value otherwise.
     */
    double record(String identifier, boolean success) {
        OutcomeWindow window = windows.get(identifier, key -> new OutcomeWindow(policy.errorWindow()));
        synchronized (window) {
            window.add(success);
            double rate = window.failureRate();
            if (!window.isFull()) {
                return -1;
            }
            if (rate > policy.errorThreshold()) {
                if (!window.alarmed) {
                    window.alarmed = true;
                    return rate;
                }
                return -1;
            }
            window.alarmed = false;
            return -1;
        }
    }

    double failureRate(String identifier) {
        OutcomeWindow window = windows.getIfPresent(identifier);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.failureRate();
        }
    }

    private static final class OutcomeWindow {
        private final boolean[] failures;
        private int next;
        private int filled;
        private int failureCount;
        private boolean alarmed;

        private OutcomeWindow(int size) {
            this.failures = new boolean[Math.max(1, size)];
        }

        private void add(boolean success) {
            if (filled == failures.length && failures[next]) {
                failureCount--;
            }
            failures[next] = !success;
            if (!success) {
                failureCount++;
            }
            next = (next + 1) % failures.length;
            filled = Math.min(filled + 1, failures.length);
        }

        private boolean isFull() {
            return filled == failures.length;
        }

        private double failureRate() {
            return filled == 0 ? 0 : (double) failureCount / filled;
        }
    }
}
