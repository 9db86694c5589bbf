package com.shieldcore.security.ratelimit;

import java.time.Duration;

public enum RateWindow {
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1));

    private final Duration length;

    RateWindow(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }
}
