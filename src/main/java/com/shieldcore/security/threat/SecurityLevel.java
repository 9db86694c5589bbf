package com.shieldcore.security.threat;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity ranking; declaration order is the ranking.
 */
public enum SecurityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(SecurityLevel other) {
        return other == null || compareTo(other) >= 0;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
