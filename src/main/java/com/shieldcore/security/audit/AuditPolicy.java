package com.shieldcore.security.audit;

import java.time.Duration;

public record AuditPolicy(
        Duration retention,
        int maxEvents,
        int maxScan,
        int highSeverityThreshold,
        int denialOfServiceThreshold,
        Duration sweepInterval
) {

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(90);
    public static final int DEFAULT_MAX_EVENTS = 10_000;
    public static final int DEFAULT_MAX_SCAN = 10_000;
    public static final int DEFAULT_HIGH_SEVERITY_THRESHOLD = 5;
    public static final int DEFAULT_DOS_THRESHOLD = 10;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);

    public static AuditPolicy defaults() {
        return new AuditPolicy(
                DEFAULT_RETENTION,
                DEFAULT_MAX_EVENTS,
                DEFAULT_MAX_SCAN,
                DEFAULT_HIGH_SEVERITY_THRESHOLD,
                DEFAULT_DOS_THRESHOLD,
                DEFAULT_SWEEP_INTERVAL
        );
    }
}
