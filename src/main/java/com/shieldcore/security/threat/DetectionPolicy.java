package com.shieldcore.security.threat;

import java.time.Duration;
import java.time.ZoneId;

/**
 * @param errorWindow       number of most recent outcomes kept per identifier
 * @param errorThreshold    failure ratio above which an anomaly is reported
 * @param inactivityTtl     how long an idle identifier's counters are kept
 * @param activityThreshold repetitions of one activity above which it is reported as a flood
 * @param offHoursThreshold repetitions of an api call during off hours above which it is reported
 * @param zone              zone used to decide whether an activity happens during off hours
 */
public record DetectionPolicy(
        int errorWindow,
        double errorThreshold,
        Duration inactivityTtl,
        int activityThreshold,
        int offHoursThreshold,
        ZoneId zone
) {

    public static final int DEFAULT_ERROR_WINDOW = 10;
    public static final double DEFAULT_ERROR_THRESHOLD = 0.5;
    public static final int DEFAULT_ACTIVITY_THRESHOLD = 100;
    public static final int DEFAULT_OFF_HOURS_THRESHOLD = 10;

    public DetectionPolicy(int errorWindow, double errorThreshold, Duration inactivityTtl) {
        this(errorWindow, errorThreshold, inactivityTtl, DEFAULT_ACTIVITY_THRESHOLD, DEFAULT_OFF_HOURS_THRESHOLD,
                ZoneId.systemDefault());
    }

    public static DetectionPolicy defaults() {
        return new DetectionPolicy(DEFAULT_ERROR_WINDOW, DEFAULT_ERROR_THRESHOLD, Duration.ofHours(24));
    }
}
