package com.shieldcore.security.threat;

public record ActivityCheck(boolean anomalous, String reason, long count) {

    private static final ActivityCheck NORMAL = new ActivityCheck(false, null, 0);

    public static ActivityCheck normal() {
        return NORMAL;
    }

    public static ActivityCheck normal(long count) {
        return new ActivityCheck(false, null, count);
    }

    public static ActivityCheck flagged(String reason, long count) {
        return new ActivityCheck(true, reason, count);
    }
}
