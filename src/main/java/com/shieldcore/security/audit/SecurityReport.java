package com.shieldcore.security.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Builder
@JsonPropertyOrder({
        "report_timestamp", "period_hours", "total_events", "truncated", "event_counts", "severity_counts",
        "source_counts", "recommendations", "blocked_identifiers", "rate_limit_active", "security_features"
})
public record SecurityReport(
        @JsonProperty("report_timestamp") Instant reportTimestamp,
        @JsonProperty("period_hours") long periodHours,
        @JsonProperty("total_events") long totalEvents,
        @JsonProperty("truncated") boolean truncated,
        @JsonProperty("event_counts") Map<String, Long> eventCounts,
        @JsonProperty("severity_counts") Map<String, Long> severityCounts,
        @JsonProperty("source_counts") Map<String, Long> sourceCounts,
        @JsonProperty("recommendations") List<String> recommendations,
        @JsonProperty("blocked_identifiers") List<String> blockedIdentifiers,
        @JsonProperty("rate_limit_active") long rateLimitActive,
        @JsonProperty("security_features") Map<String, Boolean> securityFeatures
) {

    public SecurityReport {
        eventCounts = sorted(eventCounts);
        severityCounts = sorted(severityCounts);
        sourceCounts = sorted(sourceCounts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        blockedIdentifiers = blockedIdentifiers == null ? List.of() : List.copyOf(blockedIdentifiers);
        securityFeatures = sorted(securityFeatures);
    }

    private static <V> Map<String, V> sorted(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(source));
    }

    public SecurityReport withHostState(List<String> blocked, long rateLimitActive, Map<String, Boolean> features) {
        return new SecurityReport(reportTimestamp, periodHours, totalEvents, truncated, eventCounts, severityCounts,
                sourceCounts, recommendations, blocked, rateLimitActive, features);
    }
}
