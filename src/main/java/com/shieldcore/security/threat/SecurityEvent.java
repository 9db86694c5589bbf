package com.shieldcore.security.threat;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@Builder(toBuilder = true)
public record SecurityEvent(
        Instant timestamp,
        ThreatType threatType,
        SecurityLevel severity,
        String sourceComponent,
        String description,
        String identifier,
        String payloadExcerpt,
        Map<String, Object> metadata
) {

    public SecurityEvent {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        if (threatType == null || severity == null) {
            throw new IllegalArgumentException("threatType and severity are required");
        }
        sourceComponent = sourceComponent == null ? "unknown" : sourceComponent;
        description = description == null ? "" : description;
        metadata = metadata == null ? Map.of() : metadata.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public SecurityEvent withTimestamp(Instant newTimestamp) {
        if (newTimestamp == null || newTimestamp.equals(timestamp)) {
            return this;
        }
        return toBuilder().timestamp(newTimestamp).build();
    }
}
