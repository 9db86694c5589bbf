package com.shieldcore.security.audit;

import com.shieldcore.security.threat.SecurityEvent;
import com.shieldcore.security.threat.SecurityLevel;
import com.shieldcore.security.threat.ThreatType;
import lombok.Builder;
import lombok.Singular;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

@Builder
public record EventQuery(
        @Singular Set<ThreatType> threatTypes,
        SecurityLevel minSeverity,
        String identifier,
        String descriptionContains,
        String sourceComponent,
        Instant since,
        Integer limit
) implements Predicate<SecurityEvent> {

    public static EventQuery all() {
        return EventQuery.builder().build();
    }

    @Override
    public boolean test(SecurityEvent event) {
        if (threatTypes != null && !threatTypes.isEmpty() && !threatTypes.contains(event.threatType())) {
            return false;
        }
        if (minSeverity != null && !event.severity().atLeast(minSeverity)) {
            return false;
        }
        if (identifier != null && !identifier.equals(event.identifier())) {
            return false;
        }
        if (sourceComponent != null && !sourceComponent.equals(event.sourceComponent())) {
            return false;
        }
        if (since != null && event.timestamp().isBefore(since)) {
            return false;
        }
        return descriptionContains == null
                || event.description().toLowerCase(Locale.ROOT).contains(descriptionContains.toLowerCase(Locale.ROOT));
    }
}
