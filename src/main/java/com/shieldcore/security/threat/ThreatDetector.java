package com.shieldcore.security.threat;

import com.shieldcore.security.access.BlockEntry;
import com.shieldcore.security.audit.AuditLog;
import com.shieldcore.security.ratelimit.RateLimitDecision;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.security.validation.FieldKind;
import com.shieldcore.security.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class ThreatDetector {

    public static final String SOURCE_VALIDATION = "input_validation";
    public static final String SOURCE_FILE_UPLOAD = "file_upload";
    public static final String SOURCE_RATE_LIMITING = "rate_limiting";
    public static final String SOURCE_ACCESS_CONTROL = "access_control";
    public static final String SOURCE_ANOMALY = "anomaly_detection";
    public static final String SOURCE_API_VALIDATION = "api_validation";
    public static final String ACTIVITY_API_CALL = "api_call";

    static final int EXCERPT_LENGTH = 120;

    private static final List<ThreatType> PRECEDENCE = List.of(
            ThreatType.SQL_INJECTION,
            ThreatType.COMMAND_INJECTION,
            ThreatType.XSS,
            ThreatType.PATH_TRAVERSAL
    );

    private final AuditLog auditLog;
    private final DataSanitizer sanitizer;
    private final ErrorRateTracker errorRates;
    private final DenialTracker denials;
    private final ActivityTracker activities;
    private final DetectionPolicy policy;
    private final Clock clock;
    private final boolean auditEnabled;
    private final List<SecurityEventListener> listeners = new CopyOnWriteArrayList<>();

    public ThreatDetector(
            AuditLog auditLog,
            DataSanitizer sanitizer,
            DetectionPolicy policy,
            Clock clock,
            boolean auditEnabled
    ) {
        this.auditLog = auditLog;
        this.sanitizer = sanitizer;
        this.errorRates = new ErrorRateTracker(policy);
        this.denials = new DenialTracker(policy.inactivityTtl());
        this.activities = new ActivityTracker(policy.inactivityTtl());
        this.policy = policy;
        this.clock = clock;
        this.auditEnabled = auditEnabled;
    }

    public void addListener(SecurityEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public SecurityEvent onValidationFailure(
            String identifier,
            FieldKind kind,
            ValidationResult result,
            String input,
            String source
    ) {
        if (result == null || result.ok()) {
            return null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("field_kind", kind.name().toLowerCase(Locale.ROOT));
        metadata.put("failure", result.failure().name());
        String excerpt = kind == FieldKind.API_KEY ? null : excerpt(input);
        return switch (result.failure()) {
            case MALICIOUS_CONTENT -> {
                ThreatType primary = primaryCategory(result.threatTypes());
                metadata.put("categories", result.threatTypes().stream().map(ThreatType::code).sorted().toList());
                yield emit(primary, SecurityLevel.HIGH, source,
                        "Suspicious pattern detected: " + primary.code(), identifier, excerpt, metadata);
            }
            case LENGTH_EXCEEDED -> {
                metadata.put("length", input == null ? 0 : input.length());
                yield emit(ThreatType.MALICIOUS_INPUT, SecurityLevel.MEDIUM, source,
                        "Input too long", identifier, null, metadata);
            }
            case PATH_TRAVERSAL -> emit(ThreatType.PATH_TRAVERSAL, SecurityLevel.HIGH, source,
                    "Path traversal attempt", identifier, excerpt, metadata);
            case DOMAIN_NOT_ALLOWED -> emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.HIGH, source,
                    "Access to unauthorized domain", identifier, excerpt, metadata);
            case INVALID_FORMAT -> emit(ThreatType.MALICIOUS_INPUT, SecurityLevel.LOW, source,
                    result.reason() == null ? "Invalid format" : result.reason(), identifier, excerpt, metadata);
            case REVOKED_CREDENTIAL -> emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.CRITICAL, source,
                    "Revoked credential used", identifier, null, metadata);
        };
    }

    /**
     * Reports use of a revoked API key. Only a prefix of the key's digest is recorded.
     */
    public SecurityEvent onRevokedApiKey(String identifier, String provider, String keyDigest) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider);
        metadata.put("key_hash", keyDigest.substring(0, Math.min(16, keyDigest.length())) + "...");
        return emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.CRITICAL, SOURCE_API_VALIDATION,
                "Revoked API key used: " + provider, identifier, null, metadata);
    }

    /**
     * Reports a fresh rate-limit violation. Severity escalates with the violation count and peaks
     * once the block duration reaches its ceiling.
     */
    public SecurityEvent onRateLimitViolation(String identifier, RateLimitDecision decision) {
        if (decision == null || !decision.newViolation()) {
            return null;
        }
        SecurityLevel severity;
        if (decision.atCeiling()) {
            severity = SecurityLevel.CRITICAL;
        } else if (decision.violationCount() > 1) {
            severity = SecurityLevel.HIGH;
        } else {
            severity = SecurityLevel.MEDIUM;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("window", decision.trippedWindow().name().toLowerCase(Locale.ROOT));
        metadata.put("violation_count", decision.violationCount());
        metadata.put("block_seconds", decision.blockDuration().toSeconds());
        return emit(ThreatType.DENIAL_OF_SERVICE, severity, SOURCE_RATE_LIMITING,
                "Rate limit exceeded (" + metadata.get("window") + ")", identifier, null, metadata);
    }

    /**
     * Reports a denied request. Only the first denial under a given block entry is recorded; later
     * ones are counted and the count is carried by the identifier's next denial event.
     *
     * @return the recorded event, or {@code null} when the denial was suppressed
     */
    public SecurityEvent onAccessDenied(String identifier, BlockEntry entry) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (entry != null) {
            long suppressed = identifier == null ? 0 : denials.firstDenial(identifier, entry);
            if (suppressed < 0) {
                return null;
            }
            metadata.put("origin", entry.origin().name().toLowerCase(Locale.ROOT));
            metadata.put("blocked_until", entry.expiresAt().toString());
            if (suppressed > 0) {
                metadata.put("suppressed_denials", suppressed);
            }
        }
        return emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.MEDIUM, SOURCE_ACCESS_CONTROL,
                "Request from blocked identifier denied", identifier, null, metadata);
    }

    /**
     * Feeds one request outcome into the identifier's error-rate window.
     *
     * @return the anomaly event when the failure ratio just crossed the threshold, else {@code null}
     */
    public SecurityEvent recordOutcome(String identifier, boolean success) {
        if (identifier == null) {
            return null;
        }
        double rate = errorRates.record(identifier, success);
        if (rate < 0) {
            return null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_rate", rate);
        return emit(ThreatType.ANOMALOUS_BEHAVIOR, SecurityLevel.MEDIUM, SOURCE_ANOMALY,
                String.format(Locale.ROOT, "Error rate %.0f%% over recent requests", rate * 100),
                identifier, null, metadata);
    }

    public long suppressedDenials(String identifier) {
        return identifier == null ? 0 : denials.suppressed(identifier);
    }

    /**
     * Counts one occurrence of {@code activityType} for {@code identifier} and flags floods of the
     * same activity and api calls made during off hours (before 06:00 or after 22:59). Once flagged,
     * an event is recorded on the crossing and then once per further threshold's worth of activity.
     */
    public ActivityCheck detectAnomalousActivity(String activityType, String identifier, Map<String, ?> context) {
        if (activityType == null || activityType.isBlank() || identifier == null) {
            return ActivityCheck.normal();
        }
        long count = activities.increment(activityType, identifier);
        if (count > policy.activityThreshold()) {
            if (isReportable(count, policy.activityThreshold())) {
                Map<String, Object> metadata = activityMetadata(activityType, count, context);
                emit(ThreatType.DENIAL_OF_SERVICE, SecurityLevel.HIGH, SOURCE_ANOMALY,
                        "High frequency activity detected: " + activityType, identifier, null, metadata);
            }
            return ActivityCheck.flagged("High frequency " + activityType + " activity detected", count);
        }
        int hour = clock.instant().atZone(policy.zone()).getHour();
        if (ACTIVITY_API_CALL.equals(activityType) && (hour < 6 || hour > 22)
                && count > policy.offHoursThreshold()) {
            if (isReportable(count, policy.offHoursThreshold())) {
                Map<String, Object> metadata = activityMetadata(activityType, count, context);
                metadata.put("hour", hour);
                emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.MEDIUM, SOURCE_ANOMALY,
                        "Unusual time activity: " + activityType, identifier, null, metadata);
            }
            return ActivityCheck.flagged("Unusual time " + activityType + " activity detected", count);
        }
        return ActivityCheck.normal(count);
    }

    public long activityCount(String activityType, String identifier) {
        return activities.count(activityType, identifier);
    }

    public double errorRate(String identifier) {
        return identifier == null ? 0 : errorRates.failureRate(identifier);
    }

    public SecurityEvent emit(
            ThreatType type,
            SecurityLevel severity,
            String source,
            String description,
            String identifier,
            String payloadExcerpt,
            Map<String, Object> metadata
    ) {
        SecurityEvent event = SecurityEvent.builder()
                .timestamp(clock.instant())
                .threatType(type)
                .severity(severity)
                .sourceComponent(source)
                .description(description)
                .identifier(identifier)
                .payloadExcerpt(payloadExcerpt)
                .metadata(metadata)
                .build();
        SecurityEvent stored = auditEnabled ? auditLog.record(event) : event;
        log.debug("security event: type={}, severity={}, source={}", type.code(), severity, source);
        for (SecurityEventListener listener : listeners) {
            try {
                listener.onEvent(stored);
            } catch (RuntimeException ex) {
                log.warn("security event listener failed: {}", ex.getMessage());
            }
        }
        return stored;
    }

    static ThreatType primaryCategory(Set<ThreatType> matched) {
        for (ThreatType type : PRECEDENCE) {
            if (matched.contains(type)) {
                return type;
            }
        }
        return ThreatType.MALICIOUS_INPUT;
    }

    private static boolean isReportable(long count, int threshold) {
        return (count - threshold - 1) % Math.max(1, threshold) == 0;
    }

    private Map<String, Object> activityMetadata(String activityType, long count, Map<String, ?> context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("activity_type", activityType);
        metadata.put("count", count);
        if (context != null && !context.isEmpty()) {
            metadata.put("context", sanitizer.sanitize(context, SOURCE_ANOMALY));
        }
        return metadata;
    }

    private String excerpt(String input) {
        if (input == null || input.isEmpty()) {
            return null;
        }
        String clean = sanitizer.sanitizeText(input);
        return clean.length() > EXCERPT_LENGTH ? clean.substring(0, EXCERPT_LENGTH) : clean;
    }
}
