package com.shieldcore.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.audit.AuditPolicy;
import com.shieldcore.security.patterns.PatternLibrary;
import com.shieldcore.security.ratelimit.RateLimitPolicy;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.security.threat.DetectionPolicy;
import com.shieldcore.security.validation.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validated configuration. {@link #resolve} is the one place where bad or missing values are
 * replaced, following this table:
 *
 * <pre>
 * setting                         default      rule
 * rate-limit.requests-per-minute  60           must be &gt; 0
 * rate-limit.requests-per-hour    1000         must be &gt; 0
 * rate-limit.requests-per-day     10000        must be &gt; 0
 * rate-limit.base-block           5m           must be &gt; 0
 * rate-limit.max-block            1h           must be &gt;= base-block
 * rate-limit.escalation-cooldown  15m          must be &gt;= 0
 * rate-limit.inactivity-ttl       24h          must be &gt;= max-block
 * rate-limit.overrides            (none)       JSON object; unparseable or non-positive entries ignored
 * validation.scan-limit           100000       must be &gt; 0
 * validation.default-max-length   10000        must be &gt; 0
 * validation.max-file-size-bytes  50 MiB       must be &gt; 0
 * validation.allowed-extensions   built-in     empty list keeps the built-in set
 * validation.revoked-api-key-hashes (none)     SHA-256 hex digests; malformed entries ignored
 * sanitizer.max-depth             20           must be &gt; 0
 * detection.error-window          10           must be &gt; 0
 * detection.error-threshold       0.5          must be in (0, 1)
 * detection.activity-threshold    100          must be &gt; 0
 * detection.off-hours-threshold   10           must be &gt; 0
 * detection.time-zone             system zone  must be a valid zone id
 * audit.retention                 90d          must be &gt; 0
 * audit.max-events                10000        must be &gt; 0
 * audit.max-scan                  10000        must be &gt; 0
 * audit.high-severity-threshold   5            must be &gt;= 0
 * audit.denial-of-service-threshold 10         must be &gt;= 0
 * audit.sweep-interval            1h           must be &gt; 0
 * </pre>
 *
 * Every replaced value is logged as a warning and kept in {@link #warnings()}.
 *
 * <p>The {@code maxLength} passed to {@code SecurityManager#validateInput} is taken literally,
 * zero included; only a negative value falls back to {@code validation.default-max-length}.
 */
@Slf4j
public record SecuritySettings(
        boolean rateLimiting,
        boolean inputValidation,
        boolean threatDetection,
        boolean auditLogging,
        RateLimitPolicy rateLimit,
        AuditPolicy audit,
        DetectionPolicy detection,
        int scanLimit,
        int defaultMaxLength,
        long maxFileSizeBytes,
        Set<String> allowedExtensions,
        List<String> revokedKeyDigests,
        int sanitizerMaxDepth,
        List<String> allowedDomains,
        List<String> warnings
) {

    public static final int DEFAULT_MAX_LENGTH = 10_000;

    private static final ObjectMapper OVERRIDES_MAPPER = new ObjectMapper();
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    public static SecuritySettings defaults() {
        return resolve(new SecurityProperties());
    }

    public static SecuritySettings resolve(SecurityProperties properties) {
        List<String> warnings = new ArrayList<>();
        if (properties == null) {
            warn(warnings, "no configuration supplied, using defaults");
            properties = new SecurityProperties();
        }
        try {
            return build(properties, warnings);
        } catch (RuntimeException ex) {
            warn(warnings, "configuration could not be read (" + ex.getMessage() + "), using defaults");
            return build(new SecurityProperties(), warnings);
        }
    }

    private static SecuritySettings build(SecurityProperties p, List<String> warnings) {
        Consumer<String> w = message -> warn(warnings, message);
        SecurityProperties.RateLimit rl = p.getRateLimit() == null ? new SecurityProperties.RateLimit() : p.getRateLimit();

        int perMinute = positive(rl.getRequestsPerMinute(), RateLimitPolicy.DEFAULT_PER_MINUTE, "rate-limit.requests-per-minute", w);
        int perHour = positive(rl.getRequestsPerHour(), RateLimitPolicy.DEFAULT_PER_HOUR, "rate-limit.requests-per-hour", w);
        int perDay = positive(rl.getRequestsPerDay(), RateLimitPolicy.DEFAULT_PER_DAY, "rate-limit.requests-per-day", w);
        Map<String, Object> overrides = parseOverrides(rl.getOverrides(), w);
        perMinute = override(overrides, "requests_per_minute", perMinute, w);
        perHour = override(overrides, "requests_per_hour", perHour, w);
        perDay = override(overrides, "requests_per_day", perDay, w);

        Duration baseBlock = positive(rl.getBaseBlock(), RateLimitPolicy.DEFAULT_BASE_BLOCK, "rate-limit.base-block", w);
        Duration maxBlock = positive(rl.getMaxBlock(), RateLimitPolicy.DEFAULT_MAX_BLOCK, "rate-limit.max-block", w);
        if (maxBlock.compareTo(baseBlock) < 0) {
            w.accept("rate-limit.max-block " + maxBlock + " is below base-block, using " + baseBlock);
            maxBlock = baseBlock;
        }
        Duration cooldown = rl.getEscalationCooldown();
        if (cooldown == null) {
            cooldown = RateLimitPolicy.DEFAULT_COOLDOWN;
        } else if (cooldown.isNegative()) {
            w.accept("rate-limit.escalation-cooldown must not be negative, using " + RateLimitPolicy.DEFAULT_COOLDOWN);
            cooldown = RateLimitPolicy.DEFAULT_COOLDOWN;
        }
        Duration ttl = positive(rl.getInactivityTtl(), RateLimitPolicy.DEFAULT_INACTIVITY_TTL, "rate-limit.inactivity-ttl", w);
        if (ttl.compareTo(maxBlock) < 0) {
            w.accept("rate-limit.inactivity-ttl is below max-block, using " + maxBlock);
            ttl = maxBlock;
        }
        RateLimitPolicy rateLimit = new RateLimitPolicy(perMinute, perHour, perDay, baseBlock, maxBlock, cooldown, ttl);

        SecurityProperties.Validation v = p.getValidation() == null ? new SecurityProperties.Validation() : p.getValidation();
        int scanLimit = positive(v.getScanLimit(), PatternLibrary.DEFAULT_SCAN_LIMIT, "validation.scan-limit", w);
        int defaultMaxLength = positive(v.getDefaultMaxLength(), DEFAULT_MAX_LENGTH, "validation.default-max-length", w);
        long maxFileSize = v.getMaxFileSizeBytes() == null ? InputValidator.DEFAULT_MAX_FILE_SIZE : v.getMaxFileSizeBytes();
        if (maxFileSize <= 0) {
            w.accept("validation.max-file-size-bytes must be positive, using " + InputValidator.DEFAULT_MAX_FILE_SIZE);
            maxFileSize = InputValidator.DEFAULT_MAX_FILE_SIZE;
        }
        Set<String> extensions = normalizeExtensions(v.getAllowedExtensions());
        List<String> revokedKeyDigests = normalizeDigests(v.getRevokedApiKeyHashes(), w);

        int maxDepth = positive(p.getSanitizer() == null ? null : p.getSanitizer().getMaxDepth(),
                DataSanitizer.DEFAULT_MAX_DEPTH, "sanitizer.max-depth", w);

        SecurityProperties.Detection d = p.getDetection() == null ? new SecurityProperties.Detection() : p.getDetection();
        int errorWindow = positive(d.getErrorWindow(), DetectionPolicy.DEFAULT_ERROR_WINDOW, "detection.error-window", w);
        double threshold = d.getErrorThreshold() == null ? DetectionPolicy.DEFAULT_ERROR_THRESHOLD : d.getErrorThreshold();
        if (Double.isNaN(threshold) || threshold <= 0 || threshold >= 1) {
            w.accept("detection.error-threshold must be between 0 and 1, using " + DetectionPolicy.DEFAULT_ERROR_THRESHOLD);
            threshold = DetectionPolicy.DEFAULT_ERROR_THRESHOLD;
        }
        int activityThreshold = positive(d.getActivityThreshold(), DetectionPolicy.DEFAULT_ACTIVITY_THRESHOLD,
                "detection.activity-threshold", w);
        int offHoursThreshold = positive(d.getOffHoursThreshold(), DetectionPolicy.DEFAULT_OFF_HOURS_THRESHOLD,
                "detection.off-hours-threshold", w);
        ZoneId zone = ZoneId.systemDefault();
        if (d.getTimeZone() != null && !d.getTimeZone().isBlank()) {
            try {
                zone = ZoneId.of(d.getTimeZone().trim());
            } catch (DateTimeException ex) {
                w.accept("detection.time-zone " + d.getTimeZone() + " is not a zone id, using " + zone);
            }
        }
        DetectionPolicy detection = new DetectionPolicy(errorWindow, threshold, ttl, activityThreshold,
                offHoursThreshold, zone);

        SecurityProperties.Audit a = p.getAudit() == null ? new SecurityProperties.Audit() : p.getAudit();
        AuditPolicy audit = new AuditPolicy(
                positive(a.getRetention(), AuditPolicy.DEFAULT_RETENTION, "audit.retention", w),
                positive(a.getMaxEvents(), AuditPolicy.DEFAULT_MAX_EVENTS, "audit.max-events", w),
                positive(a.getMaxScan(), AuditPolicy.DEFAULT_MAX_SCAN, "audit.max-scan", w),
                nonNegative(a.getHighSeverityThreshold(), AuditPolicy.DEFAULT_HIGH_SEVERITY_THRESHOLD,
                        "audit.high-severity-threshold", w),
                nonNegative(a.getDenialOfServiceThreshold(), AuditPolicy.DEFAULT_DOS_THRESHOLD,
                        "audit.denial-of-service-threshold", w),
                positive(a.getSweepInterval(), AuditPolicy.DEFAULT_SWEEP_INTERVAL, "audit.sweep-interval", w)
        );

        List<String> domains = p.getAllowedDomains() == null ? List.of() : p.getAllowedDomains().stream()
                .filter(domain -> domain != null && !domain.isBlank())
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();

        return new SecuritySettings(
                p.isRateLimiting(),
                p.isInputValidation(),
                p.isThreatDetection(),
                p.isAuditLogging(),
                rateLimit,
                audit,
                detection,
                scanLimit,
                defaultMaxLength,
                maxFileSize,
                extensions,
                revokedKeyDigests,
                maxDepth,
                domains,
                Collections.unmodifiableList(warnings)
        );
    }

    public Map<String, Boolean> features() {
        return Map.of(
                "rate_limiting_enabled", rateLimiting,
                "input_validation_enabled", inputValidation,
                "threat_detection_enabled", threatDetection,
                "audit_logging_enabled", auditLogging
        );
    }

    private static Set<String> normalizeExtensions(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return InputValidator.DEFAULT_ALLOWED_EXTENSIONS;
        }
        return configured.stream()
                .filter(ext -> ext != null && !ext.isBlank())
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static List<String> normalizeDigests(List<String> configured, Consumer<String> w) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<String> digests = new ArrayList<>();
        for (String digest : configured) {
            String value = digest == null ? "" : digest.trim().toLowerCase(Locale.ROOT);
            if (SHA256_HEX.matcher(value).matches()) {
                digests.add(value);
            } else {
                w.accept("validation.revoked-api-key-hashes entry is not a SHA-256 hex digest, ignoring it");
            }
        }
        return List.copyOf(digests);
    }

    private static Map<String, Object> parseOverrides(String json, Consumer<String> w) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<?, ?> raw = OVERRIDES_MAPPER.readValue(json, Map.class);
            Map<String, Object> out = new HashMap<>();
            raw.forEach((key, value) -> out.put(String.valueOf(key), value));
            return out;
        } catch (JsonProcessingException ex) {
            w.accept("rate-limit.overrides is not valid JSON, ignoring it");
            return Map.of();
        }
    }

    private static int override(Map<String, Object> overrides, String key, int current, Consumer<String> w) {
        Object value = overrides.get(key);
        if (value == null) {
            return current;
        }
        if (value instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        w.accept("rate-limit.overrides." + key + " must be a positive number, keeping " + current);
        return current;
    }

    private static int positive(Integer value, int fallback, String name, Consumer<String> w) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            w.accept(name + " must be positive (was " + value + "), using " + fallback);
            return fallback;
        }
        return value;
    }

    private static int nonNegative(Integer value, int fallback, String name, Consumer<String> w) {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            w.accept(name + " must not be negative (was " + value + "), using " + fallback);
            return fallback;
        }
        return value;
    }

    private static Duration positive(Duration value, Duration fallback, String name, Consumer<String> w) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            w.accept(name + " must be positive (was " + value + "), using " + fallback);
            return fallback;
        }
        return value;
    }

    private static void warn(List<String> warnings, String message) {
        warnings.add(message);
        log.warn("shieldcore configuration: {}", message);
    }
}
