package com.shieldcore.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.access.AccessController;
import com.shieldcore.security.access.BlockEntry;
import com.shieldcore.security.access.BlockOrigin;
import com.shieldcore.security.audit.AuditLog;
import com.shieldcore.security.audit.AuditRetentionSweeper;
import com.shieldcore.security.audit.EventQuery;
import com.shieldcore.security.audit.SecurityReport;
import com.shieldcore.security.patterns.PatternLibrary;
import com.shieldcore.security.ratelimit.RateLimitDecision;
import com.shieldcore.security.ratelimit.RateLimiter;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.security.threat.ActivityCheck;
import com.shieldcore.security.threat.SecurityEvent;
import com.shieldcore.security.threat.SecurityEventListener;
import com.shieldcore.security.threat.SecurityLevel;
import com.shieldcore.security.threat.ThreatDetector;
import com.shieldcore.security.threat.ThreatType;
import com.shieldcore.security.validation.FieldKind;
import com.shieldcore.security.validation.InputValidator;
import com.shieldcore.security.validation.ValidationFailure;
import com.shieldcore.security.validation.ValidationResult;
import com.shieldcore.utils.CryptoUtils;
import com.shieldcore.utils.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
public class SecurityManager implements AutoCloseable {

    public static final String ANONYMOUS = "anonymous";
    static final String UNKNOWN_PROVIDER = "unknown";
    static final String SOURCE_MANUAL_BLOCK = "manual_block";

    private final SecuritySettings settings;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final PatternLibrary patternLibrary;
    private final AccessController accessController;
    private final InputValidator inputValidator;
    private final DataSanitizer sanitizer;
    private final RateLimiter rateLimiter;
    private final AuditLog auditLog;
    private final ThreatDetector threatDetector;
    private final AuditRetentionSweeper sweeper;

    public SecurityManager(SecurityProperties properties) {
        this(SecuritySettings.resolve(properties), Clock.systemUTC(), JsonSupport.objectMapper());
    }

    public SecurityManager(SecuritySettings settings, Clock clock, ObjectMapper objectMapper) {
        this.settings = settings == null ? SecuritySettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.objectMapper = objectMapper == null ? JsonSupport.objectMapper() : objectMapper;
        this.patternLibrary = new PatternLibrary(this.settings.scanLimit());
        this.accessController = new AccessController(this.clock, this.settings.allowedDomains());
        this.settings.revokedKeyDigests().forEach(accessController::revokeApiKeyDigest);
        this.inputValidator = new InputValidator(patternLibrary, accessController,
                this.settings.allowedExtensions(), this.settings.maxFileSizeBytes());
        this.sanitizer = new DataSanitizer(DataSanitizer.DEFAULT_KEY_RULES, DataSanitizer.DEFAULT_INLINE_RULES,
                this.settings.sanitizerMaxDepth(), this.objectMapper);
        this.rateLimiter = new RateLimiter(this.settings.rateLimit(), accessController, this.clock);
        this.auditLog = new AuditLog(this.clock, this.settings.audit());
        this.threatDetector = new ThreatDetector(auditLog, sanitizer, this.settings.detection(), this.clock,
                this.settings.auditLogging());
        this.sweeper = new AuditRetentionSweeper(auditLog, this.settings.audit().sweepInterval());
    }

    public void start() {
        if (settings.auditLogging()) {
            sweeper.start();
        }
    }

    @Override
    public void close() {
        sweeper.close();
    }

    /**
     * Registers a listener for emitted events. Ignored when threat detection is disabled.
     */
    public void addListener(SecurityEventListener listener) {
        if (settings.threatDetection()) {
            threatDetector.addListener(listener);
        }
    }

    public ValidationResult validateInput(String value, FieldKind kind, int maxLength) {
        return validateInput(value, kind, maxLength, null);
    }

    public ValidationResult validateInput(String value, FieldKind kind) {
        return validateInput(value, kind, settings.defaultMaxLength(), null);
    }

    /**
     * Validates {@code value}; a rejection is audited and, when {@code identifier} is given, counted
     * against that caller's error rate. A {@code maxLength} of zero only accepts empty input; a
     * negative one means the configured default.
     */
    public ValidationResult validateInput(String value, FieldKind kind, int maxLength, String identifier) {
        if (!settings.inputValidation()) {
            return ValidationResult.valid();
        }
        FieldKind fieldKind = kind == null ? FieldKind.GENERAL : kind;
        int limit = maxLength >= 0 ? maxLength : settings.defaultMaxLength();
        ValidationResult result;
        try {
            result = inputValidator.validate(value, fieldKind, limit);
        } catch (RuntimeException ex) {
            log.warn("input validation failed internally, allowing input: {}", ex.getMessage());
            return ValidationResult.valid();
        }
        if (!result.ok()) {
            threatDetector.onValidationFailure(identifier, fieldKind, result, value, ThreatDetector.SOURCE_VALIDATION);
        }
        trackOutcome(identifier, result.ok());
        return result;
    }

    public ValidationResult validateFileUpload(String filename, long sizeBytes, byte[] content, String identifier) {
        if (!settings.inputValidation()) {
            return ValidationResult.valid();
        }
        byte[] scanned = settings.threatDetection() ? content : null;
        ValidationResult result = inputValidator.validateFileUpload(filename, sizeBytes, scanned);
        if (!result.ok()) {
            threatDetector.onValidationFailure(identifier, FieldKind.FILENAME, result, filename,
                    ThreatDetector.SOURCE_FILE_UPLOAD);
        }
        trackOutcome(identifier, result.ok());
        return result;
    }

    public ValidationResult validateApiKey(String apiKey, String provider) {
        return validateApiKey(apiKey, provider, null);
    }

    /**
     * Checks an API key for {@code provider}. Revoked keys are refused even when input validation
     * is disabled.
     */
    public ValidationResult validateApiKey(String apiKey, String provider, String identifier) {
        if (!settings.inputValidation() && !accessController.isApiKeyRevoked(apiKey)) {
            return ValidationResult.valid();
        }
        String providerName = provider == null || provider.isBlank()
                ? UNKNOWN_PROVIDER
                : provider.trim().toLowerCase(Locale.ROOT);
        ValidationResult result = inputValidator.validateApiKey(apiKey, providerName);
        if (result.failure() == ValidationFailure.REVOKED_CREDENTIAL) {
            threatDetector.onRevokedApiKey(identifier, providerName, CryptoUtils.sha256Hex(apiKey));
        } else if (!result.ok()) {
            threatDetector.onValidationFailure(identifier, FieldKind.API_KEY, result, apiKey,
                    ThreatDetector.SOURCE_API_VALIDATION);
        }
        trackOutcome(identifier, result.ok());
        return result;
    }

    public void revokeApiKey(String apiKey) {
        if (accessController.revokeApiKey(apiKey)) {
            log.info("API key revoked, {} keys on the revocation list", accessController.revokedApiKeyCount());
        }
    }

    public void reinstateApiKey(String apiKey) {
        if (accessController.reinstateApiKey(apiKey)) {
            log.info("API key removed from the revocation list");
        }
    }

    /**
     * Counts one {@code activityType} occurrence for the identifier and reports floods and
     * off-hours api calls. Always normal when threat detection is disabled.
     */
    public ActivityCheck detectAnomalousActivity(String activityType, String identifier, Map<String, ?> context) {
        if (!settings.threatDetection()) {
            return ActivityCheck.normal();
        }
        return threatDetector.detectAnomalousActivity(activityType, normalizeIdentifier(identifier), context);
    }

    public String generateSecureToken() {
        return generateSecureToken(CryptoUtils.DEFAULT_TOKEN_BYTES);
    }

    /**
     * @param byteLength random bytes behind the token; non-positive values use the default of 32
     */
    public String generateSecureToken(int byteLength) {
        return CryptoUtils.secureToken(byteLength > 0 ? byteLength : CryptoUtils.DEFAULT_TOKEN_BYTES);
    }

    public String hashSensitiveData(String data) {
        if (data == null) {
            throw new IllegalArgumentException("data is required");
        }
        return CryptoUtils.pbkdf2Hash(data);
    }

    public boolean matchesHashedData(String data, String hash) {
        return CryptoUtils.matchesHash(data, hash);
    }

    public RateLimitCheck checkRateLimit(String identifier) {
        String id = normalizeIdentifier(identifier);
        BlockEntry manual = accessController.activeEntry(id, BlockOrigin.MANUAL);
        if (manual == null && !settings.rateLimiting()) {
            manual = accessController.activeEntry(id);
        }
        if (manual != null) {
            threatDetector.onAccessDenied(id, manual);
            trackOutcome(id, false);
            return RateLimitCheck.accessDenied(manual.expiresAt(), secondsUntil(manual.expiresAt()));
        }
        if (!settings.rateLimiting()) {
            return RateLimitCheck.allowed(RateLimitDecision.unlimited());
        }

        RateLimitDecision decision = rateLimiter.check(id);
        if (decision.allowed()) {
            trackOutcome(id, true);
            return RateLimitCheck.allowed(decision);
        }
        if (decision.newViolation()) {
            threatDetector.onRateLimitViolation(id, decision);
        } else {
            threatDetector.onAccessDenied(id, accessController.activeEntry(id, BlockOrigin.AUTOMATIC));
        }
        trackOutcome(id, false);
        return RateLimitCheck.rateLimited(decision);
    }

    public Object sanitize(Object value, String context) {
        try {
            return sanitizer.sanitize(value, context);
        } catch (RuntimeException ex) {
            log.warn("sanitization failed for context {}, value withheld: {}", context, ex.getMessage());
            return DataSanitizer.REDACTED;
        }
    }

    public BlockEntry blockIdentifier(String identifier, String reason, Duration duration) {
        String id = normalizeIdentifier(identifier);
        BlockEntry entry = accessController.block(id, reason, duration);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", entry.reason());
        metadata.put("expires_at", entry.expiresAt().toString());
        threatDetector.emit(ThreatType.UNAUTHORIZED_ACCESS, SecurityLevel.HIGH, SOURCE_MANUAL_BLOCK,
                "Identifier blocked", id, null, metadata);
        return entry;
    }

    public BlockEntry blockIdentifier(String identifier, String reason, int durationHours) {
        return blockIdentifier(identifier, reason, Duration.ofHours(Math.max(0, durationHours)));
    }

    public boolean unblockIdentifier(String identifier) {
        String id = normalizeIdentifier(identifier);
        rateLimiter.release(id);
        return accessController.unblock(id);
    }

    public boolean isBlocked(String identifier) {
        return accessController.isBlocked(normalizeIdentifier(identifier));
    }

    public boolean isDomainAllowed(String domain) {
        return accessController.isDomainAllowed(domain);
    }

    public void addAllowedDomain(String domain) {
        if (accessController.addDomain(domain)) {
            log.info("domain added to allowlist: {}", domain);
        }
    }

    public void removeAllowedDomain(String domain) {
        if (accessController.removeDomain(domain)) {
            log.info("domain removed from allowlist: {}", domain);
        }
    }

    public Set<String> allowedDomains() {
        return accessController.allowedDomains();
    }

    public SecurityReport generateReport(int hours) {
        int period = hours;
        if (period <= 0) {
            log.warn("report period must be positive (was {}), using 24 hours", hours);
            period = 24;
        }
        return auditLog.report(Duration.ofHours(period))
                .withHostState(accessController.blockedIdentifiers(), rateLimiter.activeIdentifiers(),
                        settings.features());
    }

    public String generateReportJson(int hours) {
        try {
            return objectMapper.writeValueAsString(generateReport(hours));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("security report could not be serialized", ex);
        }
    }

    public List<SecurityEvent> searchEvents(EventQuery query) {
        return auditLog.search(query == null ? EventQuery.all() : query).toList();
    }

    public void clearEvents() {
        auditLog.clear();
        log.info("security events cleared");
    }

    public SecuritySettings settings() {
        return settings;
    }

    public PatternLibrary patternLibrary() {
        return patternLibrary;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public AccessController accessController() {
        return accessController;
    }

    public ThreatDetector threatDetector() {
        return threatDetector;
    }

    private void trackOutcome(String identifier, boolean success) {
        if (identifier != null && settings.threatDetection()) {
            threatDetector.recordOutcome(identifier, success);
        }
    }

    private long secondsUntil(Instant instant) {
        long millis = Duration.between(clock.instant(), instant).toMillis();
        return Math.max(0, (millis + 999) / 1000);
    }

    static String normalizeIdentifier(String identifier) {
        return identifier == null || identifier.isBlank() ? ANONYMOUS : identifier.trim();
    }
}
