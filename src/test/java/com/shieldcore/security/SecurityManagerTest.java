package com.shieldcore.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.audit.EventQuery;
import com.shieldcore.security.audit.SecurityReport;
import com.shieldcore.security.ratelimit.RateWindow;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.security.threat.ActivityCheck;
import com.shieldcore.security.threat.SecurityEvent;
import com.shieldcore.security.threat.SecurityLevel;
import com.shieldcore.security.threat.ThreatType;
import com.shieldcore.security.validation.FieldKind;
import com.shieldcore.security.validation.ValidationFailure;
import com.shieldcore.security.validation.ValidationResult;
import com.shieldcore.utils.CryptoUtils;
import com.shieldcore.utils.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecurityManagerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-08-01T09:00:00Z");
    private final List<SecurityManager> managers = new ArrayList<>();

    @AfterEach
    void closeManagers() {
        managers.forEach(SecurityManager::close);
    }

    @Test
    void sixtyFirstRequestIsBlockedWithOneDenialOfServiceEvent() {
        SecurityManager manager = manager(new SecurityProperties());

        for (int i = 0; i < 60; i++) {
            assertTrue(manager.checkRateLimit("X").allowed(), "request " + (i + 1));
        }
        RateLimitCheck sixtyFirst = manager.checkRateLimit("X");

        assertEquals(RateLimitCheck.Status.RATE_LIMITED, sixtyFirst.status());
        assertEquals(Duration.ofMinutes(5), sixtyFirst.decision().blockDuration());
        assertEquals(300, sixtyFirst.retryAfterSeconds());
        assertTrue(manager.isBlocked("X"));
        List<SecurityEvent> dos = manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.DENIAL_OF_SERVICE).build());
        assertEquals(1, dos.size());
        assertEquals(SecurityLevel.MEDIUM, dos.get(0).severity());
        assertEquals("X", dos.get(0).identifier());

        clock.advance(Duration.ofSeconds(30));
        RateLimitCheck sixtySecond = manager.checkRateLimit("X");

        assertEquals(RateLimitCheck.Status.RATE_LIMITED, sixtySecond.status());
        assertEquals(270, sixtySecond.retryAfterSeconds());
        assertEquals(60, manager.rateLimiter().usage("X", RateWindow.MINUTE));
        assertEquals(60, manager.rateLimiter().usage("X", RateWindow.DAY));
        assertEquals(1, manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.DENIAL_OF_SERVICE).build()).size());
        assertEquals(1, manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.UNAUTHORIZED_ACCESS).identifier("X").build()).size());
    }

    @Test
    void blockedCallerCannotFloodTheAuditTrail() {
        SecurityManager manager = manager(new SecurityProperties());

        for (int i = 0; i < 61; i++) {
            manager.checkRateLimit("X");
        }
        for (int i = 0; i < 20_000; i++) {
            assertFalse(manager.checkRateLimit("X").allowed());
        }

        SecurityReport report = manager.generateReport(24);
        assertFalse(report.truncated());
        assertEquals(1L, report.eventCounts().get("dos"));
        assertEquals(1L, report.eventCounts().get("unauthorized_access"));
        assertEquals(3, manager.auditLog().size());
        assertEquals(19_999, manager.threatDetector().suppressedDenials("X"));
    }

    @Test
    void blockIsActiveJustBeforeItsEndAndGoneJustAfter() {
        SecurityManager manager = manager(limits(2));
        manager.checkRateLimit("X");
        manager.checkRateLimit("X");
        manager.checkRateLimit("X");

        clock.advance(Duration.ofMinutes(5).minusSeconds(1));
        assertFalse(manager.checkRateLimit("X").allowed());

        clock.advance(Duration.ofSeconds(2));
        assertTrue(manager.checkRateLimit("X").allowed());
        assertFalse(manager.isBlocked("X"));
    }

    @Test
    void sqlInjectionIsRejectedAndAudited() {
        SecurityManager manager = manager(new SecurityProperties());

        ValidationResult result = manager.validateInput("'; DROP TABLE users; --", FieldKind.GENERAL, 1000, "X");

        assertFalse(result.ok());
        assertEquals(ValidationFailure.MALICIOUS_CONTENT, result.failure());
        assertTrue(result.threatTypes().contains(ThreatType.SQL_INJECTION));
        List<SecurityEvent> events = manager.searchEvents(EventQuery.all());
        assertEquals(1, events.size());
        assertEquals(ThreatType.SQL_INJECTION, events.get(0).threatType());
        assertEquals(SecurityLevel.HIGH, events.get(0).severity());
    }

    @Test
    void filenameTraversalIsRejected() {
        SecurityManager manager = manager(new SecurityProperties());

        ValidationResult result = manager.validateInput("../../etc/passwd", FieldKind.FILENAME, 255);

        assertEquals(ValidationFailure.PATH_TRAVERSAL, result.failure());
        assertEquals(1, manager.auditLog().size());
    }

    @Test
    void zeroMaxLengthIsARealLimit() {
        SecurityManager manager = manager(new SecurityProperties());

        assertEquals(ValidationFailure.LENGTH_EXCEEDED,
                manager.validateInput("abc", FieldKind.GENERAL, 0).failure());
        assertTrue(manager.validateInput("", FieldKind.GENERAL, 0).ok());
        assertTrue(manager.validateInput("abc", FieldKind.GENERAL, -1).ok());
        assertEquals(ValidationFailure.LENGTH_EXCEEDED,
                manager.validateInput("a".repeat(10_001), FieldKind.GENERAL, -1).failure());
    }

    @Test
    void revokedApiKeyIsRefusedAndAuditedAsCritical() {
        SecurityManager manager = manager(new SecurityProperties());
        String key = "sk-" + "a".repeat(48);
        assertTrue(manager.validateApiKey(key, "openai").ok());

        manager.revokeApiKey(key);
        ValidationResult result = manager.validateApiKey(key, "OpenAI", "svc");

        assertEquals(ValidationFailure.REVOKED_CREDENTIAL, result.failure());
        assertEquals("API key is not authorized", result.reason());
        SecurityEvent event = manager.searchEvents(EventQuery.all()).get(0);
        assertEquals(ThreatType.UNAUTHORIZED_ACCESS, event.threatType());
        assertEquals(SecurityLevel.CRITICAL, event.severity());
        assertEquals("openai", event.metadata().get("provider"));
        assertFalse(event.toString().contains(key));

        manager.reinstateApiKey(key);
        assertTrue(manager.validateApiKey(key, "openai").ok());
    }

    @Test
    void providerKeyFormatsAreChecked() {
        SecurityManager manager = manager(new SecurityProperties());

        assertEquals("Invalid OpenAI API key format",
                manager.validateApiKey("pk-" + "a".repeat(40), "openai").reason());
        assertEquals("Invalid Z.AI API key format", manager.validateApiKey("short-key-123", "z_ai").reason());
        assertTrue(manager.validateApiKey("zai." + "b".repeat(30), "z_ai").ok());
        assertEquals("API key is required", manager.validateApiKey("", "openai").reason());
        assertEquals(SecurityLevel.LOW, manager.searchEvents(EventQuery.all()).get(0).severity());
    }

    @Test
    void configuredRevocationsApplyEvenWithValidationDisabled() {
        String key = "zai." + "c".repeat(30);
        SecurityProperties properties = new SecurityProperties();
        properties.setInputValidation(false);
        properties.getValidation().setRevokedApiKeyHashes(List.of(CryptoUtils.sha256Hex(key), "not-a-digest"));
        SecurityManager manager = manager(properties);

        assertEquals(ValidationFailure.REVOKED_CREDENTIAL, manager.validateApiKey(key, "z_ai").failure());
        assertTrue(manager.validateApiKey("short", "z_ai").ok());
        assertEquals(1, manager.settings().warnings().size());
    }

    @Test
    void anomalousActivityFollowsTheThreatDetectionFlag() {
        SecurityManager manager = manager(new SecurityProperties());
        for (int i = 0; i < 100; i++) {
            manager.detectAnomalousActivity("login", "u1", Map.of());
        }
        ActivityCheck flood = manager.detectAnomalousActivity("login", "u1", Map.of());
        assertTrue(flood.anomalous());
        assertEquals(1, manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.DENIAL_OF_SERVICE).build()).size());

        SecurityProperties quiet = new SecurityProperties();
        quiet.setThreatDetection(false);
        SecurityManager disabled = manager(quiet);
        for (int i = 0; i < 150; i++) {
            assertFalse(disabled.detectAnomalousActivity("login", "u1", null).anomalous());
        }
    }

    @Test
    void secureTokensAreUrlSafeAndDistinct() {
        SecurityManager manager = manager(new SecurityProperties());

        String token = manager.generateSecureToken();

        assertTrue(token.matches("[A-Za-z0-9_-]{43}"));
        assertNotEquals(token, manager.generateSecureToken());
        assertEquals(22, manager.generateSecureToken(16).length());
        assertEquals(43, manager.generateSecureToken(0).length());
    }

    @Test
    void sensitiveDataHashesAreSaltedAndVerifiable() {
        SecurityManager manager = manager(new SecurityProperties());

        String first = manager.hashSensitiveData("hunter2");
        String second = manager.hashSensitiveData("hunter2");

        assertNotEquals(first, second);
        assertFalse(first.contains("hunter2"));
        assertTrue(manager.matchesHashedData("hunter2", first));
        assertFalse(manager.matchesHashedData("hunter3", first));
        assertFalse(manager.matchesHashedData("hunter2", "zz-not-hex"));
    }

    @Test
    void cleanInputIsNotAudited() {
        SecurityManager manager = manager(new SecurityProperties());

        assertTrue(manager.validateInput("Show me the camera feed", FieldKind.PROMPT).ok());
        assertEquals(0, manager.auditLog().size());
    }

    @Test
    void emptyReportIsNeutral() throws Exception {
        SecurityManager manager = manager(new SecurityProperties());

        SecurityReport report = manager.generateReport(24);
        assertEquals(0, report.totalEvents());
        assertEquals(List.of("No significant security issues detected"), report.recommendations());

        JsonNode json = new ObjectMapper().readTree(manager.generateReportJson(24));
        assertEquals(0, json.get("total_events").asInt());
        assertEquals(24, json.get("period_hours").asInt());
        assertTrue(json.get("report_timestamp").isTextual());
        assertTrue(json.get("blocked_identifiers").isArray());
        assertTrue(json.get("security_features").get("rate_limiting_enabled").asBoolean());
    }

    @Test
    void nonPositiveReportPeriodFallsBackToOneDay() {
        SecurityManager manager = manager(new SecurityProperties());
        assertEquals(24, manager.generateReport(0).periodHours());
        assertEquals(24, manager.generateReport(-3).periodHours());
    }

    @Test
    void manualBlockDeniesAccessUntilUnblocked() {
        SecurityManager manager = manager(new SecurityProperties());

        manager.blockIdentifier("10.0.0.7", "credential stuffing", 2);

        assertTrue(manager.isBlocked("10.0.0.7"));
        RateLimitCheck denied = manager.checkRateLimit("10.0.0.7");
        assertEquals(RateLimitCheck.Status.ACCESS_DENIED, denied.status());
        assertEquals(7200, denied.retryAfterSeconds());
        assertEquals(List.of("10.0.0.7"), manager.generateReport(1).blockedIdentifiers());
        assertEquals(1, manager.searchEvents(EventQuery.builder()
                .sourceComponent(SecurityManager.SOURCE_MANUAL_BLOCK)
                .minSeverity(SecurityLevel.HIGH).build()).size());

        assertTrue(manager.unblockIdentifier("10.0.0.7"));
        assertTrue(manager.checkRateLimit("10.0.0.7").allowed());
    }

    @Test
    void blankIdentifiersShareTheAnonymousBucket() {
        SecurityManager manager = manager(limits(1));

        assertTrue(manager.checkRateLimit(null).allowed());
        assertFalse(manager.checkRateLimit("  ").allowed());
        assertTrue(manager.isBlocked(SecurityManager.ANONYMOUS));
    }

    @Test
    void domainAllowlistIsCaseInsensitive() {
        SecurityManager manager = manager(new SecurityProperties());

        manager.addAllowedDomain("api.example.com");

        assertTrue(manager.isDomainAllowed("API.Example.com"));
        assertTrue(manager.validateInput("https://API.example.com/v1", FieldKind.URL).ok());
        manager.removeAllowedDomain("api.example.com");
        assertFalse(manager.isDomainAllowed("api.example.com"));
        assertTrue(manager.allowedDomains().contains("github.com"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void sanitizeRedactsNestedSecrets() {
        SecurityManager manager = manager(new SecurityProperties());

        Map<String, Object> out = (Map<String, Object>) manager.sanitize(
                Map.of("config", Map.of("api_key", "sk-abcdefghijklmnopqrstuvwxyz")), "log");

        assertEquals(DataSanitizer.REDACTED, ((Map<String, Object>) out.get("config")).get("api_key"));
    }

    @Test
    void repeatedFailuresRaiseAnAnomaly() {
        SecurityManager manager = manager(new SecurityProperties());

        for (int i = 0; i < 10; i++) {
            manager.validateInput("<script>" + i, FieldKind.GENERAL, 100, "noisy");
        }

        assertEquals(1, manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.ANOMALOUS_BEHAVIOR).identifier("noisy").build()).size());
        assertTrue(manager.generateReport(1).recommendations().contains(
                "Anomalous behavior detected - review the affected identifiers"));
    }

    @Test
    void disabledFeaturesShortCircuit() {
        SecurityProperties properties = limits(1);
        properties.setRateLimiting(false);
        properties.setInputValidation(false);
        SecurityManager manager = manager(properties);

        assertTrue(manager.validateInput("<script>", FieldKind.GENERAL).ok());
        for (int i = 0; i < 5; i++) {
            assertTrue(manager.checkRateLimit("X").allowed());
        }
        assertEquals(0, manager.auditLog().size());

        manager.blockIdentifier("X", "manual", Duration.ofMinutes(10));
        assertEquals(RateLimitCheck.Status.ACCESS_DENIED, manager.checkRateLimit("X").status());
    }

    @Test
    void disabledAuditLoggingStoresNothing() {
        SecurityProperties properties = new SecurityProperties();
        properties.setAuditLogging(false);
        SecurityManager manager = manager(properties);
        List<SecurityEvent> delivered = new ArrayList<>();
        manager.addListener(delivered::add);

        assertFalse(manager.validateInput("<script>", FieldKind.GENERAL).ok());

        assertEquals(0, manager.auditLog().size());
        assertEquals(1, delivered.size());
        assertEquals(0, manager.generateReport(24).totalEvents());
    }

    @Test
    void disabledThreatDetectionStillAuditsRejections() {
        SecurityProperties properties = new SecurityProperties();
        properties.setThreatDetection(false);
        SecurityManager manager = manager(properties);
        List<SecurityEvent> delivered = new ArrayList<>();
        manager.addListener(delivered::add);

        for (int i = 0; i < 12; i++) {
            manager.validateInput("<script>", FieldKind.GENERAL, 100, "noisy");
        }

        assertTrue(delivered.isEmpty());
        assertEquals(12, manager.auditLog().size());
        assertEquals(0, manager.searchEvents(EventQuery.builder()
                .threatType(ThreatType.ANOMALOUS_BEHAVIOR).build()).size());
    }

    @Test
    void malformedConfigurationNeverThrows() {
        SecurityProperties properties = new SecurityProperties();
        properties.getRateLimit().setRequestsPerMinute(-5);
        properties.getRateLimit().setOverrides("{not json");
        properties.getAudit().setRetention(Duration.ZERO);

        SecurityManager manager = new SecurityManager(properties);
        managers.add(manager);

        assertEquals(60, manager.settings().rateLimit().requestsPerMinute());
        assertFalse(manager.settings().warnings().isEmpty());
        assertTrue(manager.checkRateLimit("X").allowed());
    }

    @Test
    void patternEditsApplyToLaterValidations() {
        SecurityManager manager = manager(new SecurityProperties());
        assertTrue(manager.validateInput("waitfor delay '0:0:5'", FieldKind.GENERAL).ok());

        manager.patternLibrary().addPattern(ThreatType.SQL_INJECTION, "waitfor\\s+delay");

        ValidationResult result = manager.validateInput("waitfor delay '0:0:5'", FieldKind.GENERAL);
        assertEquals(ValidationFailure.MALICIOUS_CONTENT, result.failure());
        assertEquals(0.0, manager.threatDetector().errorRate("nobody"));
        assertTrue(manager.accessController().blockedIdentifiers().isEmpty());
    }

    @Test
    void clearEventsEmptiesTheLog() {
        SecurityManager manager = manager(new SecurityProperties());
        manager.validateInput("<script>", FieldKind.GENERAL);

        manager.clearEvents();

        assertTrue(manager.searchEvents(null).isEmpty());
    }

    @Test
    void startSchedulesTheRetentionSweep() {
        SecurityManager manager = manager(new SecurityProperties());
        manager.start();
        manager.close();
        assertEquals(0, manager.auditLog().size());
    }

    private SecurityManager manager(SecurityProperties properties) {
        SecurityManager manager = new SecurityManager(SecuritySettings.resolve(properties), clock,
                JsonSupport.objectMapper());
        managers.add(manager);
        return manager;
    }

    private static SecurityProperties limits(int perMinute) {
        SecurityProperties properties = new SecurityProperties();
        properties.getRateLimit().setRequestsPerMinute(perMinute);
        return properties;
    }
}
