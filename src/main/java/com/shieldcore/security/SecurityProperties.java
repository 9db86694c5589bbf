package com.shieldcore.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "shieldcore")
public class SecurityProperties {

    private boolean rateLimiting = true;
    private boolean inputValidation = true;
    private boolean threatDetection = true;
    private boolean auditLogging = true;

    private List<String> allowedDomains = new ArrayList<>(List.of(
            "api.openai.com",
            "api.z.ai",
            "context7.com",
            "jina.ai",
            "tavily.com",
            "api.github.com",
            "github.com",
            "supabase.com"
    ));

    private RateLimit rateLimit = new RateLimit();
    private Validation validation = new Validation();
    private Sanitizer sanitizer = new Sanitizer();
    private Detection detection = new Detection();
    private Audit audit = new Audit();
    private Filter filter = new Filter();

    @Data
    public static class RateLimit {
        private Integer requestsPerMinute;
        private Integer requestsPerHour;
        private Integer requestsPerDay;
        private Duration baseBlock;
        private Duration maxBlock;
        private Duration escalationCooldown;
        private Duration inactivityTtl;
        /**
         * JSON object with {@code requests_per_minute}, {@code requests_per_hour} and
         * {@code requests_per_day} keys; applied over the individual fields.
         */
        private String overrides;
    }

    @Data
    public static class Validation {
        private Integer scanLimit;
        private Integer defaultMaxLength;
        private Long maxFileSizeBytes;
        private List<String> allowedExtensions = new ArrayList<>();
        /**
         * SHA-256 hex digests of API keys that must be refused.
         */
        private List<String> revokedApiKeyHashes = new ArrayList<>();
    }

    @Data
    public static class Sanitizer {
        private Integer maxDepth;
    }

    @Data
    public static class Detection {
        private Integer errorWindow;
        private Double errorThreshold;
        private Integer activityThreshold;
        private Integer offHoursThreshold;
        /**
         * Zone id used for the off-hours rule; the system zone when unset.
         */
        private String timeZone;
    }

    @Data
    public static class Audit {
        private Duration retention;
        private Integer maxEvents;
        private Integer maxScan;
        private Integer highSeverityThreshold;
        private Integer denialOfServiceThreshold;
        private Duration sweepInterval;
    }

    @Data
    public static class Filter {
        private boolean enabled = true;
        private int maxLength = 2048;
        /**
         * Peer addresses whose forwarding headers are believed; {@code *} trusts every peer.
         */
        private List<String> trustedProxies = new ArrayList<>();
    }
}
