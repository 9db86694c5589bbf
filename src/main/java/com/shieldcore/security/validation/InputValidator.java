package com.shieldcore.security.validation;

import com.shieldcore.security.access.AccessController;
import com.shieldcore.security.patterns.PatternLibrary;
import com.shieldcore.security.threat.ThreatType;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public class InputValidator {

    public static final Set<String> DEFAULT_ALLOWED_EXTENSIONS = Set.of(
            ".txt", ".md", ".json", ".yaml", ".yml", ".csv",
            ".jpg", ".jpeg", ".png", ".gif", ".webp",
            ".pdf", ".doc", ".docx"
    );
    public static final long DEFAULT_MAX_FILE_SIZE = 50L * 1024 * 1024;
    public static final String PROVIDER_OPENAI = "openai";
    public static final String PROVIDER_Z_AI = "z_ai";
    static final int Z_AI_MIN_KEY_LENGTH = 20;

    private static final Pattern FILENAME_CHARS = Pattern.compile("[A-Za-z0-9._ \\-]+");
    private static final Pattern ENCODED_TRAVERSAL = Pattern.compile(
            "%(2e|2f|5c|00|252e|252f|c0%ae|c0%af)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:");
    private static final Pattern API_KEY_SHAPE = Pattern.compile("[A-Za-z0-9_\\-.~+/=:]{16,512}");
    private static final Pattern EMBEDDED_CONTENT = Pattern.compile(
            "<script[^>]*>|javascript:|vbscript:|onload\\s*=|onerror\\s*=|exec\\s*\\(|eval\\s*\\(|system\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private final PatternLibrary patternLibrary;
    private final AccessController accessController;
    private final Set<String> allowedExtensions;
    private final long maxFileSize;

    public InputValidator(PatternLibrary patternLibrary, AccessController accessController) {
        this(patternLibrary, accessController, DEFAULT_ALLOWED_EXTENSIONS, DEFAULT_MAX_FILE_SIZE);
    }

    public InputValidator(
            PatternLibrary patternLibrary,
            AccessController accessController,
            Set<String> allowedExtensions,
            long maxFileSize
    ) {
        this.patternLibrary = patternLibrary;
        this.accessController = accessController;
        this.allowedExtensions = allowedExtensions == null || allowedExtensions.isEmpty()
                ? DEFAULT_ALLOWED_EXTENSIONS
                : Set.copyOf(allowedExtensions);
        this.maxFileSize = maxFileSize > 0 ? maxFileSize : DEFAULT_MAX_FILE_SIZE;
    }

    public ValidationResult validate(String value, FieldKind kind, int maxLength) {
        String input = value == null ? "" : value;
        FieldKind fieldKind = kind == null ? FieldKind.GENERAL : kind;
        if (input.length() > maxLength) {
            return ValidationResult.fail(ValidationFailure.LENGTH_EXCEEDED,
                    "Input too long (max " + maxLength + " characters)");
        }
        return switch (fieldKind) {
            case FILENAME -> validateFilename(input);
            case URL -> validateUrl(input);
            case API_KEY -> validateApiKey(input);
            case GENERAL, PROMPT -> validateText(input);
        };
    }

    /**
     * Checks an uploaded file: its name, its size and, when given, its content.
     */
    public ValidationResult validateFileUpload(String filename, long sizeBytes, byte[] content) {
        ValidationResult nameResult = validate(filename, FieldKind.FILENAME, 255);
        if (!nameResult.ok()) {
            return nameResult;
        }
        if (sizeBytes > maxFileSize) {
            return ValidationResult.fail(ValidationFailure.LENGTH_EXCEEDED,
                    "File too large (max " + (maxFileSize / (1024 * 1024)) + "MB)");
        }
        if (content != null && content.length > 0) {
            int scanned = Math.min(content.length, patternLibrary.scanLimit());
            String text = new String(content, 0, scanned, StandardCharsets.UTF_8);
            if (EMBEDDED_CONTENT.matcher(text).find()) {
                Set<ThreatType> types = patternLibrary.classify(text);
                return ValidationResult.malicious(types.isEmpty() ? Set.of(ThreatType.XSS) : types);
            }
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateText(String input) {
        Set<ThreatType> matched = patternLibrary.classify(input);
        if (matched.isEmpty()) {
            return ValidationResult.valid();
        }
        return ValidationResult.malicious(matched);
    }

    private ValidationResult validateFilename(String input) {
        if (input.isBlank()) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Filename is required");
        }
        if (isTraversal(input)) {
            return ValidationResult.fail(ValidationFailure.PATH_TRAVERSAL, "Invalid filename: path traversal");
        }
        if (!FILENAME_CHARS.matcher(input).matches()) {
            return ValidationResult.fail(ValidationFailure.PATH_TRAVERSAL,
                    "Invalid filename: disallowed path characters");
        }
        int dot = input.lastIndexOf('.');
        String extension = dot < 0 ? "" : input.substring(dot).toLowerCase(Locale.ROOT);
        if (!allowedExtensions.contains(extension)) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT,
                    "File extension not allowed: " + (extension.isEmpty() ? "(none)" : extension));
        }
        return ValidationResult.valid();
    }

    private static boolean isTraversal(String input) {
        return input.contains("..")
                || input.startsWith("/")
                || input.startsWith("\\")
                || input.startsWith("~")
                || DRIVE_LETTER.matcher(input).find()
                || input.indexOf(':') >= 0
                || input.indexOf('\0') >= 0
                || ENCODED_TRAVERSAL.matcher(input).find();
    }

    private ValidationResult validateUrl(String input) {
        URI uri;
        try {
            uri = new URI(input.trim());
        } catch (URISyntaxException ex) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Invalid URL format");
        }
        String host = uri.getHost();
        if (uri.getScheme() == null || host == null || host.isBlank()) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Invalid URL format");
        }
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            return ValidationResult.fail(ValidationFailure.DOMAIN_NOT_ALLOWED, "Only https URLs are allowed");
        }
        if (!accessController.isDomainAllowed(host)) {
            return ValidationResult.fail(ValidationFailure.DOMAIN_NOT_ALLOWED, "Domain not allowed");
        }
        return ValidationResult.valid();
    }

    /**
     * Checks an API key against the revocation list, then against the provider's key format, then
     * against the generic key shape.
     */
    public ValidationResult validateApiKey(String apiKey, String provider) {
        if (apiKey == null || apiKey.isEmpty()) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "API key is required");
        }
        if (accessController.isApiKeyRevoked(apiKey)) {
            return ValidationResult.fail(ValidationFailure.REVOKED_CREDENTIAL, "API key is not authorized");
        }
        String providerName = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
        if (PROVIDER_OPENAI.equals(providerName) && !apiKey.startsWith("sk-")) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Invalid OpenAI API key format");
        }
        if (PROVIDER_Z_AI.equals(providerName) && apiKey.length() < Z_AI_MIN_KEY_LENGTH) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Invalid Z.AI API key format");
        }
        return validateApiKey(apiKey);
    }

    private static ValidationResult validateApiKey(String input) {
        if (input.isEmpty()) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "API key is required");
        }
        if (!API_KEY_SHAPE.matcher(input).matches()) {
            return ValidationResult.fail(ValidationFailure.INVALID_FORMAT, "Invalid API key format");
        }
        return ValidationResult.valid();
    }
}
