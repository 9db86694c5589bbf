package com.shieldcore.security.sanitize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DataSanitizer {

    public static final String REDACTED = "***REDACTED***";
    public static final String TRUNCATED = "***TRUNCATED***";
    public static final int DEFAULT_MAX_DEPTH = 20;

    public static final List<SanitizationRule.KeyRule> DEFAULT_KEY_RULES = List.of(
            new SanitizationRule.KeyRule("token", REDACTED),
            new SanitizationRule.KeyRule("key", REDACTED),
            new SanitizationRule.KeyRule("password", REDACTED),
            new SanitizationRule.KeyRule("secret", REDACTED),
            new SanitizationRule.KeyRule("credential", REDACTED),
            new SanitizationRule.KeyRule("auth", REDACTED)
    );

    public static final List<SanitizationRule.InlineRule> DEFAULT_INLINE_RULES = List.of(
            SanitizationRule.InlineRule.of("sk-[A-Za-z0-9_\\-]{20,}", "sk-" + REDACTED),
            SanitizationRule.InlineRule.of("(Bearer\\s+)[A-Za-z0-9\\-._~+/]+=*", "$1" + REDACTED),
            SanitizationRule.InlineRule.of("((?:token|password|secret|key)[\"']?\\s*[:=]\\s*[\"']?)[^\"'\\s,;&*]+",
                    "$1" + REDACTED)
    );

    private final List<SanitizationRule.KeyRule> keyRules;
    private final List<SanitizationRule.InlineRule> inlineRules;
    private final int maxDepth;
    private final ObjectMapper objectMapper;

    public DataSanitizer() {
        this(DEFAULT_KEY_RULES, DEFAULT_INLINE_RULES, DEFAULT_MAX_DEPTH, new ObjectMapper());
    }

    public DataSanitizer(
            List<SanitizationRule.KeyRule> keyRules,
            List<SanitizationRule.InlineRule> inlineRules,
            int maxDepth,
            ObjectMapper objectMapper
    ) {
        this.keyRules = List.copyOf(keyRules);
        this.inlineRules = List.copyOf(inlineRules);
        this.maxDepth = maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
        this.objectMapper = objectMapper;
    }

    /**
     * @param value   data about to be logged or exported
     * @param context caller tag, used only for diagnostics
     * @return a redacted copy of {@code value}
     */
    public Object sanitize(Object value, String context) {
        if (value instanceof JsonNode node) {
            return sanitizeJson(node);
        }
        return sanitizeValue(value, 0);
    }

    public JsonNode sanitizeJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        Object plain = objectMapper.convertValue(node, Object.class);
        return objectMapper.valueToTree(sanitizeValue(plain, 0));
    }

    public String sanitizeText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (SanitizationRule.InlineRule rule : inlineRules) {
            result = rule.apply(result);
        }
        return result;
    }

    public boolean isSensitiveKey(Object key) {
        if (key == null) {
            return false;
        }
        String name = key.toString();
        for (SanitizationRule.KeyRule rule : keyRules) {
            if (rule.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private Object sanitizeValue(Object value, int depth) {
        if (depth > maxDepth) {
            return TRUNCATED;
        }
        if (value instanceof String text) {
            return sanitizeText(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object sanitized = isSensitiveKey(entry.getKey())
                        ? markerFor(entry.getKey())
                        : sanitizeValue(entry.getValue(), depth + 1);
                copy.put(entry.getKey(), sanitized);
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(sanitizeValue(item, depth + 1));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(sanitizeValue(item, depth + 1));
            }
            return copy;
        }
        return value;
    }

    private String markerFor(Object key) {
        String name = key.toString();
        for (SanitizationRule.KeyRule rule : keyRules) {
            if (rule.matches(name)) {
                return rule.marker();
            }
        }
        return REDACTED;
    }
}
