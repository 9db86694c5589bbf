package com.shieldcore.security.sanitize;

import java.util.Locale;
import java.util.regex.Pattern;

public sealed interface SanitizationRule {

    record KeyRule(String fragment, String marker) implements SanitizationRule {
        public KeyRule {
            fragment = fragment.toLowerCase(Locale.ROOT);
        }

        public boolean matches(String key) {
            return key != null && key.toLowerCase(Locale.ROOT).contains(fragment);
        }
    }

    record InlineRule(Pattern pattern, String replacement) implements SanitizationRule {
        public static InlineRule of(String regex, String replacement) {
            return new InlineRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }

        public String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }
}
