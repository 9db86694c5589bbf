package com.shieldcore.security.patterns;

import com.shieldcore.security.threat.ThreatType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class PatternSnapshot {

    private final Map<ThreatType, List<Pattern>> patterns;

    private PatternSnapshot(Map<ThreatType, List<Pattern>> patterns) {
        this.patterns = patterns;
    }

    static PatternSnapshot compile(Map<ThreatType, List<String>> sources) {
        EnumMap<ThreatType, List<Pattern>> compiled = new EnumMap<>(ThreatType.class);
        sources.forEach((type, expressions) -> {
            if (!type.isPatternCategory()) {
                throw new IllegalArgumentException(type + " is not a pattern category");
            }
            compiled.put(type, expressions.stream().map(PatternSnapshot::compileOne).toList());
        });
        return new PatternSnapshot(Collections.unmodifiableMap(compiled));
    }

    private static Pattern compileOne(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        return Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    Set<ThreatType> classify(CharSequence text) {
        EnumSet<ThreatType> matched = EnumSet.noneOf(ThreatType.class);
        for (Map.Entry<ThreatType, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    Map<ThreatType, List<String>> sources() {
        EnumMap<ThreatType, List<String>> out = new EnumMap<>(ThreatType.class);
        patterns.forEach((type, list) -> out.put(type, list.stream().map(Pattern::pattern).toList()));
        return out;
    }

    int size() {
        return patterns.values().stream().mapToInt(List::size).sum();
    }
}
