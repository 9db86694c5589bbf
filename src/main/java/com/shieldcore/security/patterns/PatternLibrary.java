package com.shieldcore.security.patterns;

import com.shieldcore.security.threat.ThreatType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class PatternLibrary {

    public static final int DEFAULT_SCAN_LIMIT = 100_000;

    private static final Map<ThreatType, List<String>> DEFAULT_PATTERNS = defaults();

    private final AtomicReference<PatternSnapshot> snapshot;
    private final int scanLimit;

    public PatternLibrary() {
        this(DEFAULT_PATTERNS, DEFAULT_SCAN_LIMIT);
    }

    public PatternLibrary(int scanLimit) {
        this(DEFAULT_PATTERNS, scanLimit);
    }

    public PatternLibrary(Map<ThreatType, List<String>> patterns, int scanLimit) {
        this.snapshot = new AtomicReference<>(PatternSnapshot.compile(patterns));
        this.scanLimit = scanLimit > 0 ? scanLimit : DEFAULT_SCAN_LIMIT;
    }

    /**
     * Returns every category with at least one matching signature. Text beyond the scan limit is
     * ignored.
     */
    public Set<ThreatType> classify(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        CharSequence scanned = text.length() > scanLimit ? text.subSequence(0, scanLimit) : text;
        return Collections.unmodifiableSet(snapshot.get().classify(scanned));
    }

    public void addPattern(ThreatType type, String expression) {
        snapshot.updateAndGet(current -> {
            Map<ThreatType, List<String>> sources = current.sources();
            List<String> list = new ArrayList<>(sources.getOrDefault(type, List.of()));
            list.add(expression);
            sources.put(type, list);
            return PatternSnapshot.compile(sources);
        });
        log.info("pattern added to {}: total signatures={}", type, snapshot.get().size());
    }

    public void replaceAll(Map<ThreatType, List<String>> patterns) {
        PatternSnapshot next = PatternSnapshot.compile(patterns);
        snapshot.set(next);
        log.info("pattern library replaced: total signatures={}", next.size());
    }

    public Map<ThreatType, List<String>> patterns() {
        return Collections.unmodifiableMap(snapshot.get().sources());
    }

    public int scanLimit() {
        return scanLimit;
    }

    public static Map<ThreatType, List<String>> defaultPatterns() {
        return DEFAULT_PATTERNS;
    }

    private static Map<ThreatType, List<String>> defaults() {
        EnumMap<ThreatType, List<String>> map = new EnumMap<>(ThreatType.class);
        map.put(ThreatType.SQL_INJECTION, List.of(
                "\\bunion\\s+(all\\s+)?select\\b",
                "\\bselect\\s+\\*\\s+from\\b",
                "\\binsert\\s+into\\s+\\w+",
                "\\bdelete\\s+from\\s+\\w+",
                "\\b(drop|truncate|alter|create)\\s+(table|database|schema|index|view)\\b",
                "\\bupdate\\s+\\w+\\s+set\\s+\\w+\\s*=",
                "'\\s*(or|and)\\s+['\"]?\\w+['\"]?\\s*=\\s*['\"]?\\w+",
                ";\\s*--",
                "'\\s*;",
                "\\b(xp_cmdshell|sleep\\s*\\(\\s*\\d+\\s*\\)|benchmark\\s*\\()"
        ));
        map.put(ThreatType.XSS, List.of(
                "<\\s*script\\b",
                "<\\s*/\\s*script\\s*>",
                "\\b(javascript|vbscript)\\s*:",
                "\\bon(load|error|click|mouseover|focus|blur|submit)\\s*=",
                "<\\s*(iframe|object|embed|svg|applet|meta)\\b",
                "\\b(document\\.cookie|document\\.write|window\\.location)"
        ));
        map.put(ThreatType.PATH_TRAVERSAL, List.of(
                "\\.\\./",
                "\\.\\.\\\\",
                "%2e%2e(%2f|%5c|/|\\\\)",
                "\\.\\.(%2f|%5c)",
                "%252e%252e",
                "%c0%ae"
        ));
        map.put(ThreatType.COMMAND_INJECTION, List.of(
                "`[^`]+`",
                "\\$\\([^)]*\\)",
                "[;&|]\\s*(rm|cat|echo|curl|wget|nc|ncat|bash|sh|zsh|chmod|chown|whoami|id|uname|python3?|perl|ruby|powershell|cmd)\\b",
                "\\b(exec|eval|system|popen|passthru)\\s*\\(",
                "\\b(powershell|cmd\\.exe)\\s+[-/]"
        ));
        return Collections.unmodifiableMap(map);
    }
}
