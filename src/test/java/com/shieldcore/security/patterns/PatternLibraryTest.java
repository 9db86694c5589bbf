package com.shieldcore.security.patterns;

import com.shieldcore.security.threat.ThreatType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternLibraryTest {

    private final PatternLibrary library = new PatternLibrary();

    @Test
    void classifiesEachDefaultCategory() {
        assertTrue(library.classify("SELECT * FROM users").contains(ThreatType.SQL_INJECTION));
        assertTrue(library.classify("' OR '1'='1").contains(ThreatType.SQL_INJECTION));
        assertTrue(library.classify("<script>alert(1)</script>").contains(ThreatType.XSS));
        assertTrue(library.classify("../../etc/passwd").contains(ThreatType.PATH_TRAVERSAL));
        assertTrue(library.classify("; rm -rf /").contains(ThreatType.COMMAND_INJECTION));
        assertTrue(library.classify("$(whoami)").contains(ThreatType.COMMAND_INJECTION));
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertEquals(Set.of(ThreatType.XSS), library.classify("<ScRiPt src=x>"));
        assertTrue(library.classify("UnIoN SeLeCt password").contains(ThreatType.SQL_INJECTION));
    }

    @Test
    void reportsEveryMatchingCategory() {
        Set<ThreatType> types = library.classify("<script>x</script>; DROP TABLE users");
        assertTrue(types.contains(ThreatType.XSS));
        assertTrue(types.contains(ThreatType.SQL_INJECTION));
    }

    @Test
    void everydayPromptsAreClean() {
        for (String prompt : List.of(
                "Hello, how are you?",
                "Turn on the living room lights",
                "What's the temperature?",
                "Create automation for sunset",
                "Show me the camera feed")) {
            assertTrue(library.classify(prompt).isEmpty(), prompt);
        }
        assertTrue(library.classify(null).isEmpty());
        assertTrue(library.classify("").isEmpty());
    }

    @Test
    void textBeyondScanLimitIsIgnored() {
        PatternLibrary small = new PatternLibrary(16);
        String padded = "a".repeat(16) + "<script>";
        assertTrue(small.classify(padded).isEmpty());
        assertEquals(Set.of(ThreatType.XSS), small.classify("<script>" + "a".repeat(16)));
    }

    @Test
    void addedPatternTakesEffect() {
        PatternLibrary custom = new PatternLibrary();
        assertTrue(custom.classify("waitfor delay '0:0:5'").isEmpty());

        custom.addPattern(ThreatType.SQL_INJECTION, "waitfor\\s+delay");

        assertEquals(Set.of(ThreatType.SQL_INJECTION), custom.classify("WAITFOR DELAY '0:0:5'"));
        assertTrue(custom.patterns().get(ThreatType.SQL_INJECTION).contains("waitfor\\s+delay"));
        assertTrue(library.classify("waitfor delay '0:0:5'").isEmpty());
    }

    @Test
    void invalidPatternKeepsPreviousCatalogue() {
        PatternLibrary custom = new PatternLibrary();
        int before = custom.patterns().get(ThreatType.XSS).size();

        assertThrows(IllegalArgumentException.class, () -> custom.addPattern(ThreatType.XSS, "(unclosed"));
        assertThrows(IllegalArgumentException.class, () -> custom.addPattern(ThreatType.DENIAL_OF_SERVICE, "x"));
        assertThrows(IllegalArgumentException.class, () -> custom.addPattern(ThreatType.XSS, " "));

        assertEquals(before, custom.patterns().get(ThreatType.XSS).size());
        assertTrue(custom.classify("<script>").contains(ThreatType.XSS));
    }

    @Test
    void replaceAllSwapsTheWholeCatalogue() {
        PatternLibrary custom = new PatternLibrary();
        custom.replaceAll(Map.of(ThreatType.XSS, List.of("forbidden")));

        assertTrue(custom.classify("<script>").isEmpty());
        assertEquals(Set.of(ThreatType.XSS), custom.classify("a FORBIDDEN word"));
    }
}
