package com.shieldcore.security.threat;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreatType {
    SQL_INJECTION("sql_injection", true),
    XSS("xss", true),
    PATH_TRAVERSAL("path_traversal", true),
    COMMAND_INJECTION("command_injection", true),
    DENIAL_OF_SERVICE("dos", false),
    UNAUTHORIZED_ACCESS("unauthorized_access", false),
    ANOMALOUS_BEHAVIOR("anomalous_behavior", false),
    MALICIOUS_INPUT("malicious_input", false),
    DATA_EXFILTRATION("data_exfiltration", false);

    private final String code;
    private final boolean patternCategory;

    ThreatType(String code, boolean patternCategory) {
        this.code = code;
        this.patternCategory = patternCategory;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Whether the type is one of the signature categories scanned by the pattern library.
     */
    public boolean isPatternCategory() {
        return patternCategory;
    }

    public boolean isInjection() {
        return this == SQL_INJECTION || this == XSS || this == COMMAND_INJECTION;
    }
}
