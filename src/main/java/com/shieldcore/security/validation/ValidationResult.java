package com.shieldcore.security.validation;

import com.shieldcore.security.threat.ThreatType;

import java.util.Set;

public record ValidationResult(
        boolean ok,
        ValidationFailure failure,
        Set<ThreatType> threatTypes,
        String reason
) {

    private static final ValidationResult OK = new ValidationResult(true, null, Set.of(), null);

    public ValidationResult {
        threatTypes = threatTypes == null ? Set.of() : Set.copyOf(threatTypes);
    }

    public static ValidationResult valid() {
        return OK;
    }

    public static ValidationResult fail(ValidationFailure failure, String reason) {
        return new ValidationResult(false, failure, Set.of(), reason);
    }

    public static ValidationResult malicious(Set<ThreatType> threatTypes) {
        return new ValidationResult(false, ValidationFailure.MALICIOUS_CONTENT, threatTypes,
                "Input contains potentially malicious content");
    }
}
