package com.shieldcore.security.validation;

public enum ValidationFailure {
    LENGTH_EXCEEDED,
    MALICIOUS_CONTENT,
    PATH_TRAVERSAL,
    DOMAIN_NOT_ALLOWED,
    INVALID_FORMAT,
    REVOKED_CREDENTIAL
}
