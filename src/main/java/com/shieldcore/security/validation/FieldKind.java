package com.shieldcore.security.validation;

public enum FieldKind {
    GENERAL,
    PROMPT,
    FILENAME,
    URL,
    API_KEY
}
