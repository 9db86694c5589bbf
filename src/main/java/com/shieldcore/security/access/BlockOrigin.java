package com.shieldcore.security.access;

public enum BlockOrigin {
    MANUAL,
    AUTOMATIC
}
