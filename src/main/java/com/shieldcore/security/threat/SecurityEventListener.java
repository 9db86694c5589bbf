package com.shieldcore.security.threat;

@FunctionalInterface
public interface SecurityEventListener {
    void onEvent(SecurityEvent event);
}
