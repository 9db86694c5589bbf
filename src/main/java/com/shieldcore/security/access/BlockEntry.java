package com.shieldcore.security.access;

import java.time.Instant;

public record BlockEntry(
        String identifier,
        String reason,
        Instant createdAt,
        Instant expiresAt,
        BlockOrigin origin
) {

    public BlockEntry {
        if (identifier == null || createdAt == null || expiresAt == null || origin == null) {
            throw new IllegalArgumentException("identifier, timestamps and origin are required");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        reason = reason == null ? "" : reason;
    }

    public boolean isActive(Instant now) {
        return expiresAt.isAfter(now);
    }

    /**
     * Merges a repeated block into this entry; the later expiry wins and the newest reason is kept.
     */
    BlockEntry extend(String newReason, Instant newExpiresAt) {
        Instant expiry = newExpiresAt.isAfter(expiresAt) ? newExpiresAt : expiresAt;
        String mergedReason = newReason == null || newReason.isBlank() ? reason : newReason;
        return new BlockEntry(identifier, mergedReason, createdAt, expiry, origin);
    }
}
