package com.shieldcore.security.access;

import com.shieldcore.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Slf4j
public class AccessController {

    public static final Duration DEFAULT_MANUAL_BLOCK = Duration.ofHours(24);

    private static final Pattern KEY_DIGEST = Pattern.compile("[0-9a-fA-F]{64}");

    private final Clock clock;
    private final Set<String> allowedDomains = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, Map<BlockOrigin, BlockEntry>> blocks = new ConcurrentHashMap<>();
    private final Set<String> revokedKeyDigests = ConcurrentHashMap.newKeySet();

    public AccessController(Clock clock, Collection<String> initialDomains) {
        this.clock = clock;
        if (initialDomains != null) {
            initialDomains.forEach(this::addDomain);
        }
    }

    public boolean isDomainAllowed(String domain) {
        String normalized = normalizeDomain(domain);
        return normalized != null && allowedDomains.contains(normalized);
    }

    public boolean addDomain(String domain) {
        String normalized = normalizeDomain(domain);
        return normalized != null && allowedDomains.add(normalized);
    }

    public boolean removeDomain(String domain) {
        String normalized = normalizeDomain(domain);
        return normalized != null && allowedDomains.remove(normalized);
    }

    public Set<String> allowedDomains() {
        return Collections.unmodifiableSet(new TreeSet<>(allowedDomains));
    }

    public boolean revokeApiKey(String apiKey) {
        return apiKey != null && !apiKey.isEmpty() && revokedKeyDigests.add(CryptoUtils.sha256Hex(apiKey));
    }

    /**
     * Revokes a key known only by its SHA-256 hex digest.
     */
    public boolean revokeApiKeyDigest(String sha256Hex) {
        if (sha256Hex == null || !KEY_DIGEST.matcher(sha256Hex.trim()).matches()) {
            throw new IllegalArgumentException("not a SHA-256 hex digest");
        }
        return revokedKeyDigests.add(sha256Hex.trim().toLowerCase(Locale.ROOT));
    }

    public boolean reinstateApiKey(String apiKey) {
        return apiKey != null && !apiKey.isEmpty() && revokedKeyDigests.remove(CryptoUtils.sha256Hex(apiKey));
    }

    public boolean isApiKeyRevoked(String apiKey) {
        return apiKey != null && !apiKey.isEmpty() && revokedKeyDigests.contains(CryptoUtils.sha256Hex(apiKey));
    }

    public int revokedApiKeyCount() {
        return revokedKeyDigests.size();
    }

    public BlockEntry block(String identifier, String reason, Duration duration) {
        Duration effective = duration == null || duration.isZero() || duration.isNegative()
                ? DEFAULT_MANUAL_BLOCK
                : duration;
        BlockEntry entry = put(identifier, reason, effective, BlockOrigin.MANUAL);
        log.info("identifier blocked manually until {}", entry.expiresAt());
        return entry;
    }

    public BlockEntry blockAutomatically(String identifier, String reason, Duration duration) {
        return put(identifier, reason, duration, BlockOrigin.AUTOMATIC);
    }

    public boolean isBlocked(String identifier) {
        return activeEntry(identifier) != null;
    }

    /**
     * Returns the active entry with the latest expiry, or {@code null}. Expired entries are
     * dropped as a side effect.
     */
    public BlockEntry activeEntry(String identifier) {
        if (identifier == null) {
            return null;
        }
        Instant now = clock.instant();
        Map<BlockOrigin, BlockEntry> current = blocks.computeIfPresent(identifier, (id, entries) -> prune(entries, now));
        if (current == null) {
            return null;
        }
        BlockEntry latest = null;
        for (BlockEntry entry : current.values()) {
            if (latest == null || entry.expiresAt().isAfter(latest.expiresAt())) {
                latest = entry;
            }
        }
        return latest;
    }

    public BlockEntry activeEntry(String identifier, BlockOrigin origin) {
        if (identifier == null) {
            return null;
        }
        Instant now = clock.instant();
        Map<BlockOrigin, BlockEntry> current = blocks.computeIfPresent(identifier, (id, entries) -> prune(entries, now));
        return current == null ? null : current.get(origin);
    }

    public boolean unblock(String identifier) {
        if (identifier == null) {
            return false;
        }
        boolean removed = blocks.remove(identifier) != null;
        if (removed) {
            log.info("identifier unblocked");
        }
        return removed;
    }

    /**
     * Removes only the automatic entry, leaving a manual block in place.
     */
    public void releaseAutomatic(String identifier) {
        if (identifier == null) {
            return;
        }
        blocks.computeIfPresent(identifier, (id, entries) -> {
            if (!entries.containsKey(BlockOrigin.AUTOMATIC)) {
                return entries;
            }
            EnumMap<BlockOrigin, BlockEntry> copy = new EnumMap<>(BlockOrigin.class);
            copy.putAll(entries);
            copy.remove(BlockOrigin.AUTOMATIC);
            return copy.isEmpty() ? null : Collections.unmodifiableMap(copy);
        });
    }

    public List<BlockEntry> activeBlocks() {
        Instant now = clock.instant();
        return blocks.values().stream()
                .flatMap(entries -> entries.values().stream())
                .filter(entry -> entry.isActive(now))
                .toList();
    }

    public List<String> blockedIdentifiers() {
        return activeBlocks().stream()
                .map(BlockEntry::identifier)
                .distinct()
                .sorted()
                .toList();
    }

    private BlockEntry put(String identifier, String reason, Duration duration, BlockOrigin origin) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(duration);
        Map<BlockOrigin, BlockEntry> updated = blocks.compute(identifier, (id, entries) -> {
            EnumMap<BlockOrigin, BlockEntry> copy = new EnumMap<>(BlockOrigin.class);
            Map<BlockOrigin, BlockEntry> live = entries == null ? null : prune(entries, now);
            if (live != null) {
                copy.putAll(live);
            }
            BlockEntry existing = copy.get(origin);
            copy.put(origin, existing == null
                    ? new BlockEntry(id, reason, now, expiresAt, origin)
                    : existing.extend(reason, expiresAt));
            return Collections.unmodifiableMap(copy);
        });
        return updated.get(origin);
    }

    private static Map<BlockOrigin, BlockEntry> prune(Map<BlockOrigin, BlockEntry> entries, Instant now) {
        boolean allActive = entries.values().stream().allMatch(entry -> entry.isActive(now));
        if (allActive) {
            return entries;
        }
        EnumMap<BlockOrigin, BlockEntry> copy = new EnumMap<>(BlockOrigin.class);
        entries.forEach((origin, entry) -> {
            if (entry.isActive(now)) {
                copy.put(origin, entry);
            }
        });
        return copy.isEmpty() ? null : Collections.unmodifiableMap(copy);
    }

    private static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }
}
