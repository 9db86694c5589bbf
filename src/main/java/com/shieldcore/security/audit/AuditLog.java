package com.shieldcore.security.audit;

import com.shieldcore.security.threat.SecurityEvent;
import com.shieldcore.security.threat.SecurityLevel;
import com.shieldcore.security.threat.ThreatType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Slf4j
public class AuditLog {

    static final String CRITICAL_PRESENT = "CRITICAL security events detected - immediate attention required";
    static final String HIGH_VOLUME = "High number of HIGH severity events - review security configuration";
    static final String DOS_VOLUME = "Multiple denial-of-service attempts detected - consider stricter rate limiting";
    static final String INJECTION_SEEN = "Injection attempts detected - review input validation";
    static final String ANOMALY_SEEN = "Anomalous behavior detected - review the affected identifiers";
    static final String TRUNCATED = "Audit log limits reached - counts cover only the most recent events";
    static final String ALL_CLEAR = "No significant security issues detected";

    private final Clock clock;
    private final AuditPolicy policy;
    private final ConcurrentLinkedDeque<SecurityEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final ReentrantLock writeLock = new ReentrantLock();
    private Instant lastTimestamp = Instant.EPOCH;
    private volatile Instant evictedThrough;

    public AuditLog(Clock clock, AuditPolicy policy) {
        this.clock = clock;
        this.policy = policy;
    }

    /**
     * Appends an event and returns the stored instance.
     */
    public SecurityEvent record(SecurityEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        writeLock.lock();
        try {
            SecurityEvent stored = event.timestamp().isBefore(lastTimestamp)
                    ? event.withTimestamp(lastTimestamp)
                    : event;
            lastTimestamp = stored.timestamp();
            events.addLast(stored);
            size.incrementAndGet();
            while (size.get() > policy.maxEvents()) {
                SecurityEvent evicted = events.pollFirst();
                size.decrementAndGet();
                evictedThrough = evicted.timestamp();
            }
            return stored;
        } finally {
            writeLock.unlock();
        }
    }

    public SecurityReport report(Duration period) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(period);
        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> bySource = new TreeMap<>();
        long total = 0;
        boolean truncated = false;
        Iterator<SecurityEvent> iterator = events.descendingIterator();
        while (iterator.hasNext()) {
            SecurityEvent event = iterator.next();
            if (event.timestamp().isBefore(cutoff)) {
                break;
            }
            if (total == policy.maxScan()) {
                truncated = true;
                break;
            }
            total++;
            byType.merge(event.threatType().code(), 1L, Long::sum);
            bySeverity.merge(event.severity().code(), 1L, Long::sum);
            bySource.merge(event.sourceComponent(), 1L, Long::sum);
        }
        Instant evicted = evictedThrough;
        if (evicted != null && !evicted.isBefore(cutoff)) {
            truncated = true;
        }
        if (truncated) {
            log.debug("security report for the last {} covers only the newest {} events", period, total);
        }
        return SecurityReport.builder()
                .reportTimestamp(now)
                .periodHours(period.toHours())
                .totalEvents(total)
                .truncated(truncated)
                .eventCounts(byType)
                .severityCounts(bySeverity)
                .sourceCounts(bySource)
                .recommendations(recommend(byType, bySeverity, truncated))
                .build();
    }

    public Stream<SecurityEvent> search(Predicate<SecurityEvent> predicate) {
        return newestFirst().filter(predicate);
    }

    public Stream<SecurityEvent> search(EventQuery query) {
        Stream<SecurityEvent> stream = newestFirst();
        if (query.since() != null) {
            stream = stream.takeWhile(event -> !event.timestamp().isBefore(query.since()));
        }
        stream = stream.filter(query);
        if (query.limit() != null && query.limit() >= 0) {
            stream = stream.limit(query.limit());
        }
        return stream;
    }

    /**
     * Drops events older than the retention window, then any events still beyond the size cap.
     *
     * @return number of events removed
     */
    public int prune() {
        Instant cutoff = clock.instant().minus(policy.retention());
        int removed = 0;
        writeLock.lock();
        try {
            SecurityEvent head = events.peekFirst();
            while (head != null && head.timestamp().isBefore(cutoff)) {
                events.pollFirst();
                size.decrementAndGet();
                removed++;
                head = events.peekFirst();
            }
            while (size.get() > policy.maxEvents()) {
                SecurityEvent evicted = events.pollFirst();
                if (evicted == null) {
                    break;
                }
                size.decrementAndGet();
                evictedThrough = evicted.timestamp();
                removed++;
            }
        } finally {
            writeLock.unlock();
        }
        if (removed > 0) {
            log.debug("audit log pruned {} events, {} remain", removed, size.get());
        }
        return removed;
    }

    public void clear() {
        writeLock.lock();
        try {
            events.clear();
            size.set(0);
            evictedThrough = null;
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return size.get();
    }

    public AuditPolicy policy() {
        return policy;
    }

    private Stream<SecurityEvent> newestFirst() {
        Iterator<SecurityEvent> iterator = events.descendingIterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .limit(policy.maxScan());
    }

    private List<String> recommend(Map<String, Long> byType, Map<String, Long> bySeverity, boolean truncated) {
        List<String> recommendations = new ArrayList<>();
        if (bySeverity.getOrDefault(SecurityLevel.CRITICAL.code(), 0L) > 0) {
            recommendations.add(CRITICAL_PRESENT);
        }
        if (bySeverity.getOrDefault(SecurityLevel.HIGH.code(), 0L) > policy.highSeverityThreshold()) {
            recommendations.add(HIGH_VOLUME);
        }
        if (byType.getOrDefault(ThreatType.DENIAL_OF_SERVICE.code(), 0L) > policy.denialOfServiceThreshold()) {
            recommendations.add(DOS_VOLUME);
        }
        long injections = 0;
        for (ThreatType type : ThreatType.values()) {
            if (type.isInjection()) {
                injections += byType.getOrDefault(type.code(), 0L);
            }
        }
        if (injections > 0) {
            recommendations.add(INJECTION_SEEN);
        }
        if (byType.getOrDefault(ThreatType.ANOMALOUS_BEHAVIOR.code(), 0L) > 0) {
            recommendations.add(ANOMALY_SEEN);
        }
        if (truncated) {
            recommendations.add(TRUNCATED);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(ALL_CLEAR);
        }
        return recommendations;
    }
}
