package com.shieldcore.security.audit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public class AuditRetentionSweeper implements AutoCloseable {

    private final AuditLog auditLog;
    private final Duration interval;
    private ScheduledExecutorService executor;

    public AuditRetentionSweeper(AuditLog auditLog, Duration interval) {
        this.auditLog = auditLog;
        this.interval = interval;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "shieldcore-audit-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = interval.toMillis();
        executor.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.debug("audit retention sweep scheduled every {}", interval);
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    void sweep() {
        try {
            auditLog.prune();
        } catch (RuntimeException ex) {
            log.warn("audit retention sweep failed: {}", ex.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
    }
}
