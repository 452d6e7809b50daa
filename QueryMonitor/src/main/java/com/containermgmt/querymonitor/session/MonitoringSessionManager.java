package com.containermgmt.querymonitor.session;

import com.containermgmt.querymonitor.audit.OperationLogService;
import com.containermgmt.querymonitor.audit.OperationType;
import com.containermgmt.querymonitor.collector.QueryCollector;
import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.SessionStatus;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import com.containermgmt.querymonitor.store.MonitoringSessionStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts, stops and drives monitoring sessions.
 *
 * At most one session runs per database. Start and stop for the same
 * database are serialized by a per-database lock; all sessions share one
 * scheduler and each runs with a fixed delay between cycles.
 */
@Slf4j
@Service
public class MonitoringSessionManager {

    private final MonitoringSessionStore store;
    private final QueryCollector collector;
    private final OperationLogService operationLog;
    private final QueryMonitorProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Map<Long, ReentrantLock> databaseLocks = new ConcurrentHashMap<>();
    private final Map<Long, SessionWorker> workers = new ConcurrentHashMap<>();

    @Autowired
    public MonitoringSessionManager(MonitoringSessionStore store,
                                    QueryCollector collector,
                                    OperationLogService operationLog,
                                    QueryMonitorProperties properties,
                                    Clock clock) {
        this(store, collector, operationLog, properties, clock,
            newScheduler(properties.getMonitoring().getWorkerThreads()));
    }

    MonitoringSessionManager(MonitoringSessionStore store,
                             QueryCollector collector,
                             OperationLogService operationLog,
                             QueryMonitorProperties properties,
                             Clock clock,
                             ScheduledExecutorService scheduler) {
        this.store = store;
        this.collector = collector;
        this.operationLog = operationLog;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Starts monitoring {@code databaseId}, or returns the session already running for it.
     *
     * The database is contacted once before the session is created, so an
     * unreachable database or a missing pg_stat_statements is reported to the
     * caller instead of failing silently in the background.
     *
     * @param pollingIntervalSeconds null for the configured default
     * @param scheduledEndTime null to run until stopped
     */
    public MonitoringSessionInfo startMonitoring(long databaseId, long userId,
                                                 Integer pollingIntervalSeconds, Instant scheduledEndTime) {
        int interval = pollingIntervalSeconds != null
            ? pollingIntervalSeconds
            : properties.getMonitoring().getDefaultPollingIntervalSeconds();
        if (interval < 1) {
            throw new IllegalArgumentException("pollingIntervalSeconds must be at least 1");
        }
        Instant now = clock.instant();
        if (scheduledEndTime != null && !scheduledEndTime.isAfter(now)) {
            throw new IllegalArgumentException("scheduledEndTime must be in the future");
        }

        ReentrantLock lock = lockFor(databaseId);
        lock.lock();
        try {
            Optional<MonitoringSessionInfo> running = store.findRunning(databaseId);
            if (running.isPresent()) {
                MonitoringSessionInfo existing = running.get();
                if (!existing.isExpired(now)) {
                    log.info("Database {} already monitored by session {}", databaseId, existing.getId());
                    ensureScheduled(existing);
                    return existing;
                }
                store.finish(existing.getId(), SessionStatus.COMPLETED, now);
                cancelWorker(existing.getId());
            }

            collector.verify(databaseId);

            MonitoringSessionInfo session = store.create(databaseId, userId, interval, scheduledEndTime, now);
            schedule(session);

            log.info("Started monitoring session {} for database {} (every {}s{})", session.getId(), databaseId,
                interval, scheduledEndTime != null ? ", until " + scheduledEndTime : "");
            operationLog.record(databaseId, userId, OperationType.MONITORING_START, true,
                Map.of("sessionId", session.getId(), "pollingIntervalSeconds", interval));
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops a session. Stopping a session that already ended returns it unchanged.
     */
    public MonitoringSessionInfo stopMonitoring(long sessionId, long userId) {
        MonitoringSessionInfo session = getSessionStatus(sessionId);

        ReentrantLock lock = lockFor(session.getDatabaseId());
        lock.lock();
        try {
            Instant now = clock.instant();
            // a session already past its end time has run its course
            boolean expired = session.isRunning() && session.isExpired(now);
            MonitoringSessionInfo stopped = store.finish(sessionId,
                    expired ? SessionStatus.COMPLETED : SessionStatus.STOPPED, now)
                .orElseThrow(() -> new ResourceNotFoundException("Monitoring session", sessionId));
            cancelWorker(sessionId);

            if (expired) {
                log.info("Monitoring session {} for database {} had already reached its end time, marked completed",
                    sessionId, session.getDatabaseId());
            } else if (session.isRunning()) {
                log.info("Stopped monitoring session {} for database {}", sessionId, session.getDatabaseId());
                operationLog.record(session.getDatabaseId(), userId, OperationType.MONITORING_STOP, true,
                    Map.of("sessionId", sessionId));
            }
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    public MonitoringSessionInfo getSessionStatus(long sessionId) {
        return store.findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Monitoring session", sessionId));
    }

    public Optional<MonitoringSessionInfo> getActiveSession(long databaseId) {
        return store.findRunning(databaseId);
    }

    /**
     * Number of sessions with a live loop in this process.
     */
    public int getActiveWorkerCount() {
        return workers.size();
    }

    /**
     * Picks up sessions left running by a previous process. Expired ones are
     * marked completed instead.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeRunningSessions() {
        if (!properties.getMonitoring().isResumeOnStartup()) {
            log.info("Session resume disabled");
            return;
        }

        List<MonitoringSessionInfo> running;
        try {
            running = store.findAllRunning();
        } catch (RuntimeException e) {
            log.error("Could not load running monitoring sessions: {}", e.getMessage());
            return;
        }

        Instant now = clock.instant();
        int resumed = 0;
        for (MonitoringSessionInfo session : running) {
            ReentrantLock lock = lockFor(session.getDatabaseId());
            lock.lock();
            try {
                if (session.isExpired(now)) {
                    store.finish(session.getId(), SessionStatus.COMPLETED, now);
                    log.info("Session {} expired while the service was down, marked completed", session.getId());
                } else {
                    ensureScheduled(session);
                    resumed++;
                }
            } finally {
                lock.unlock();
            }
        }
        log.info("Resumed {} monitoring session(s)", resumed);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping {} monitoring loop(s)...", workers.size());
        for (SessionWorker worker : new ArrayList<>(workers.values())) {
            worker.finish();
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("MonitoringSessionManager stopped");
    }

    private void ensureScheduled(MonitoringSessionInfo session) {
        SessionWorker worker = workers.get(session.getId());
        if (worker == null || worker.isFinished()) {
            schedule(session);
        }
    }

    private void schedule(MonitoringSessionInfo session) {
        SessionWorker worker = new SessionWorker(session.getId(), session.getDatabaseId(), store, collector,
            clock, finished -> workers.remove(finished.getSessionId(), finished));
        workers.put(session.getId(), worker);
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
            worker, 0, session.getPollingIntervalSeconds(), TimeUnit.SECONDS);
        worker.attach(future);
    }

    private void cancelWorker(long sessionId) {
        SessionWorker worker = workers.get(sessionId);
        if (worker != null) {
            worker.finish();
        }
    }

    private ReentrantLock lockFor(long databaseId) {
        return databaseLocks.computeIfAbsent(databaseId, id -> new ReentrantLock());
    }

    private static ScheduledExecutorService newScheduler(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "monitoring-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
