package com.containermgmt.querymonitor.session;

import com.containermgmt.querymonitor.collector.QueryCollector;
import com.containermgmt.querymonitor.dto.CollectionResult;
import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.SessionStatus;
import com.containermgmt.querymonitor.store.MonitoringSessionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * One tick of a monitoring session. The session row is re-read on every
 * tick, so a stop written by another request or process ends the loop on
 * its next iteration.
 */
@Slf4j
class SessionWorker implements Runnable {

    private final long sessionId;
    private final long databaseId;
    private final MonitoringSessionStore store;
    private final QueryCollector collector;
    private final Clock clock;
    private final Consumer<SessionWorker> onFinished;

    private ScheduledFuture<?> future;
    private boolean finished;

    SessionWorker(long sessionId, long databaseId, MonitoringSessionStore store, QueryCollector collector,
                  Clock clock, Consumer<SessionWorker> onFinished) {
        this.sessionId = sessionId;
        this.databaseId = databaseId;
        this.store = store;
        this.collector = collector;
        this.clock = clock;
        this.onFinished = onFinished;
    }

    long getSessionId() {
        return sessionId;
    }

    synchronized boolean isFinished() {
        return finished;
    }

    synchronized void attach(ScheduledFuture<?> scheduled) {
        this.future = scheduled;
        if (finished) {
            scheduled.cancel(false);
        }
    }

    /**
     * Stops further ticks. A tick already running completes.
     */
    void finish() {
        synchronized (this) {
            if (finished) {
                return;
            }
            finished = true;
            if (future != null) {
                future.cancel(false);
            }
        }
        onFinished.accept(this);
    }

    @Override
    public void run() {
        if (isFinished()) {
            return;
        }

        try {
            Optional<MonitoringSessionInfo> current = store.findById(sessionId);
            if (current.isEmpty() || !current.get().isRunning()) {
                log.info("Monitoring session {} is no longer running, stopping its loop", sessionId);
                finish();
                return;
            }

            Instant now = clock.instant();
            if (current.get().isExpired(now)) {
                store.finish(sessionId, SessionStatus.COMPLETED, now);
                log.info("Monitoring session {} reached its scheduled end, marked completed", sessionId);
                finish();
                return;
            }

            CollectionResult result = collector.runCycle(databaseId);
            log.debug("Session {} cycle: {} stored, {} skipped", sessionId, result.getRowsStored(), result.getRowsSkipped());
        } catch (RuntimeException e) {
            // the next tick retries
            log.error("Monitoring cycle failed for session {} (database {}): {}",
                sessionId, databaseId, e.getMessage());
        }
    }
}
