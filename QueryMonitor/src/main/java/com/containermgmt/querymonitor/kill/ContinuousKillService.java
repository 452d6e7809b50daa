package com.containermgmt.querymonitor.kill;

import com.containermgmt.querymonitor.audit.OperationLogService;
import com.containermgmt.querymonitor.audit.OperationType;
import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.connection.DatabaseHandle;
import com.containermgmt.querymonitor.dto.ContinuousKillStatus;
import com.containermgmt.querymonitor.dto.QuerySample;
import com.containermgmt.querymonitor.exception.KillException;
import com.containermgmt.querymonitor.normalizer.QueryNormalizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Repeatedly terminates every running query whose signature matches a target.
 *
 * One target per database. Every tick takes a fresh pg_stat_activity snapshot
 * and kills each matching backend; a failed kill is logged and the remaining
 * matches are still attempted.
 *
 * Backends are killed by pid. If a matching query finishes between the
 * snapshot and the kill and the pid is reused in that window, an unrelated
 * backend is terminated. This is not guarded against.
 */
@Slf4j
@Service
public class ContinuousKillService {

    private final RunningQueryService runningQueryService;
    private final QueryNormalizer normalizer;
    private final OperationLogService operationLog;
    private final QueryMonitorProperties.ContinuousKill killProps;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Map<Long, KillLoop> loops = new ConcurrentHashMap<>();

    @Autowired
    public ContinuousKillService(RunningQueryService runningQueryService,
                                 QueryNormalizer normalizer,
                                 OperationLogService operationLog,
                                 QueryMonitorProperties properties,
                                 Clock clock) {
        this(runningQueryService, normalizer, operationLog, properties, clock, newScheduler());
    }

    ContinuousKillService(RunningQueryService runningQueryService,
                          QueryNormalizer normalizer,
                          OperationLogService operationLog,
                          QueryMonitorProperties properties,
                          Clock clock,
                          ScheduledExecutorService scheduler) {
        this.runningQueryService = runningQueryService;
        this.normalizer = normalizer;
        this.operationLog = operationLog;
        this.killProps = properties.getContinuousKill();
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Sets (or replaces) the target of {@code databaseId} and starts its loop.
     * The signature is kept as given, cut to the configured length; use
     * {@link #signature(String)} to derive one from raw SQL.
     *
     * @throws IllegalArgumentException for a blank signature
     */
    public synchronized ContinuousKillStatus setContinuousKillTarget(long databaseId, String signature, long userId) {
        if (StringUtils.isBlank(signature)) {
            throw new IllegalArgumentException("Continuous kill target must not be empty");
        }
        String target = StringUtils.left(signature, killProps.getSignatureLength());

        KillLoop previous = loops.remove(databaseId);
        if (previous != null) {
            previous.cancel();
        }

        KillLoop loop = new KillLoop(databaseId, userId, target, clock.instant());
        loops.put(databaseId, loop);
        loop.future = scheduler.scheduleWithFixedDelay(
            () -> tick(loop), 0, killProps.getIntervalMs(), TimeUnit.MILLISECONDS);

        log.info("Continuous kill started on database {} for: {}", databaseId, target);
        operationLog.record(databaseId, userId, OperationType.CONTINUOUS_KILL_START, true,
            Map.of("target", target));
        return loop.toStatus();
    }

    /**
     * Stops the loop of {@code databaseId} and resets its target and counter.
     */
    public synchronized ContinuousKillStatus clearContinuousKillTarget(long databaseId, long userId) {
        KillLoop loop = loops.remove(databaseId);
        if (loop == null) {
            return ContinuousKillStatus.inactive(databaseId);
        }
        loop.cancel();

        log.info("Continuous kill stopped on database {} after {} kill(s)", databaseId, loop.killCount.get());
        operationLog.record(databaseId, userId, OperationType.CONTINUOUS_KILL_STOP, true,
            Map.of("target", loop.target, "killCount", loop.killCount.get()));
        return ContinuousKillStatus.inactive(databaseId);
    }

    public ContinuousKillStatus getContinuousKillStatus(long databaseId) {
        KillLoop loop = loops.get(databaseId);
        return loop != null ? loop.toStatus() : ContinuousKillStatus.inactive(databaseId);
    }

    /**
     * Signature of a raw query, as compared against the target on every tick.
     */
    public String signature(String query) {
        return normalizer.signature(query, killProps.getSignatureLength());
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            loops.values().forEach(KillLoop::cancel);
            loops.clear();
        }
        scheduler.shutdownNow();
        log.info("ContinuousKillService stopped");
    }

    /**
     * One pass: snapshot, match, kill.
     *
     * @return the number of backends terminated in this pass
     */
    int tick(KillLoop loop) {
        if (!loop.active) {
            return 0;
        }

        int killed = 0;
        try (DatabaseHandle handle = runningQueryService.open(loop.databaseId)) {
            List<QuerySample> running = runningQueryService.getRunningQueries(handle.getExecutor());
            for (QuerySample sample : running) {
                if (!loop.active) {
                    break;
                }
                if (!loop.target.equals(signature(sample.getQuery()))) {
                    continue;
                }
                try {
                    runningQueryService.killQuery(handle.getExecutor(), sample.getPid());
                    killed++;
                    loop.killCount.incrementAndGet();
                    log.info("Continuous kill terminated backend {} on database {}", sample.getPid(), loop.databaseId);
                    operationLog.record(loop.databaseId, loop.userId, OperationType.CONTINUOUS_KILL_EXECUTION, true,
                        Map.of("pid", sample.getPid(), "target", loop.target));
                } catch (KillException e) {
                    log.warn("Continuous kill could not terminate backend {} on database {}: {}",
                        e.getPid(), loop.databaseId, e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.error("Continuous kill pass failed on database {}: {}", loop.databaseId, e.getMessage());
        }
        return killed;
    }

    /**
     * Loop currently registered for {@code databaseId}, null when none.
     */
    KillLoop getLoop(long databaseId) {
        return loops.get(databaseId);
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "continuous-kill-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static final class KillLoop {

        final long databaseId;
        final long userId;
        final String target;
        final Instant startedAt;
        final AtomicLong killCount = new AtomicLong();

        volatile boolean active = true;
        volatile ScheduledFuture<?> future;

        KillLoop(long databaseId, long userId, String target, Instant startedAt) {
            this.databaseId = databaseId;
            this.userId = userId;
            this.target = target;
            this.startedAt = startedAt;
        }

        void cancel() {
            active = false;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        ContinuousKillStatus toStatus() {
            return ContinuousKillStatus.builder()
                .databaseId(databaseId)
                .active(active)
                .target(target)
                .killCount(killCount.get())
                .startedAt(startedAt)
                .build();
        }
    }
}
