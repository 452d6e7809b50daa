package com.containermgmt.querymonitor.session;

import com.containermgmt.querymonitor.MutableClock;
import com.containermgmt.querymonitor.audit.OperationLogService;
import com.containermgmt.querymonitor.audit.OperationType;
import com.containermgmt.querymonitor.collector.QueryCollector;
import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.dto.CollectionResult;
import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.SessionStatus;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.exception.ExtensionMissingException;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import com.containermgmt.querymonitor.store.InMemoryMonitoringSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitoringSessionManagerTest {

    private static final long DB = 12;
    private static final long USER = 5;
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final QueryMonitorProperties properties = new QueryMonitorProperties();

    private InMemoryMonitoringSessionStore store;
    private QueryCollector collector;
    private OperationLogService operationLog;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private MonitoringSessionManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitoringSessionStore();
        collector = mock(QueryCollector.class);
        operationLog = mock(OperationLogService.class);
        scheduler = mock(ScheduledExecutorService.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
        when(collector.runCycle(anyLong())).thenReturn(CollectionResult.builder().databaseId(DB).build());

        manager = new MonitoringSessionManager(store, collector, operationLog, properties, clock, scheduler);
    }

    @Test
    void startCreatesARunningSessionAndSchedulesIt() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, null);

        assertThat(session.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(session.getDatabaseId()).isEqualTo(DB);
        assertThat(session.getUserId()).isEqualTo(USER);
        assertThat(session.getPollingIntervalSeconds()).isEqualTo(30);
        assertThat(session.getStartedAt()).isEqualTo(T0);
        verify(collector).verify(DB);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(30L), eq(TimeUnit.SECONDS));
        verify(operationLog).record(eq(DB), eq(USER), eq(OperationType.MONITORING_START), eq(true), anyMap());
        assertThat(manager.getActiveWorkerCount()).isEqualTo(1);
    }

    @Test
    void defaultIntervalIsUsedWhenNoneGiven() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, null, null);

        assertThat(session.getPollingIntervalSeconds()).isEqualTo(60);
    }

    @Test
    void secondStartReturnsTheRunningSession() {
        MonitoringSessionInfo first = manager.startMonitoring(DB, USER, 30, null);
        MonitoringSessionInfo second = manager.startMonitoring(DB, 99, 10, null);

        assertThat(second.getId()).isEqualTo(first.getId());
        verify(collector, times(1)).verify(DB);
        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
        assertThat(store.findAllRunning()).hasSize(1);
    }

    @Test
    void unreachableDatabaseCreatesNoSession() {
        doThrow(new ConnectivityException("Cannot connect to database 12")).when(collector).verify(DB);

        assertThatThrownBy(() -> manager.startMonitoring(DB, USER, 30, null))
            .isInstanceOf(ConnectivityException.class);

        assertThat(store.findRunning(DB)).isEmpty();
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
    }

    @Test
    void missingExtensionIsSurfaced() {
        doThrow(new ExtensionMissingException("pg_stat_statements")).when(collector).verify(DB);

        assertThatThrownBy(() -> manager.startMonitoring(DB, USER, 30, null))
            .isInstanceOf(ExtensionMissingException.class);
        assertThat(store.findRunning(DB)).isEmpty();
    }

    @Test
    void endTimeInThePastIsRejected() {
        assertThatThrownBy(() -> manager.startMonitoring(DB, USER, 30, T0.minusSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.startMonitoring(DB, USER, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stopMarksTheSessionStoppedAndCancelsItsLoop() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, null);
        clock.advance(Duration.ofMinutes(5));

        MonitoringSessionInfo stopped = manager.stopMonitoring(session.getId(), USER);

        assertThat(stopped.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(stopped.getStoppedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(manager.getActiveSession(DB)).isEmpty();
        assertThat(manager.getActiveWorkerCount()).isZero();
        verify(future).cancel(false);
        verify(operationLog).record(eq(DB), eq(USER), eq(OperationType.MONITORING_STOP), eq(true), anyMap());
    }

    @Test
    void stoppingTwiceKeepsTheFirstStop() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, null);
        MonitoringSessionInfo first = manager.stopMonitoring(session.getId(), USER);
        clock.advance(Duration.ofMinutes(1));

        MonitoringSessionInfo second = manager.stopMonitoring(session.getId(), USER);

        assertThat(second.getStoppedAt()).isEqualTo(first.getStoppedAt());
        verify(operationLog, times(1)).record(anyLong(), anyLong(), eq(OperationType.MONITORING_STOP), anyBoolean(), anyMap());
    }

    @Test
    void stopPastTheEndTimeCompletesTheSession() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, T0.plus(Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(15));

        MonitoringSessionInfo stopped = manager.stopMonitoring(session.getId(), USER);

        assertThat(stopped.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(stopped.getStoppedAt()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
        assertThat(manager.getActiveWorkerCount()).isZero();
        verify(future).cancel(false);
        verify(operationLog, never()).record(anyLong(), anyLong(), eq(OperationType.MONITORING_STOP), anyBoolean(), anyMap());
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> manager.stopMonitoring(404, USER)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> manager.getSessionStatus(404)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void tickRunsOneCollectionCycle() {
        manager.startMonitoring(DB, USER, 30, null);

        scheduledWorker().run();

        verify(collector).runCycle(DB);
    }

    @Test
    void tickAfterStopDoesNotCollect() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, null);
        Runnable worker = scheduledWorker();
        store.finish(session.getId(), SessionStatus.STOPPED, T0);

        worker.run();

        verify(collector, never()).runCycle(anyLong());
        verify(future).cancel(false);
    }

    @Test
    void tickPastTheEndTimeCompletesTheSession() {
        MonitoringSessionInfo session = manager.startMonitoring(DB, USER, 30, T0.plus(Duration.ofHours(1)));
        Runnable worker = scheduledWorker();
        clock.advance(Duration.ofHours(1));

        worker.run();

        assertThat(manager.getSessionStatus(session.getId()).getStatus()).isEqualTo(SessionStatus.COMPLETED);
        verify(collector, never()).runCycle(anyLong());
        verify(future).cancel(false);
    }

    @Test
    void failedCycleKeepsTheLoopAlive() {
        manager.startMonitoring(DB, USER, 30, null);
        Runnable worker = scheduledWorker();
        when(collector.runCycle(DB)).thenThrow(new ConnectivityException("SSH tunnel down"));

        worker.run();
        worker.run();

        verify(collector, times(2)).runCycle(DB);
        verify(future, never()).cancel(anyBoolean());
    }

    @Test
    void startAfterExpiryCompletesTheOldSessionAndCreatesANewOne() {
        MonitoringSessionInfo old = manager.startMonitoring(DB, USER, 30, T0.plus(Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(20));

        MonitoringSessionInfo fresh = manager.startMonitoring(DB, USER, 30, null);

        assertThat(fresh.getId()).isNotEqualTo(old.getId());
        assertThat(manager.getSessionStatus(old.getId()).getStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void resumeSchedulesRunningSessionsAndCompletesExpiredOnes() {
        MonitoringSessionInfo live = store.put(MonitoringSessionInfo.builder()
            .databaseId(1).userId(USER).status(SessionStatus.RUNNING).pollingIntervalSeconds(15)
            .startedAt(T0.minusSeconds(600)).build());
        MonitoringSessionInfo expired = store.put(MonitoringSessionInfo.builder()
            .databaseId(2).userId(USER).status(SessionStatus.RUNNING).pollingIntervalSeconds(15)
            .startedAt(T0.minusSeconds(600)).scheduledEndTime(T0.minusSeconds(60)).build());

        manager.resumeRunningSessions();

        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(15L), eq(TimeUnit.SECONDS));
        assertThat(manager.getSessionStatus(live.getId()).getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(manager.getSessionStatus(expired.getId()).getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(manager.getActiveWorkerCount()).isEqualTo(1);
    }

    @Test
    void resumeCanBeDisabled() {
        properties.getMonitoring().setResumeOnStartup(false);
        store.put(MonitoringSessionInfo.builder()
            .databaseId(1).userId(USER).status(SessionStatus.RUNNING).pollingIntervalSeconds(15)
            .startedAt(T0).build());

        manager.resumeRunningSessions();

        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
    }

    private Runnable scheduledWorker() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(captor.capture(), anyLong(), anyLong(), any());
        return captor.getValue();
    }
}
