package com.containermgmt.querymonitor.kill;

import com.containermgmt.querymonitor.MutableClock;
import com.containermgmt.querymonitor.audit.OperationLogService;
import com.containermgmt.querymonitor.audit.OperationType;
import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.connection.DatabaseHandle;
import com.containermgmt.querymonitor.connection.SqlExecutor;
import com.containermgmt.querymonitor.dto.ContinuousKillStatus;
import com.containermgmt.querymonitor.dto.QuerySample;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.exception.KillException;
import com.containermgmt.querymonitor.normalizer.QueryNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
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

class ContinuousKillServiceTest {

    private static final long DB = 4;
    private static final long USER = 2;
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static final String TARGET = "SELECT pg_sleep(60) FROM reports WHERE tenant_id = 17";
    private static final String TARGET_SIGNATURE = "select pg_sleep(?) from reports where tenant_id = ?";

    private RunningQueryService runningQueryService;
    private OperationLogService operationLog;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private SqlExecutor executor;
    private ContinuousKillService service;

    @BeforeEach
    void setUp() {
        runningQueryService = mock(RunningQueryService.class);
        operationLog = mock(OperationLogService.class);
        scheduler = mock(ScheduledExecutorService.class);
        future = mock(ScheduledFuture.class);
        executor = mock(SqlExecutor.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
        when(runningQueryService.open(DB)).thenAnswer(inv -> new DatabaseHandle(DB, executor, null));

        service = new ContinuousKillService(runningQueryService, new QueryNormalizer(), operationLog,
            new QueryMonitorProperties(), new MutableClock(T0), scheduler);
    }

    @Test
    void blankTargetIsRejected() {
        assertThatThrownBy(() -> service.setContinuousKillTarget(DB, "", USER))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.setContinuousKillTarget(DB, "   ", USER))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.setContinuousKillTarget(DB, null, USER))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(service.getContinuousKillStatus(DB).isActive()).isFalse();
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
    }

    @Test
    void settingATargetStartsTheLoop() {
        ContinuousKillStatus status = service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);

        assertThat(status.isActive()).isTrue();
        assertThat(status.getTarget()).isEqualTo(TARGET_SIGNATURE);
        assertThat(status.getKillCount()).isZero();
        assertThat(status.getStartedAt()).isEqualTo(T0);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(2000L), eq(TimeUnit.MILLISECONDS));
        verify(operationLog).record(eq(DB), eq(USER), eq(OperationType.CONTINUOUS_KILL_START), eq(true), anyMap());
    }

    @Test
    void tickKillsEveryMatchEvenWhenOneKillFails() {
        service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);
        when(runningQueryService.getRunningQueries(executor)).thenReturn(List.of(
            sample(101, "SELECT pg_sleep(60) FROM reports WHERE tenant_id = 17"),
            sample(102, "select pg_sleep(5) from reports where tenant_id = 99"),
            sample(103, "SELECT * FROM users")));
        doThrow(new KillException(101, "Backend 101 was not terminated"))
            .when(runningQueryService).killQuery(executor, 101);

        int killed = service.tick(service.getLoop(DB));

        assertThat(killed).isEqualTo(1);
        verify(runningQueryService).killQuery(executor, 101);
        verify(runningQueryService).killQuery(executor, 102);
        verify(runningQueryService, never()).killQuery(executor, 103);
        assertThat(service.getContinuousKillStatus(DB).getKillCount()).isEqualTo(1);
        verify(operationLog, times(1))
            .record(eq(DB), eq(USER), eq(OperationType.CONTINUOUS_KILL_EXECUTION), eq(true), anyMap());
        verify(executor).close();
    }

    @Test
    void killCountAccumulatesAcrossTicks() {
        service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);
        when(runningQueryService.getRunningQueries(executor)).thenReturn(List.of(sample(7, TARGET)));

        service.tick(service.getLoop(DB));
        service.tick(service.getLoop(DB));

        assertThat(service.getContinuousKillStatus(DB).getKillCount()).isEqualTo(2);
    }

    @Test
    void clearingStopsTheLoopAndResetsTheCounter() {
        service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);
        ContinuousKillService.KillLoop loop = service.getLoop(DB);
        when(runningQueryService.getRunningQueries(executor)).thenReturn(List.of(sample(7, TARGET)));
        service.tick(loop);

        ContinuousKillStatus cleared = service.clearContinuousKillTarget(DB, USER);

        assertThat(cleared.isActive()).isFalse();
        assertThat(cleared.getTarget()).isNull();
        assertThat(cleared.getKillCount()).isZero();
        assertThat(service.getContinuousKillStatus(DB).isActive()).isFalse();
        verify(future).cancel(false);
        verify(operationLog).record(eq(DB), eq(USER), eq(OperationType.CONTINUOUS_KILL_STOP), eq(true), anyMap());

        // a tick that was already due when the loop was cancelled does nothing
        assertThat(service.tick(loop)).isZero();
        verify(runningQueryService, times(1)).killQuery(any(SqlExecutor.class), anyInt());
    }

    @Test
    void newTargetReplacesThePreviousLoop() {
        service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);
        ContinuousKillService.KillLoop first = service.getLoop(DB);

        ContinuousKillStatus status = service.setContinuousKillTarget(DB, "delete from audit where id = ?", USER);

        assertThat(first.active).isFalse();
        assertThat(status.getTarget()).isEqualTo("delete from audit where id = ?");
        assertThat(service.getLoop(DB)).isNotSameAs(first);
        verify(future).cancel(false);
    }

    @Test
    void signatureEndingInASpaceMatchesItsOwnQuery() {
        String query = "SELECT " + "x".repeat(72) + " FROM t WHERE id = $1";
        String signature = service.signature(query);
        assertThat(signature).hasSize(80).endsWith(" ");

        ContinuousKillStatus status = service.setContinuousKillTarget(DB, signature, USER);
        when(runningQueryService.getRunningQueries(executor)).thenReturn(List.of(sample(55, query)));

        assertThat(status.getTarget()).isEqualTo(signature);
        assertThat(service.tick(service.getLoop(DB))).isEqualTo(1);
        verify(runningQueryService).killQuery(executor, 55);
    }

    @Test
    void signatureIsCutToTheConfiguredLength() {
        String longSignature = "select " + "y".repeat(100);

        ContinuousKillStatus status = service.setContinuousKillTarget(DB, longSignature, USER);

        assertThat(status.getTarget()).hasSize(80).isEqualTo(longSignature.substring(0, 80));
    }

    @Test
    void signatureOfRawSqlIsTheTruncatedNormalizedText() {
        assertThat(service.signature(TARGET)).isEqualTo(TARGET_SIGNATURE);
    }

    @Test
    void unreachableDatabaseSkipsThePass() {
        service.setContinuousKillTarget(DB, TARGET_SIGNATURE, USER);
        when(runningQueryService.open(DB)).thenThrow(new ConnectivityException("SSH tunnel down"));

        assertThat(service.tick(service.getLoop(DB))).isZero();
        assertThat(service.getContinuousKillStatus(DB).isActive()).isTrue();
    }

    @Test
    void clearingWithoutATargetIsANoOp() {
        ContinuousKillStatus status = service.clearContinuousKillTarget(DB, USER);

        assertThat(status.isActive()).isFalse();
        verify(operationLog, never()).record(anyLong(), anyLong(), any(), anyBoolean(), anyMap());
    }

    private static QuerySample sample(int pid, String query) {
        return QuerySample.builder().pid(pid).state("active").query(query).build();
    }
}
