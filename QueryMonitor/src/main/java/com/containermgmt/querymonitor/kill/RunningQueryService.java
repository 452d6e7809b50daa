package com.containermgmt.querymonitor.kill;

import com.containermgmt.querymonitor.audit.OperationLogService;
import com.containermgmt.querymonitor.audit.OperationType;
import com.containermgmt.querymonitor.connection.ConnectionFactory;
import com.containermgmt.querymonitor.connection.DatabaseHandle;
import com.containermgmt.querymonitor.connection.SqlExecutor;
import com.containermgmt.querymonitor.dto.QuerySample;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.exception.KillException;
import com.containermgmt.querymonitor.registry.DatabaseRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of pg_stat_activity and backend termination on a monitored database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunningQueryService {

    static final String RUNNING_QUERIES_SQL = """
        SELECT pid,
               usename AS username,
               datname AS database,
               state,
               query,
               EXTRACT(EPOCH FROM now() - query_start) AS duration_seconds,
               query_start AS started_at
        FROM pg_stat_activity
        WHERE state != 'idle'
          AND pid != pg_backend_pid()
          AND datname = current_database()
        ORDER BY query_start DESC
        """;

    static final String TERMINATE_SQL = "SELECT pg_terminate_backend(?) AS terminated";

    private final DatabaseRegistry registry;
    private final ConnectionFactory connectionFactory;
    private final OperationLogService operationLog;

    public List<QuerySample> getRunningQueries(long databaseId) {
        try (DatabaseHandle handle = open(databaseId)) {
            return getRunningQueries(handle.getExecutor());
        }
    }

    /**
     * Terminates the backend {@code pid} on {@code databaseId}. The attempt is
     * audited whether it succeeds or not.
     *
     * @throws KillException when the backend is gone or may not be terminated
     */
    public void killQuery(long databaseId, int pid, long userId) {
        try (DatabaseHandle handle = open(databaseId)) {
            killQuery(handle.getExecutor(), pid);
        } catch (KillException e) {
            log.warn("Kill of backend {} on database {} failed: {}", pid, databaseId, e.getMessage());
            operationLog.record(databaseId, userId, OperationType.KILL_QUERY, false,
                Map.of("pid", pid, "error", String.valueOf(e.getMessage())));
            throw e;
        }
        log.info("Terminated backend {} on database {}", pid, databaseId);
        operationLog.record(databaseId, userId, OperationType.KILL_QUERY, true, Map.of("pid", pid));
    }

    public DatabaseHandle open(long databaseId) {
        return connectionFactory.createConnection(registry.resolve(databaseId), false);
    }

    List<QuerySample> getRunningQueries(SqlExecutor executor) {
        List<Map<String, Object>> rows;
        try {
            rows = executor.execute(RUNNING_QUERIES_SQL);
        } catch (SQLException e) {
            throw new ConnectivityException("Reading pg_stat_activity failed: " + e.getMessage(), e);
        }

        List<QuerySample> samples = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object startedAt = row.get("started_at");
            Object duration = row.get("duration_seconds");
            samples.add(QuerySample.builder()
                .pid(((Number) row.get("pid")).intValue())
                .username((String) row.get("username"))
                .database((String) row.get("database"))
                .state((String) row.get("state"))
                .query((String) row.get("query"))
                .startedAt(startedAt instanceof Timestamp ts ? ts.toInstant() : null)
                .durationSeconds(duration instanceof Number n ? n.doubleValue() : 0)
                .build());
        }
        return samples;
    }

    void killQuery(SqlExecutor executor, int pid) {
        List<Map<String, Object>> rows;
        try {
            rows = executor.execute(TERMINATE_SQL, pid);
        } catch (SQLException e) {
            throw new KillException(pid, "Failed to terminate backend " + pid + ": " + e.getMessage(), e);
        }
        Object terminated = rows.isEmpty() ? null : rows.get(0).get("terminated");
        if (!Boolean.TRUE.equals(terminated)) {
            throw new KillException(pid, "Backend " + pid + " was not terminated (already finished?)");
        }
    }
}
