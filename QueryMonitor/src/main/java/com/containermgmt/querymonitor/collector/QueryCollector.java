package com.containermgmt.querymonitor.collector;

import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.connection.ConnectionFactory;
import com.containermgmt.querymonitor.connection.DatabaseHandle;
import com.containermgmt.querymonitor.connection.SqlExecutor;
import com.containermgmt.querymonitor.dto.CollectionResult;
import com.containermgmt.querymonitor.dto.StatementStatsRow;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.exception.ExtensionMissingException;
import com.containermgmt.querymonitor.normalizer.QueryNormalizer;
import com.containermgmt.querymonitor.registry.DatabaseRegistry;
import com.containermgmt.querymonitor.store.QueryStatsStore;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.DBException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reads pg_stat_statements from a monitored database and folds every
 * statement into its normalized query.
 *
 * One bad row never aborts a cycle: it is logged and counted as skipped.
 */
@Slf4j
@Component
public class QueryCollector {

    public static final String EXTENSION = "pg_stat_statements";

    static final String EXTENSION_CHECK_SQL = "SELECT 1 FROM pg_extension WHERE extname = ?";

    static final String STATEMENT_STATS_SQL = """
        SELECT s.query, s.calls, s.total_exec_time, s.min_exec_time, s.max_exec_time, s.mean_exec_time
        FROM pg_stat_statements s
        JOIN pg_database d ON d.oid = s.dbid
        WHERE d.datname = current_database()
          AND s.query NOT ILIKE '%pg_stat_statements%'
        ORDER BY s.total_exec_time DESC
        LIMIT ?
        """;

    private final DatabaseRegistry registry;
    private final ConnectionFactory connectionFactory;
    private final QueryNormalizer normalizer;
    private final QueryStatsStore store;
    private final QueryMonitorProperties properties;
    private final Clock clock;

    public QueryCollector(DatabaseRegistry registry,
                          ConnectionFactory connectionFactory,
                          QueryNormalizer normalizer,
                          QueryStatsStore store,
                          QueryMonitorProperties properties,
                          Clock clock) {
        this.registry = registry;
        this.connectionFactory = connectionFactory;
        this.normalizer = normalizer;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Connects to {@code databaseId}, checks the extension and stores one
     * snapshot of its statement statistics.
     */
    public CollectionResult runCycle(long databaseId) {
        try (DatabaseHandle handle = connectionFactory.createConnection(
                registry.resolve(databaseId), properties.getMonitoring().isUsePool())) {
            SqlExecutor executor = handle.getExecutor();
            checkExtension(executor);
            List<Map<String, Object>> rows = fetchStatementStats(executor);
            return collect(databaseId, rows, clock.instant());
        }
    }

    /**
     * Connectivity and extension check, without collecting.
     */
    public void verify(long databaseId) {
        try (DatabaseHandle handle = connectionFactory.createConnection(registry.resolve(databaseId), false)) {
            checkExtension(handle.getExecutor());
        }
    }

    public void checkExtension(SqlExecutor executor) {
        List<Map<String, Object>> rows;
        try {
            rows = executor.execute(EXTENSION_CHECK_SQL, EXTENSION);
        } catch (SQLException e) {
            throw new ConnectivityException("Extension check failed: " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            throw new ExtensionMissingException(EXTENSION);
        }
    }

    public List<Map<String, Object>> fetchStatementStats(SqlExecutor executor) {
        try {
            return executor.execute(STATEMENT_STATS_SQL, properties.getCollector().getStatementLimit());
        } catch (SQLException e) {
            throw new ConnectivityException("Reading " + EXTENSION + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Upserts every row: the normalized query first, then the literal
     * instance linked to it.
     */
    public CollectionResult collect(long databaseId, List<Map<String, Object>> rows, Instant now) {
        int stored = 0;
        int skipped = 0;

        for (Map<String, Object> row : rows) {
            try {
                StatementStatsRow stats = StatementStatsRow.fromRow(row);
                String normalizedText = normalizer.normalize(stats.getQueryText());
                String normalizedHash = normalizer.hash(normalizedText);

                long normalizedId = store.upsertNormalizedQuery(databaseId, normalizedHash, normalizedText, now);
                store.upsertQueryInstance(databaseId, normalizedId, stats.getQueryText(),
                    normalizer.hash(stats.getQueryText()), stats, now);
                stored++;
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping malformed statement row for database {}: {}", databaseId, e.getMessage());
            } catch (DBException e) {
                skipped++;
                log.error("Failed to store statement for database {}: {}", databaseId, e.getMessage());
            }
        }

        log.info("Collected {} statement(s) for database {} ({} skipped)", stored, databaseId, skipped);
        return CollectionResult.builder()
            .databaseId(databaseId)
            .rowsSeen(rows.size())
            .rowsStored(stored)
            .rowsSkipped(skipped)
            .collectedAt(now)
            .build();
    }
}
