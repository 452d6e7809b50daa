package com.containermgmt.querymonitor.connection;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executor over one JDBC connection, used for a single collection cycle or
 * a one-off kill.
 */
@Slf4j
public class SingleConnectionSqlExecutor extends AbstractJdbcSqlExecutor {

    private final Connection connection;

    public SingleConnectionSqlExecutor(Connection connection, int queryTimeoutSeconds) {
        super(queryTimeoutSeconds);
        this.connection = connection;
    }

    @Override
    public synchronized List<Map<String, Object>> execute(String sql, Object... params) throws SQLException {
        return run(connection, sql, params);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing monitored database connection: {}", e.getMessage());
        }
    }
}
