package com.containermgmt.querymonitor.connection;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executor backed by a small Hikari pool, for callers issuing many
 * statements against the same database.
 */
public class PooledSqlExecutor extends AbstractJdbcSqlExecutor {

    private final HikariDataSource dataSource;

    public PooledSqlExecutor(HikariDataSource dataSource, int queryTimeoutSeconds) {
        super(queryTimeoutSeconds);
        this.dataSource = dataSource;
    }

    @Override
    public List<Map<String, Object>> execute(String sql, Object... params) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            return run(connection, sql, params);
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
