package com.containermgmt.querymonitor.connection;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * The single capability a monitored database exposes to the core:
 * run a parameterized statement and get its rows back.
 */
public interface SqlExecutor extends AutoCloseable {

    /**
     * Runs {@code sql} with positional {@code ?} parameters.
     *
     * @return one map per row, keyed by column label; empty for statements without a result set
     */
    List<Map<String, Object>> execute(String sql, Object... params) throws SQLException;

    @Override
    void close();
}
