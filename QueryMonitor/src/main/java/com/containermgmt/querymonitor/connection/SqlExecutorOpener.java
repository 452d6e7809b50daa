package com.containermgmt.querymonitor.connection;

import java.sql.SQLException;

/**
 * Opens the JDBC side of a {@link DatabaseHandle}. Replaced in tests.
 */
@FunctionalInterface
public interface SqlExecutorOpener {

    SqlExecutor open(String jdbcUrl, String username, String password, boolean pooled) throws SQLException;
}
