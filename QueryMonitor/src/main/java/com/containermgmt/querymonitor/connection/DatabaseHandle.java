package com.containermgmt.querymonitor.connection;

import com.containermgmt.querymonitor.ssh.TunnelLease;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open connection to a monitored database together with the tunnel lease
 * it rides on. {@link #cleanup()} releases both, in that order, exactly once.
 */
@Slf4j
public class DatabaseHandle implements AutoCloseable {

    private final long databaseId;
    private final SqlExecutor executor;
    private final TunnelLease tunnelLease;
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);

    public DatabaseHandle(long databaseId, SqlExecutor executor, TunnelLease tunnelLease) {
        this.databaseId = databaseId;
        this.executor = executor;
        this.tunnelLease = tunnelLease;
    }

    public long getDatabaseId() {
        return databaseId;
    }

    public SqlExecutor getExecutor() {
        return executor;
    }

    public boolean isTunneled() {
        return tunnelLease != null;
    }

    public void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.close();
        } finally {
            if (tunnelLease != null) {
                tunnelLease.close();
            }
            log.debug("Released connection to database {}", databaseId);
        }
    }

    @Override
    public void close() {
        cleanup();
    }
}
