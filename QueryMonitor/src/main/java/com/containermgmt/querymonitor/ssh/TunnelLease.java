package com.containermgmt.querymonitor.ssh;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One reference on a shared tunnel. Closing the lease releases the reference;
 * further closes are no-ops.
 */
public final class TunnelLease implements AutoCloseable {

    private final SshTunnelManager manager;
    private final SshTunnelManager.TunnelEntry entry;
    private final int localPort;
    private final AtomicBoolean released = new AtomicBoolean(false);

    TunnelLease(SshTunnelManager manager, SshTunnelManager.TunnelEntry entry, int localPort) {
        this.manager = manager;
        this.entry = entry;
        this.localPort = localPort;
    }

    public int getLocalPort() {
        return localPort;
    }

    public String getKey() {
        return entry.key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release(entry);
        }
    }
}
