package com.containermgmt.querymonitor.ssh;

import java.util.concurrent.CompletableFuture;

/**
 * A local TCP listener relaying every accepted connection through an SSH
 * session to a remote database host.
 */
public interface SshTunnel extends AutoCloseable {

    /**
     * Binds the local listener and authenticates the SSH session.
     * Returns once the tunnel is usable.
     *
     * @return the local port to connect to
     */
    int connect() throws SshTunnelException;

    /**
     * Tears down the SSH session and the listener. Safe to call repeatedly.
     */
    @Override
    void close();

    TunnelState getState();

    /**
     * @return the local port, or -1 when not bound
     */
    int getLocalPort();

    /**
     * Completes when the tunnel reaches {@link TunnelState#CLOSED}, whatever the cause.
     */
    CompletableFuture<Void> closedFuture();

    default boolean isOpen() {
        return getState() == TunnelState.OPEN;
    }
}
