package com.containermgmt.querymonitor.ssh;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process tunnel: no sockets, records connect and close calls.
 */
public class FakeSshTunnel implements SshTunnel {

    private final int port;
    private final SshTunnelException failure;
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final AtomicInteger closeCalls = new AtomicInteger();

    private volatile TunnelState state = TunnelState.NEW;

    public FakeSshTunnel(int port) {
        this(port, null);
    }

    public FakeSshTunnel(int port, SshTunnelException failure) {
        this.port = port;
        this.failure = failure;
    }

    @Override
    public int connect() throws SshTunnelException {
        state = TunnelState.CONNECTING;
        if (failure != null) {
            close();
            throw failure;
        }
        state = TunnelState.OPEN;
        return port;
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        state = TunnelState.CLOSED;
        closed.complete(null);
    }

    /**
     * Simulates the SSH session dropping.
     */
    public void drop() {
        state = TunnelState.CLOSED;
    }

    @Override
    public TunnelState getState() {
        return state;
    }

    @Override
    public int getLocalPort() {
        return state == TunnelState.OPEN ? port : -1;
    }

    @Override
    public CompletableFuture<Void> closedFuture() {
        return closed;
    }

    public int getCloseCalls() {
        return closeCalls.get();
    }
}
