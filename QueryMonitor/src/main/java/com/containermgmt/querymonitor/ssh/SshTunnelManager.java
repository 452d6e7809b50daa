package com.containermgmt.querymonitor.ssh;

import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the SSH tunnels of the process, shared by tunnel key (instance identity).
 *
 * Each {@link #acquire} adds a reference and returns a {@link TunnelLease};
 * the tunnel is closed when the last lease is released. Reference counts
 * change only under {@code lock}; the SSH handshake itself runs outside it,
 * concurrent callers for the same key wait for the first caller's handshake.
 */
@Slf4j
@Component
public class SshTunnelManager {

    private final SshTunnelFactory tunnelFactory;
    private final long acquireTimeoutMs;

    private final Map<String, TunnelEntry> tunnels = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public SshTunnelManager(QueryMonitorProperties properties) {
        this(config -> new JschSshTunnel(config, properties.getSsh()),
            properties.getSsh().getConnectTimeoutMs() * 2L);
    }

    public SshTunnelManager(SshTunnelFactory tunnelFactory, long acquireTimeoutMs) {
        this.tunnelFactory = tunnelFactory;
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    /**
     * Returns a lease on the tunnel for {@code key}, opening it if needed.
     * On failure no reference is kept and the tunnel is closed.
     */
    public TunnelLease acquire(String key, SshTunnelConfig config) throws SshTunnelException {
        TunnelEntry entry;
        boolean creator = false;

        lock.lock();
        try {
            entry = tunnels.get(key);
            if (entry == null || entry.isDead()) {
                if (entry != null) {
                    log.info("Replacing closed SSH tunnel for {}", key);
                }
                entry = new TunnelEntry(key, tunnelFactory.create(config));
                tunnels.put(key, entry);
                creator = true;
            }
            entry.refCount++;
        } finally {
            lock.unlock();
        }

        int localPort;
        if (creator) {
            try {
                localPort = entry.tunnel.connect();
                entry.ready.complete(localPort);
                log.info("SSH tunnel for {} open on local port {} ({} -> {}:{})",
                    key, localPort, config.getSshHost(), config.getDbHost(), config.getDbPort());
            } catch (SshTunnelException | RuntimeException e) {
                entry.ready.completeExceptionally(e);
                discard(entry);
                throw e;
            }
        } else {
            localPort = awaitReady(entry);
        }

        return new TunnelLease(this, entry, localPort);
    }

    /**
     * Number of open leases for {@code key}; 0 when no tunnel exists.
     */
    public int getReferenceCount(String key) {
        lock.lock();
        try {
            TunnelEntry entry = tunnels.get(key);
            return entry != null ? entry.refCount : 0;
        } finally {
            lock.unlock();
        }
    }

    public int getTunnelCount() {
        lock.lock();
        try {
            return tunnels.size();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void closeAll() {
        List<TunnelEntry> toClose;
        lock.lock();
        try {
            toClose = new ArrayList<>(tunnels.values());
            tunnels.clear();
        } finally {
            lock.unlock();
        }
        log.info("Closing {} SSH tunnel(s)", toClose.size());
        for (TunnelEntry entry : toClose) {
            entry.tunnel.close();
        }
    }

    void release(TunnelEntry entry) {
        boolean closeTunnel = false;
        lock.lock();
        try {
            entry.refCount--;
            if (entry.refCount <= 0) {
                // only drop the mapping if it still points at this entry
                tunnels.remove(entry.key, entry);
                closeTunnel = true;
            }
        } finally {
            lock.unlock();
        }

        if (closeTunnel) {
            log.info("Last reference released, closing SSH tunnel for {}", entry.key);
            entry.tunnel.close();
        }
    }

    private int awaitReady(TunnelEntry entry) throws SshTunnelException {
        try {
            return entry.ready.get(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            discard(entry);
            Throwable cause = e.getCause();
            if (cause instanceof SshTunnelException ste) {
                throw ste;
            }
            throw new SshTunnelException("SSH tunnel for " + entry.key + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            discard(entry);
            throw new SshTunnelException("Timed out waiting for SSH tunnel " + entry.key);
        } catch (InterruptedException e) {
            discard(entry);
            Thread.currentThread().interrupt();
            throw new SshTunnelException("Interrupted waiting for SSH tunnel " + entry.key, e);
        }
    }

    private void discard(TunnelEntry entry) {
        release(entry);
    }

    static final class TunnelEntry {

        final String key;
        final SshTunnel tunnel;
        final CompletableFuture<Integer> ready = new CompletableFuture<>();
        int refCount;

        TunnelEntry(String key, SshTunnel tunnel) {
            this.key = key;
            this.tunnel = tunnel;
        }

        boolean isDead() {
            if (ready.isCompletedExceptionally()) {
                return true;
            }
            return ready.isDone() && !tunnel.isOpen();
        }
    }
}
