package com.containermgmt.querymonitor.ssh;

import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.jcraft.jsch.ChannelDirectTCPIP;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSch based tunnel. Every connection accepted on the loopback listener gets
 * its own direct-tcpip channel; bytes are copied in both directions by two
 * pump threads. A failure on one connection closes that socket and channel
 * only, the SSH session stays up.
 */
@Slf4j
public class JschSshTunnel implements SshTunnel {

    private static final int BUFFER_SIZE = 8192;
    private static final AtomicInteger TUNNEL_SEQ = new AtomicInteger();

    private final SshTunnelConfig config;
    private final QueryMonitorProperties.Ssh sshProps;
    private final SessionOpener sessionOpener;
    private final String name;

    private final Set<ForwardedConnection> connections = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final ExecutorService forwarders;

    private volatile TunnelState state = TunnelState.NEW;
    private volatile ServerSocket serverSocket;
    private volatile Session session;
    private volatile int localPort = -1;

    public JschSshTunnel(SshTunnelConfig config, QueryMonitorProperties.Ssh sshProps) {
        this(config, sshProps, null);
    }

    JschSshTunnel(SshTunnelConfig config, QueryMonitorProperties.Ssh sshProps, SessionOpener sessionOpener) {
        this.config = config;
        this.sshProps = sshProps;
        this.sessionOpener = sessionOpener != null ? sessionOpener : this::openSession;
        this.name = "ssh-tunnel-" + TUNNEL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.forwarders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-fwd-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized int connect() throws SshTunnelException {
        if (state != TunnelState.NEW) {
            throw new SshTunnelException("Tunnel " + name + " cannot connect from state " + state);
        }
        state = TunnelState.CONNECTING;

        try {
            serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
            localPort = serverSocket.getLocalPort();
            log.info("{} listening on localhost:{}", name, localPort);
        } catch (IOException e) {
            close();
            throw new SshTunnelException("Could not bind a local port for SSH tunnel: " + e.getMessage(), e);
        }

        try {
            session = sessionOpener.open();
            session.connect(sshProps.getConnectTimeoutMs());
            log.info("{} SSH connection established to {}@{}:{}",
                name, config.getSshUsername(), config.getSshHost(), config.getSshPort());
        } catch (JSchException e) {
            close();
            throw new SshTunnelException(describeFailure(e), e);
        }

        state = TunnelState.OPEN;
        Thread acceptor = new Thread(this::acceptLoop, name + "-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();

        return localPort;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (state == TunnelState.CLOSED) {
                return;
            }
            state = TunnelState.CLOSED;
        }

        for (ForwardedConnection connection : connections) {
            connection.close();
        }
        connections.clear();

        if (session != null) {
            session.disconnect();
            session = null;
        }

        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                log.warn("{} error closing local listener: {}", name, e.getMessage());
            }
            serverSocket = null;
        }

        forwarders.shutdownNow();
        localPort = -1;
        closed.complete(null);
        log.info("{} closed", name);
    }

    @Override
    public TunnelState getState() {
        Session current = session;
        if (state == TunnelState.OPEN && (current == null || !current.isConnected())) {
            log.warn("{} SSH session dropped, closing tunnel", name);
            close();
        }
        return state;
    }

    @Override
    public int getLocalPort() {
        return localPort;
    }

    @Override
    public CompletableFuture<Void> closedFuture() {
        return closed;
    }

    private Session openSession() throws JSchException {
        JSch jsch = new JSch();
        if (sshProps.getKnownHostsFile() != null && !sshProps.getKnownHostsFile().isBlank()) {
            jsch.setKnownHosts(sshProps.getKnownHostsFile());
        }

        if (config.hasPrivateKey()) {
            byte[] passphrase = config.getSshKeyPassphrase() != null
                ? config.getSshKeyPassphrase().getBytes(StandardCharsets.UTF_8)
                : null;
            jsch.addIdentity(name, config.getSshPrivateKey().getBytes(StandardCharsets.UTF_8), null, passphrase);
        }

        Session s = jsch.getSession(config.getSshUsername(), config.getSshHost(), config.getSshPort());
        if (!config.hasPrivateKey() && config.getSshPassword() != null) {
            s.setPassword(config.getSshPassword());
        }
        s.setConfig("StrictHostKeyChecking", sshProps.getStrictHostKeyChecking());
        if (sshProps.getServerAliveIntervalMs() > 0) {
            s.setServerAliveInterval(sshProps.getServerAliveIntervalMs());
        }
        return s;
    }

    private String describeFailure(JSchException e) {
        String target = config.getSshUsername() + "@" + config.getSshHost() + ":" + config.getSshPort();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (message.toLowerCase().contains("auth")) {
            return "SSH authentication failed for " + target + ": " + message;
        }
        return "SSH connection failed for " + target + ": " + message;
    }

    private void acceptLoop() {
        ServerSocket listener = serverSocket;
        while (state == TunnelState.OPEN && listener != null && !listener.isClosed()) {
            try {
                dispatch(listener.accept());
            } catch (SocketException e) {
                // listener closed by close()
                break;
            } catch (IOException e) {
                log.warn("{} accept failed: {}", name, e.getMessage());
            }
        }
        log.debug("{} acceptor stopped", name);
    }

    /**
     * Hands an accepted socket to a forwarder thread. The socket is closed
     * when it cannot be handed over, e.g. after {@link #close()}.
     */
    void dispatch(Socket socket) {
        try {
            forwarders.execute(() -> forward(socket));
        } catch (RejectedExecutionException e) {
            log.debug("{} rejected connection from port {}: tunnel is closing", name, socket.getPort());
            closeQuietly(socket);
        }
    }

    private void forward(Socket socket) {
        Session current = session;
        ChannelDirectTCPIP channel = null;
        try {
            if (current == null || !current.isConnected()) {
                throw new IOException("SSH session is not connected");
            }

            channel = (ChannelDirectTCPIP) current.openChannel("direct-tcpip");
            channel.setHost(config.getDbHost());
            channel.setPort(config.getDbPort());
            channel.setOrgIPAddress(socket.getInetAddress().getHostAddress());
            channel.setOrgPort(socket.getPort());

            InputStream fromRemote = channel.getInputStream();
            OutputStream toRemote = channel.getOutputStream();
            channel.connect(sshProps.getChannelConnectTimeoutMs());

            ForwardedConnection connection = new ForwardedConnection(socket, channel);
            connections.add(connection);
            if (state != TunnelState.OPEN) {
                connection.close();
                return;
            }

            InputStream fromLocal = socket.getInputStream();
            OutputStream toLocal = socket.getOutputStream();
            forwarders.execute(() -> pump(fromLocal, toRemote, connection));
            pump(fromRemote, toLocal, connection);

        } catch (JSchException | IOException | RuntimeException e) {
            log.warn("{} forwarding to {}:{} failed: {}",
                name, config.getDbHost(), config.getDbPort(), e.getMessage());
            closeQuietly(socket);
            if (channel != null) {
                channel.disconnect();
            }
        }
    }

    private void pump(InputStream in, OutputStream out, ForwardedConnection connection) {
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                out.flush();
            }
        } catch (IOException e) {
            log.debug("{} stream closed: {}", name, e.getMessage());
        } finally {
            connection.close();
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing local socket: {}", e.getMessage());
        }
    }

    /**
     * Opens the (not yet connected) SSH session of a tunnel.
     */
    @FunctionalInterface
    interface SessionOpener {
        Session open() throws JSchException;
    }

    /**
     * One accepted local socket bound to its SSH channel.
     */
    private final class ForwardedConnection {

        private final Socket socket;
        private final ChannelDirectTCPIP channel;
        private final AtomicBoolean done = new AtomicBoolean(false);

        ForwardedConnection(Socket socket, ChannelDirectTCPIP channel) {
            this.socket = socket;
            this.channel = channel;
        }

        void close() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            closeQuietly(socket);
            channel.disconnect();
            connections.remove(this);
        }
    }
}
