package com.containermgmt.querymonitor.connection;

import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.ssh.SshTunnelConfig;
import com.containermgmt.querymonitor.ssh.SshTunnelException;
import com.containermgmt.querymonitor.ssh.SshTunnelManager;
import com.containermgmt.querymonitor.ssh.TunnelLease;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Builds {@link DatabaseHandle}s for monitored databases, going through the
 * shared SSH tunnel when the configuration asks for one.
 *
 * If anything fails after the tunnel lease was taken the lease is released
 * before the error is thrown; the caller never receives a half-open handle.
 */
@Slf4j
@Component
public class ConnectionFactory {

    static final String TUNNEL_HOST = "127.0.0.1";

    private final SshTunnelManager tunnelManager;
    private final QueryMonitorProperties.Connection connectionProps;
    private final SqlExecutorOpener opener;

    @Autowired
    public ConnectionFactory(SshTunnelManager tunnelManager, QueryMonitorProperties properties) {
        this.tunnelManager = tunnelManager;
        this.connectionProps = properties.getConnection();
        this.opener = this::openJdbc;
    }

    public ConnectionFactory(SshTunnelManager tunnelManager, QueryMonitorProperties properties,
                             SqlExecutorOpener opener) {
        this.tunnelManager = tunnelManager;
        this.connectionProps = properties.getConnection();
        this.opener = opener;
    }

    /**
     * Opens a connection to the database described by {@code config}.
     *
     * @param usePool pooled executor (several statements over time) or a single connection
     * @throws ConnectivityException when the tunnel or the database cannot be reached
     */
    public DatabaseHandle createConnection(ConnectionConfig config, boolean usePool) {
        TunnelLease lease = null;
        String host = config.getHost();
        int port = config.getPort();

        try {
            if (config.usesSshTunnel()) {
                SshTunnelConfig tunnel = config.getSshTunnel();
                lease = tunnelManager.acquire(config.getTunnelKey(), tunnel);
                host = TUNNEL_HOST;
                port = lease.getLocalPort();
            }

            String url = buildJdbcUrl(host, port, config.getDatabaseName(), config.isUseSsl());
            SqlExecutor executor = opener.open(url, config.getUsername(), config.getPassword(), usePool);

            log.debug("Connected to database {} at {}:{}{}", config.getDatabaseId(), host, port,
                lease != null ? " (tunnel " + config.getTunnelKey() + ")" : "");
            return new DatabaseHandle(config.getDatabaseId(), executor, lease);

        } catch (SshTunnelException e) {
            throw new ConnectivityException("SSH tunnel to database " + config.getDatabaseId()
                + " failed: " + e.getMessage(), e);
        } catch (SQLException | RuntimeException e) {
            if (lease != null) {
                lease.close();
            }
            throw new ConnectivityException("Cannot connect to database " + config.getDatabaseId()
                + ": " + e.getMessage(), e);
        }
    }

    String buildJdbcUrl(String host, int port, String databaseName, boolean useSsl) {
        StringBuilder url = new StringBuilder("jdbc:postgresql://")
            .append(host).append(':').append(port).append('/').append(urlEncode(databaseName))
            .append("?connectTimeout=").append(connectionProps.getConnectTimeoutSeconds())
            .append("&socketTimeout=").append(connectionProps.getSocketTimeoutSeconds())
            .append("&ApplicationName=").append(urlEncode(connectionProps.getApplicationName()));
        if (useSsl) {
            url.append("&sslmode=require");
        }
        return url.toString();
    }

    // the driver URL-decodes the database name and every parameter value
    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private SqlExecutor openJdbc(String url, String username, String password, boolean pooled) throws SQLException {
        int queryTimeout = connectionProps.getQueryTimeoutSeconds();
        if (!pooled) {
            Properties info = new Properties();
            info.setProperty("user", username);
            if (password != null) {
                info.setProperty("password", password);
            }
            return new SingleConnectionSqlExecutor(DriverManager.getConnection(url, info), queryTimeout);
        }

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setUsername(username);
        hikari.setPassword(password);
        hikari.setMaximumPoolSize(connectionProps.getMaxPoolSize());
        hikari.setMinimumIdle(0);
        hikari.setConnectionTimeout(connectionProps.getConnectTimeoutSeconds() * 1000L);
        hikari.setPoolName("monitored-" + Math.abs(url.hashCode()));
        try {
            return new PooledSqlExecutor(new HikariDataSource(hikari), queryTimeout);
        } catch (RuntimeException e) {
            // Hikari wraps the driver failure in PoolInitializationException
            throw new SQLException(e.getMessage(), e);
        }
    }
}
