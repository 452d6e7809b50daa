package com.containermgmt.querymonitor.registry;

import com.containermgmt.querymonitor.config.ActiveJDBCConfig;
import com.containermgmt.querymonitor.connection.ConnectionConfig;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import com.containermgmt.querymonitor.model.DatabaseConnection;
import com.containermgmt.querymonitor.model.Instance;
import com.containermgmt.querymonitor.ssh.SshTunnelConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.javalite.activejdbc.Model;
import org.springframework.stereotype.Component;

/**
 * Resolves connection settings from the database_connections and instances tables.
 *
 * Credentials on the database row win over the instance's. SSH settings on
 * the database row, when enabled, replace the instance tunnel and get their
 * own tunnel key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActiveJdbcDatabaseRegistry implements DatabaseRegistry {

    private final ActiveJDBCConfig activeJDBCConfig;

    @Override
    public ConnectionConfig resolve(long databaseId) {
        return activeJDBCConfig.withConnection(() -> {
            DatabaseConnection database = DatabaseConnection.findActive(databaseId);
            if (database == null) {
                throw new ResourceNotFoundException("Database", databaseId);
            }
            Instance instance = database.findInstance();
            if (instance == null) {
                throw new ResourceNotFoundException("Instance", database.get("instance_id"));
            }

            ConnectionConfig.ConnectionConfigBuilder builder = ConnectionConfig.builder()
                .databaseId(databaseId)
                .host(instance.getString("hostname"))
                .port(intOr(instance.getInteger("port"), 5432))
                .databaseName(database.getString("database_name"))
                .username(StringUtils.defaultIfBlank(database.getString("username"), instance.getString("username")))
                .password(StringUtils.defaultIfBlank(database.getString("password"), instance.getString("password")))
                .useSsl(Boolean.TRUE.equals(database.getBoolean("use_ssl")));

            if (database.usesSshTunnel()) {
                builder.sshTunnel(tunnelConfig(database, instance))
                    .tunnelKey("database-" + databaseId);
            } else if (instance.usesSshTunnel()) {
                builder.sshTunnel(tunnelConfig(instance, instance))
                    .tunnelKey("instance-" + instance.getId());
            }

            ConnectionConfig config = builder.build();
            log.debug("Resolved database {} -> {}:{} (tunnel: {})",
                databaseId, config.getHost(), config.getPort(), config.getTunnelKey());
            return config;
        });
    }

    private static SshTunnelConfig tunnelConfig(Model source, Instance instance) {
        return SshTunnelConfig.builder()
            .sshHost(source.getString("ssh_host"))
            .sshPort(intOr(source.getInteger("ssh_port"), 22))
            .sshUsername(source.getString("ssh_username"))
            .sshPassword(source.getString("ssh_password"))
            .sshPrivateKey(source.getString("ssh_private_key"))
            .sshKeyPassphrase(source.getString("ssh_key_passphrase"))
            .dbHost(instance.getString("hostname"))
            .dbPort(intOr(instance.getInteger("port"), 5432))
            .build();
    }

    private static int intOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
