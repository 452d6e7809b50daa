package com.containermgmt.querymonitor.connection;

import com.containermgmt.querymonitor.ssh.SshTunnelConfig;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Everything needed to reach one monitored database: the Postgres endpoint,
 * credentials and, when the instance is behind a bastion, its SSH tunnel.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionConfig {

    long databaseId;

    String host;

    @Builder.Default
    int port = 5432;

    String databaseName;

    String username;

    @ToString.Exclude
    String password;

    boolean useSsl;

    /** Tunnel settings, null for a direct connection. */
    SshTunnelConfig sshTunnel;

    /** Identity under which the tunnel is shared ("instance-3", "database-7"). */
    String tunnelKey;

    public boolean usesSshTunnel() {
        return sshTunnel != null;
    }
}
