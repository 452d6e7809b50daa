package com.containermgmt.querymonitor.ssh;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * SSH endpoint plus the database host/port reached through it.
 * Either a password or a private key (with optional passphrase) is used.
 */
@Value
@Builder
public class SshTunnelConfig {

    String sshHost;

    @Builder.Default
    int sshPort = 22;

    String sshUsername;

    @ToString.Exclude
    String sshPassword;

    @ToString.Exclude
    String sshPrivateKey;

    @ToString.Exclude
    String sshKeyPassphrase;

    String dbHost;

    int dbPort;

    public boolean hasPrivateKey() {
        return sshPrivateKey != null && !sshPrivateKey.isBlank();
    }
}
