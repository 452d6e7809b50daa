package com.containermgmt.querymonitor.ssh;

@FunctionalInterface
public interface SshTunnelFactory {

    SshTunnel create(SshTunnelConfig config);
}
