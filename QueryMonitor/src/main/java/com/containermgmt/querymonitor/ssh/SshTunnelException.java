package com.containermgmt.querymonitor.ssh;

/**
 * Tunnel could not be established: local bind failure, SSH connect or authentication failure.
 */
public class SshTunnelException extends Exception {

    public SshTunnelException(String message) {
        super(message);
    }

    public SshTunnelException(String message, Throwable cause) {
        super(message, cause);
    }

}
