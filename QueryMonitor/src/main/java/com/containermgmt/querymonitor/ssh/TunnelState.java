package com.containermgmt.querymonitor.ssh;

/**
 * Lifecycle of an SSH tunnel. Transitions only move forward:
 * NEW -> CONNECTING -> OPEN -> CLOSED, or NEW/CONNECTING -> CLOSED on failure.
 */
public enum TunnelState {
    NEW,
    CONNECTING,
    OPEN,
    CLOSED
}
