package com.containermgmt.querymonitor.exception;

/**
 * A backend could not be terminated (already gone, or insufficient privilege).
 */
public class KillException extends QueryMonitorException {

    private final int pid;

    public KillException(int pid, String message) {
        super(message);
        this.pid = pid;
    }

    public KillException(int pid, String message, Throwable cause) {
        super(message, cause);
        this.pid = pid;
    }

    public int getPid() {
        return pid;
    }

}
