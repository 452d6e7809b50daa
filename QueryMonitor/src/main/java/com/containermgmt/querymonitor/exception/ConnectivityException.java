package com.containermgmt.querymonitor.exception;

/**
 * The monitored database could not be reached: SSH tunnel, authentication
 * or the database itself. Retried on the next tick by background loops.
 */
public class ConnectivityException extends QueryMonitorException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

}
