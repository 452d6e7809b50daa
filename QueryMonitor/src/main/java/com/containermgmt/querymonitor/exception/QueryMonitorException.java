package com.containermgmt.querymonitor.exception;

/**
 * Base exception for query monitoring errors
 */
public class QueryMonitorException extends RuntimeException {

    public QueryMonitorException(String message) {
        super(message);
    }

    public QueryMonitorException(String message, Throwable cause) {
        super(message, cause);
    }

}
