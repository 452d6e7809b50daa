package com.containermgmt.querymonitor.audit;

/**
 * Values of database_operation_logs.operation_type written by this service.
 */
public enum OperationType {

    KILL_QUERY("kill_query"),
    CONTINUOUS_KILL_START("continuous_kill_start"),
    CONTINUOUS_KILL_STOP("continuous_kill_stop"),
    CONTINUOUS_KILL_EXECUTION("continuous_kill_execution"),
    MONITORING_START("query_monitoring_start"),
    MONITORING_STOP("query_monitoring_stop");

    private final String code;

    OperationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
