package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a monitoring session, stored lower-case.
 */
public enum SessionStatus {

    RUNNING,
    STOPPED,
    COMPLETED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase();
    }

    public static SessionStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
