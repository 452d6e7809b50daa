package com.containermgmt.querymonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A statement currently executing on the monitored database (pg_stat_activity).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuerySample {

    private int pid;
    private String username;
    private String database;
    private String state;
    private String query;
    private Instant startedAt;
    private double durationSeconds;
}
