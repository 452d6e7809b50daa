package com.containermgmt.querymonitor.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ContinuousKillStatus {

    long databaseId;
    boolean active;
    String target;
    long killCount;
    Instant startedAt;

    public static ContinuousKillStatus inactive(long databaseId) {
        return ContinuousKillStatus.builder().databaseId(databaseId).active(false).build();
    }
}
