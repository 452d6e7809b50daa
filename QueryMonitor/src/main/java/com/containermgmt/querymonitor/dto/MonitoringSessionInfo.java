package com.containermgmt.querymonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSessionInfo {

    private long id;
    private long databaseId;
    private long userId;
    private SessionStatus status;
    private int pollingIntervalSeconds;
    private Instant scheduledEndTime;
    private Instant startedAt;
    private Instant stoppedAt;

    public boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    public boolean isExpired(Instant now) {
        return scheduledEndTime != null && !now.isBefore(scheduledEndTime);
    }
}
