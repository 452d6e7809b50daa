package com.containermgmt.querymonitor.store;

import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MonitoringSessionStore {

    MonitoringSessionInfo create(long databaseId, long userId, int pollingIntervalSeconds,
                                 Instant scheduledEndTime, Instant startedAt);

    Optional<MonitoringSessionInfo> findById(long sessionId);

    /**
     * The running session of {@code databaseId}, if any.
     */
    Optional<MonitoringSessionInfo> findRunning(long databaseId);

    List<MonitoringSessionInfo> findAllRunning();

    /**
     * Moves a running session to {@code status}. Sessions already stopped or
     * completed are left untouched.
     *
     * @return the session as stored after the call
     */
    Optional<MonitoringSessionInfo> finish(long sessionId, SessionStatus status, Instant stoppedAt);
}
