package com.containermgmt.querymonitor.store;

import com.containermgmt.querymonitor.config.ActiveJDBCConfig;
import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.SessionStatus;
import com.containermgmt.querymonitor.model.MonitoringSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class ActiveJdbcMonitoringSessionStore implements MonitoringSessionStore {

    private final ActiveJDBCConfig activeJDBCConfig;

    @Override
    public MonitoringSessionInfo create(long databaseId, long userId, int pollingIntervalSeconds,
                                        Instant scheduledEndTime, Instant startedAt) {
        return activeJDBCConfig.withConnection(() -> {
            MonitoringSession session = new MonitoringSession();
            session.set("database_id", databaseId);
            session.set("user_id", userId);
            session.set("status", SessionStatus.RUNNING.dbValue());
            session.set("polling_interval_seconds", pollingIntervalSeconds);
            session.set("scheduled_end_time", scheduledEndTime != null ? Timestamp.from(scheduledEndTime) : null);
            session.set("started_at", Timestamp.from(startedAt));
            session.saveIt();
            return toInfo(session);
        });
    }

    @Override
    public Optional<MonitoringSessionInfo> findById(long sessionId) {
        return activeJDBCConfig.withConnection(() ->
            Optional.ofNullable(MonitoringSession.<MonitoringSession>findById(sessionId))
                .map(ActiveJdbcMonitoringSessionStore::toInfo));
    }

    @Override
    public Optional<MonitoringSessionInfo> findRunning(long databaseId) {
        return activeJDBCConfig.withConnection(() ->
            Optional.ofNullable(MonitoringSession.findRunningForDatabase(databaseId))
                .map(ActiveJdbcMonitoringSessionStore::toInfo));
    }

    @Override
    public List<MonitoringSessionInfo> findAllRunning() {
        return activeJDBCConfig.withConnection(() -> MonitoringSession.findAllRunning().stream()
            .map(ActiveJdbcMonitoringSessionStore::toInfo)
            .collect(Collectors.toList()));
    }

    @Override
    public Optional<MonitoringSessionInfo> finish(long sessionId, SessionStatus status, Instant stoppedAt) {
        return activeJDBCConfig.withConnection(() -> {
            MonitoringSession session = MonitoringSession.findById(sessionId);
            if (session == null) {
                return Optional.<MonitoringSessionInfo>empty();
            }
            if (SessionStatus.RUNNING.dbValue().equals(session.getString("status"))) {
                session.set("status", status.dbValue());
                session.set("stopped_at", Timestamp.from(stoppedAt));
                session.saveIt();
            }
            return Optional.of(toInfo(session));
        });
    }

    private static MonitoringSessionInfo toInfo(MonitoringSession session) {
        Timestamp end = session.getTimestamp("scheduled_end_time");
        Timestamp started = session.getTimestamp("started_at");
        Timestamp stopped = session.getTimestamp("stopped_at");
        return MonitoringSessionInfo.builder()
            .id(session.getLongId())
            .databaseId(session.getLong("database_id"))
            .userId(session.getLong("user_id"))
            .status(SessionStatus.fromDb(session.getString("status")))
            .pollingIntervalSeconds(session.getInteger("polling_interval_seconds"))
            .scheduledEndTime(end != null ? end.toInstant() : null)
            .startedAt(started != null ? started.toInstant() : null)
            .stoppedAt(stopped != null ? stopped.toInstant() : null)
            .build();
    }
}
