package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.dto.MonitoringSessionInfo;
import com.containermgmt.querymonitor.dto.StartMonitoringRequest;
import com.containermgmt.querymonitor.session.MonitoringSessionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for monitoring sessions.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class QueryMonitoringController {

    private final MonitoringSessionManager sessionManager;
    private final CallerIdentity callerIdentity;

    /**
     * Starts monitoring a database, or returns the session already running for it.
     */
    @PostMapping("/databases/{databaseId}/query-monitoring/start")
    public ResponseEntity<MonitoringSessionInfo> start(
            @PathVariable long databaseId,
            @Valid @RequestBody(required = false) StartMonitoringRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        StartMonitoringRequest body = request != null ? request : new StartMonitoringRequest();
        log.info("Start monitoring requested for database {}", databaseId);
        return ResponseEntity.ok(sessionManager.startMonitoring(databaseId, callerIdentity.resolve(userId),
            body.getPollingIntervalSeconds(), body.getScheduledEndTime()));
    }

    /**
     * Returns the running session of a database; 204 when it is not monitored.
     */
    @GetMapping("/databases/{databaseId}/query-monitoring/active")
    public ResponseEntity<MonitoringSessionInfo> active(@PathVariable long databaseId) {
        return sessionManager.getActiveSession(databaseId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/query-monitoring/sessions/{sessionId}/stop")
    public ResponseEntity<MonitoringSessionInfo> stop(
            @PathVariable long sessionId,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        log.info("Stop requested for monitoring session {}", sessionId);
        return ResponseEntity.ok(sessionManager.stopMonitoring(sessionId, callerIdentity.resolve(userId)));
    }

    @GetMapping("/query-monitoring/sessions/{sessionId}")
    public ResponseEntity<MonitoringSessionInfo> status(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionManager.getSessionStatus(sessionId));
    }
}
