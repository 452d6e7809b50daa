package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.dto.ContinuousKillRequest;
import com.containermgmt.querymonitor.dto.ContinuousKillStatus;
import com.containermgmt.querymonitor.dto.KillQueryRequest;
import com.containermgmt.querymonitor.dto.QuerySample;
import com.containermgmt.querymonitor.kill.ContinuousKillService;
import com.containermgmt.querymonitor.kill.RunningQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for running queries: inspection, manual kill and continuous kill.
 */
@Slf4j
@RestController
@RequestMapping("/api/databases/{databaseId}")
@RequiredArgsConstructor
public class RunningQueryController {

    private final RunningQueryService runningQueryService;
    private final ContinuousKillService continuousKillService;
    private final CallerIdentity callerIdentity;

    @GetMapping("/running-queries")
    public ResponseEntity<List<QuerySample>> runningQueries(@PathVariable long databaseId) {
        return ResponseEntity.ok(runningQueryService.getRunningQueries(databaseId));
    }

    @PostMapping("/kill-query")
    public ResponseEntity<Map<String, Object>> killQuery(
            @PathVariable long databaseId,
            @Valid @RequestBody KillQueryRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        log.info("Kill requested for backend {} on database {}", request.getPid(), databaseId);
        runningQueryService.killQuery(databaseId, request.getPid(), callerIdentity.resolve(userId));
        Map<String, Object> body = Map.of("success", true, "pid", request.getPid());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/continuous-kill")
    public ResponseEntity<ContinuousKillStatus> continuousKillStatus(@PathVariable long databaseId) {
        return ResponseEntity.ok(continuousKillService.getContinuousKillStatus(databaseId));
    }

    @PostMapping("/continuous-kill")
    public ResponseEntity<ContinuousKillStatus> startContinuousKill(
            @PathVariable long databaseId,
            @Valid @RequestBody ContinuousKillRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        String signature = StringUtils.isNotBlank(request.getSignature())
            ? request.getSignature()
            : continuousKillService.signature(request.getQuery());
        return ResponseEntity.ok(continuousKillService.setContinuousKillTarget(
            databaseId, signature, callerIdentity.resolve(userId)));
    }

    @DeleteMapping("/continuous-kill")
    public ResponseEntity<ContinuousKillStatus> stopContinuousKill(
            @PathVariable long databaseId,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        return ResponseEntity.ok(continuousKillService.clearContinuousKillTarget(
            databaseId, callerIdentity.resolve(userId)));
    }
}
