package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.dto.AssignGroupRequest;
import com.containermgmt.querymonitor.dto.DiscoveredQuery;
import com.containermgmt.querymonitor.dto.DiscoveredQueryFilter;
import com.containermgmt.querymonitor.dto.MarkKnownRequest;
import com.containermgmt.querymonitor.dto.QueryInstanceView;
import com.containermgmt.querymonitor.service.DiscoveredQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for normalized queries discovered on a database.
 */
@RestController
@RequestMapping("/api/databases/{databaseId}/discovered-queries")
@RequiredArgsConstructor
public class DiscoveredQueryController {

    private final DiscoveredQueryService discoveredQueryService;

    /**
     * Lists discovered queries, most recently seen first.
     *
     * @param showKnown include queries marked known (default false)
     * @param groupId "ungrouped", "all_queries" or a group id
     * @param startDate lower bound on last seen, ISO-8601
     * @param endDate upper bound on last seen, ISO-8601
     * @param search case-insensitive substring of the normalized text
     */
    @GetMapping
    public ResponseEntity<List<DiscoveredQuery>> list(
            @PathVariable long databaseId,
            @RequestParam(defaultValue = "false") boolean showKnown,
            @RequestParam(required = false) String groupId,
            @RequestParam(required = false) Instant startDate,
            @RequestParam(required = false) Instant endDate,
            @RequestParam(required = false) String search) {
        DiscoveredQueryFilter filter = DiscoveredQueryFilter.builder()
            .showKnown(showKnown)
            .groupId(groupId)
            .startDate(startDate)
            .endDate(endDate)
            .search(search)
            .build();
        return ResponseEntity.ok(discoveredQueryService.getDiscoveredQueries(databaseId, filter));
    }

    @GetMapping("/{queryId}")
    public ResponseEntity<DiscoveredQuery> get(@PathVariable long databaseId, @PathVariable long queryId) {
        return ResponseEntity.ok(discoveredQueryService.getDiscoveredQuery(databaseId, queryId));
    }

    @GetMapping("/{queryId}/instances")
    public ResponseEntity<List<QueryInstanceView>> instances(@PathVariable long databaseId,
                                                             @PathVariable long queryId) {
        return ResponseEntity.ok(discoveredQueryService.getQueryInstances(databaseId, queryId));
    }

    @PostMapping("/{queryId}/known")
    public ResponseEntity<DiscoveredQuery> markKnown(@PathVariable long databaseId,
                                                     @PathVariable long queryId,
                                                     @RequestBody(required = false) MarkKnownRequest request) {
        boolean known = request == null || request.isKnown();
        return ResponseEntity.ok(discoveredQueryService.markQueryKnown(databaseId, queryId, known));
    }

    @PostMapping("/{queryId}/group")
    public ResponseEntity<DiscoveredQuery> assignGroup(@PathVariable long databaseId,
                                                       @PathVariable long queryId,
                                                       @RequestBody AssignGroupRequest request) {
        return ResponseEntity.ok(discoveredQueryService.assignQueryGroup(databaseId, queryId, request.getGroupId()));
    }
}
