package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.dto.QueryGroupRequest;
import com.containermgmt.querymonitor.dto.QueryGroupView;
import com.containermgmt.querymonitor.service.QueryGroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/databases/{databaseId}/query-groups")
@RequiredArgsConstructor
public class QueryGroupController {

    private final QueryGroupService groupService;
    private final CallerIdentity callerIdentity;

    @GetMapping
    public ResponseEntity<List<QueryGroupView>> list(@PathVariable long databaseId) {
        return ResponseEntity.ok(groupService.listGroups(databaseId));
    }

    @PostMapping
    public ResponseEntity<QueryGroupView> create(
            @PathVariable long databaseId,
            @Valid @RequestBody QueryGroupRequest request,
            @RequestHeader(value = CallerIdentity.USER_HEADER, required = false) Long userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(groupService.createGroup(databaseId, callerIdentity.resolve(userId), request));
    }

    @PutMapping("/{groupId}")
    public ResponseEntity<QueryGroupView> update(@PathVariable long databaseId,
                                                 @PathVariable long groupId,
                                                 @Valid @RequestBody QueryGroupRequest request) {
        return ResponseEntity.ok(groupService.updateGroup(databaseId, groupId, request));
    }

    @DeleteMapping("/{groupId}")
    public ResponseEntity<Void> delete(@PathVariable long databaseId, @PathVariable long groupId) {
        groupService.deleteGroup(databaseId, groupId);
        return ResponseEntity.noContent().build();
    }
}
