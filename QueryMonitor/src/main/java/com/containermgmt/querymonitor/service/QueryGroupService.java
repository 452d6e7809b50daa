package com.containermgmt.querymonitor.service;

import com.containermgmt.querymonitor.config.ActiveJDBCConfig;
import com.containermgmt.querymonitor.dto.QueryGroupRequest;
import com.containermgmt.querymonitor.dto.QueryGroupView;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import com.containermgmt.querymonitor.model.QueryGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CRUD for query groups. Deleting a group leaves its queries ungrouped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryGroupService {

    private final ActiveJDBCConfig activeJDBCConfig;
    private final Clock clock;

    public List<QueryGroupView> listGroups(long databaseId) {
        return activeJDBCConfig.withConnection(() -> QueryGroup.findByDatabase(databaseId).stream()
            .map(QueryGroupService::toView)
            .collect(Collectors.toList()));
    }

    public QueryGroupView getGroup(long databaseId, long groupId) {
        return activeJDBCConfig.withConnection(() -> toView(find(databaseId, groupId)));
    }

    public QueryGroupView createGroup(long databaseId, long userId, QueryGroupRequest request) {
        return activeJDBCConfig.withConnection(() -> {
            Timestamp now = Timestamp.from(clock.instant());
            QueryGroup group = new QueryGroup();
            group.set("database_id", databaseId);
            group.set("name", request.getName().trim());
            group.set("description", request.getDescription());
            group.set("is_known", request.isKnown());
            group.set("user_id", userId);
            group.set("created_at", now);
            group.set("updated_at", now);
            group.saveIt();
            log.info("Created query group {} '{}' on database {}", group.getId(), request.getName(), databaseId);
            return toView(group);
        });
    }

    public QueryGroupView updateGroup(long databaseId, long groupId, QueryGroupRequest request) {
        return activeJDBCConfig.withConnection(() -> {
            QueryGroup group = find(databaseId, groupId);
            group.set("name", request.getName().trim());
            group.set("description", request.getDescription());
            group.set("is_known", request.isKnown());
            group.set("updated_at", Timestamp.from(clock.instant()));
            group.saveIt();
            return toView(group);
        });
    }

    public void deleteGroup(long databaseId, long groupId) {
        activeJDBCConfig.withConnection(() -> {
            QueryGroup group = find(databaseId, groupId);
            group.delete();
            log.info("Deleted query group {} on database {}", groupId, databaseId);
        });
    }

    private static QueryGroup find(long databaseId, long groupId) {
        QueryGroup group = QueryGroup.findForDatabase(databaseId, groupId);
        if (group == null) {
            throw new ResourceNotFoundException("Query group", groupId);
        }
        return group;
    }

    private static QueryGroupView toView(QueryGroup group) {
        Timestamp created = group.getTimestamp("created_at");
        Timestamp updated = group.getTimestamp("updated_at");
        return QueryGroupView.builder()
            .id(group.getLongId())
            .databaseId(group.getLong("database_id"))
            .name(group.getString("name"))
            .description(group.getString("description"))
            .known(Boolean.TRUE.equals(group.getBoolean("is_known")))
            .createdAt(created != null ? created.toInstant() : null)
            .updatedAt(updated != null ? updated.toInstant() : null)
            .build();
    }
}
