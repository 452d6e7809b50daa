package com.containermgmt.querymonitor.service;

import com.containermgmt.querymonitor.collector.QueryAggregator;
import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import com.containermgmt.querymonitor.dto.DiscoveredQuery;
import com.containermgmt.querymonitor.dto.DiscoveredQueryFilter;
import com.containermgmt.querymonitor.dto.QueryInstanceView;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import com.containermgmt.querymonitor.store.QueryStatsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the collected statistics: normalized queries with their
 * instances folded in, plus the known / group flags operators set on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveredQueryService {

    private final QueryStatsStore store;
    private final QueryGroupService groupService;
    private final QueryMonitorProperties properties;

    /**
     * Discovered queries of a database, most recently seen first, capped at
     * the configured maximum. A store failure yields an empty list.
     */
    public List<DiscoveredQuery> getDiscoveredQueries(long databaseId, DiscoveredQueryFilter filter) {
        validateGroupFilter(filter.getGroupId());

        try {
            List<DiscoveredQuery> queries = store.findNormalizedQueries(
                databaseId, filter, properties.getDiscovery().getMaxResults());
            if (queries.isEmpty()) {
                return queries;
            }

            List<Long> ids = queries.stream().map(DiscoveredQuery::getId).collect(Collectors.toList());
            Map<Long, List<QueryInstanceView>> instances = store.findInstances(ids);

            return queries.stream()
                .map(q -> QueryAggregator.aggregate(q, instances.getOrDefault(q.getId(), List.of())))
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("Failed to read discovered queries for database {}: {}", databaseId, e.getMessage());
            return Collections.emptyList();
        }
    }

    public DiscoveredQuery getDiscoveredQuery(long databaseId, long queryId) {
        DiscoveredQuery query = store.findNormalizedQuery(databaseId, queryId)
            .orElseThrow(() -> new ResourceNotFoundException("Query", queryId));
        List<QueryInstanceView> instances = store.findInstances(List.of(queryId)).getOrDefault(queryId, List.of());
        return QueryAggregator.aggregate(query, instances);
    }

    /**
     * Literal instances of one normalized query, most recently updated first.
     */
    public List<QueryInstanceView> getQueryInstances(long databaseId, long queryId) {
        store.findNormalizedQuery(databaseId, queryId)
            .orElseThrow(() -> new ResourceNotFoundException("Query", queryId));
        return store.findInstances(List.of(queryId)).getOrDefault(queryId, List.of());
    }

    public DiscoveredQuery markQueryKnown(long databaseId, long queryId, boolean known) {
        if (!store.updateKnown(databaseId, queryId, known)) {
            throw new ResourceNotFoundException("Query", queryId);
        }
        log.info("Query {} of database {} marked {}", queryId, databaseId, known ? "known" : "unknown");
        return getDiscoveredQuery(databaseId, queryId);
    }

    /**
     * Moves a query into {@code groupId}, or out of any group when it is null.
     */
    public DiscoveredQuery assignQueryGroup(long databaseId, long queryId, Long groupId) {
        if (groupId != null) {
            groupService.getGroup(databaseId, groupId);
        }
        if (!store.updateGroup(databaseId, queryId, groupId)) {
            throw new ResourceNotFoundException("Query", queryId);
        }
        log.info("Query {} of database {} assigned to group {}", queryId, databaseId, groupId);
        return getDiscoveredQuery(databaseId, queryId);
    }

    private static void validateGroupFilter(String groupId) {
        if (StringUtils.isBlank(groupId)
            || DiscoveredQueryFilter.UNGROUPED.equals(groupId)
            || DiscoveredQueryFilter.ALL_QUERIES.equals(groupId)) {
            return;
        }
        if (!StringUtils.isNumeric(groupId)) {
            throw new IllegalArgumentException("groupId must be a number, 'ungrouped' or 'all_queries'");
        }
    }
}
