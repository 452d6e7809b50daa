package com.containermgmt.querymonitor.store;

import com.containermgmt.querymonitor.config.ActiveJDBCConfig;
import com.containermgmt.querymonitor.dto.DiscoveredQuery;
import com.containermgmt.querymonitor.dto.DiscoveredQueryFilter;
import com.containermgmt.querymonitor.dto.QueryInstanceView;
import com.containermgmt.querymonitor.dto.StatementStatsRow;
import com.containermgmt.querymonitor.model.NormalizedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ActiveJDBC implementation over normalized_queries and collected_query_instances.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActiveJdbcQueryStatsStore implements QueryStatsStore {

    private static final String UPSERT_NORMALIZED_SQL = """
        INSERT INTO normalized_queries
            (database_id, normalized_text, normalized_hash, is_known, first_seen_at, last_seen_at)
        VALUES (?, ?, ?, FALSE, ?, ?)
        ON CONFLICT (database_id, normalized_hash) DO UPDATE
            SET last_seen_at = GREATEST(normalized_queries.last_seen_at, EXCLUDED.last_seen_at)
        RETURNING id
        """;

    private static final String UPSERT_INSTANCE_SQL = """
        INSERT INTO collected_query_instances
            (normalized_query_id, database_id, query_text, query_hash,
             calls, total_time, min_time, max_time, mean_time, last_updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (database_id, query_hash) DO UPDATE SET
            normalized_query_id = EXCLUDED.normalized_query_id,
            calls = EXCLUDED.calls,
            total_time = EXCLUDED.total_time,
            min_time = EXCLUDED.min_time,
            max_time = EXCLUDED.max_time,
            mean_time = EXCLUDED.mean_time,
            last_updated_at = EXCLUDED.last_updated_at
        """;

    private static final String SELECT_NORMALIZED = """
        SELECT id, database_id, normalized_text, normalized_hash, is_known, group_id,
               first_seen_at, last_seen_at
        FROM normalized_queries
        """;

    private final ActiveJDBCConfig activeJDBCConfig;

    @Override
    public long upsertNormalizedQuery(long databaseId, String normalizedHash, String normalizedText, Instant seenAt) {
        Timestamp ts = Timestamp.from(seenAt);
        return activeJDBCConfig.withConnection(() -> {
            Object id = Base.firstCell(UPSERT_NORMALIZED_SQL, databaseId, normalizedText, normalizedHash, ts, ts);
            return ((Number) id).longValue();
        });
    }

    @Override
    public void upsertQueryInstance(long databaseId, long normalizedQueryId, String queryText, String queryHash,
                                    StatementStatsRow stats, Instant updatedAt) {
        activeJDBCConfig.withConnection(() -> {
            Base.exec(UPSERT_INSTANCE_SQL,
                normalizedQueryId,
                databaseId,
                queryText,
                queryHash,
                stats.getCalls(),
                stats.getTotalTime(),
                stats.getMinTime(),
                stats.getMaxTime(),
                stats.getMeanTime(),
                Timestamp.from(updatedAt));
        });
    }

    @Override
    public List<DiscoveredQuery> findNormalizedQueries(long databaseId, DiscoveredQueryFilter filter, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_NORMALIZED).append("WHERE database_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(databaseId);

        appendFilter(sql, params, filter);

        // last_seen_at moves with the newest instance last_updated_at
        sql.append(" ORDER BY last_seen_at DESC LIMIT ?");
        params.add(limit);

        return activeJDBCConfig.withConnection(() -> Base.findAll(sql.toString(), params.toArray()).stream()
            .map(ActiveJdbcQueryStatsStore::toDiscoveredQuery)
            .collect(Collectors.toList()));
    }

    @Override
    public Optional<DiscoveredQuery> findNormalizedQuery(long databaseId, long normalizedQueryId) {
        return activeJDBCConfig.withConnection(() -> {
            List<Map<String, Object>> rows = Base.findAll(
                SELECT_NORMALIZED + "WHERE database_id = ? AND id = ?", databaseId, normalizedQueryId);
            return rows.stream().findFirst().map(ActiveJdbcQueryStatsStore::toDiscoveredQuery);
        });
    }

    @Override
    public Map<Long, List<QueryInstanceView>> findInstances(Collection<Long> normalizedQueryIds) {
        if (normalizedQueryIds.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = normalizedQueryIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT id, normalized_query_id, database_id, query_text, query_hash, calls, total_time, "
            + "min_time, max_time, mean_time, last_updated_at "
            + "FROM collected_query_instances WHERE normalized_query_id IN (" + placeholders + ") "
            + "ORDER BY last_updated_at DESC";

        return activeJDBCConfig.withConnection(() -> {
            Map<Long, List<QueryInstanceView>> byQuery = new LinkedHashMap<>();
            for (Map<String, Object> row : Base.findAll(sql, normalizedQueryIds.toArray())) {
                QueryInstanceView view = toInstanceView(row);
                byQuery.computeIfAbsent(view.getNormalizedQueryId(), k -> new ArrayList<>()).add(view);
            }
            return byQuery;
        });
    }

    @Override
    public boolean updateKnown(long databaseId, long normalizedQueryId, boolean known) {
        return activeJDBCConfig.withConnection(() -> {
            NormalizedQuery query = NormalizedQuery.findForDatabase(databaseId, normalizedQueryId);
            if (query == null) {
                return false;
            }
            query.set("is_known", known);
            return query.saveIt();
        });
    }

    @Override
    public boolean updateGroup(long databaseId, long normalizedQueryId, Long groupId) {
        return activeJDBCConfig.withConnection(() -> {
            NormalizedQuery query = NormalizedQuery.findForDatabase(databaseId, normalizedQueryId);
            if (query == null) {
                return false;
            }
            query.set("group_id", groupId);
            return query.saveIt();
        });
    }

    private static void appendFilter(StringBuilder sql, List<Object> params, DiscoveredQueryFilter filter) {
        if (!filter.isShowKnown()) {
            sql.append(" AND is_known = FALSE");
        }

        String groupId = filter.getGroupId();
        if (DiscoveredQueryFilter.UNGROUPED.equals(groupId)) {
            sql.append(" AND group_id IS NULL");
        } else if (StringUtils.isNotBlank(groupId) && !DiscoveredQueryFilter.ALL_QUERIES.equals(groupId)) {
            sql.append(" AND group_id = ?");
            params.add(Long.parseLong(groupId));
        }

        if (filter.getStartDate() != null) {
            sql.append(" AND last_seen_at >= ?");
            params.add(Timestamp.from(filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            sql.append(" AND last_seen_at <= ?");
            params.add(Timestamp.from(filter.getEndDate()));
        }

        if (StringUtils.isNotBlank(filter.getSearch())) {
            sql.append(" AND normalized_text ILIKE ?");
            params.add("%" + escapeLike(filter.getSearch().trim()) + "%");
        }
    }

    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static DiscoveredQuery toDiscoveredQuery(Map<String, Object> row) {
        Object groupId = row.get("group_id");
        return DiscoveredQuery.builder()
            .id(((Number) row.get("id")).longValue())
            .databaseId(((Number) row.get("database_id")).longValue())
            .normalizedText((String) row.get("normalized_text"))
            .normalizedHash((String) row.get("normalized_hash"))
            .known(Boolean.TRUE.equals(row.get("is_known")))
            .groupId(groupId != null ? ((Number) groupId).longValue() : null)
            .firstSeenAt(toInstant(row.get("first_seen_at")))
            .lastSeenAt(toInstant(row.get("last_seen_at")))
            .build();
    }

    private static QueryInstanceView toInstanceView(Map<String, Object> row) {
        return QueryInstanceView.builder()
            .id(((Number) row.get("id")).longValue())
            .normalizedQueryId(((Number) row.get("normalized_query_id")).longValue())
            .databaseId(((Number) row.get("database_id")).longValue())
            .queryText((String) row.get("query_text"))
            .queryHash((String) row.get("query_hash"))
            .calls(((Number) row.get("calls")).longValue())
            .totalTime(((Number) row.get("total_time")).doubleValue())
            .minTime(((Number) row.get("min_time")).doubleValue())
            .maxTime(((Number) row.get("max_time")).doubleValue())
            .meanTime(((Number) row.get("mean_time")).doubleValue())
            .lastUpdatedAt(toInstant(row.get("last_updated_at")))
            .build();
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof java.util.Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        return null;
    }
}
