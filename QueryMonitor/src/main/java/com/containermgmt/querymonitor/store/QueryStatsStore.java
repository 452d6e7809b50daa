package com.containermgmt.querymonitor.store;

import com.containermgmt.querymonitor.dto.DiscoveredQuery;
import com.containermgmt.querymonitor.dto.DiscoveredQueryFilter;
import com.containermgmt.querymonitor.dto.QueryInstanceView;
import com.containermgmt.querymonitor.dto.StatementStatsRow;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of normalized queries and their literal instances.
 *
 * Both upserts are keyed on content hashes, so concurrent collectors for the
 * same database converge on one row per signature and one row per raw text.
 */
public interface QueryStatsStore {

    /**
     * Inserts the normalized query or, if (databaseId, hash) exists, moves its
     * last_seen_at forward.
     *
     * @return id of the normalized query row
     */
    long upsertNormalizedQuery(long databaseId, String normalizedHash, String normalizedText, Instant seenAt);

    /**
     * Inserts the instance or overwrites the stats of the existing
     * (databaseId, queryHash) row with the latest snapshot.
     */
    void upsertQueryInstance(long databaseId, long normalizedQueryId, String queryText, String queryHash,
                             StatementStatsRow stats, Instant updatedAt);

    /**
     * Normalized queries matching {@code filter}, newest last_seen_at first.
     * last_seen_at is stamped in the same collection cycle as the instances'
     * last_updated_at, so this is also newest instance update first.
     * Aggregate fields are left empty.
     */
    List<DiscoveredQuery> findNormalizedQueries(long databaseId, DiscoveredQueryFilter filter, int limit);

    Optional<DiscoveredQuery> findNormalizedQuery(long databaseId, long normalizedQueryId);

    /**
     * Instances grouped by normalized query id.
     */
    Map<Long, List<QueryInstanceView>> findInstances(Collection<Long> normalizedQueryIds);

    boolean updateKnown(long databaseId, long normalizedQueryId, boolean known);

    boolean updateGroup(long databaseId, long normalizedQueryId, Long groupId);
}
