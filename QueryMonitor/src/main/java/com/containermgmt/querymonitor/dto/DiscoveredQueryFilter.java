package com.containermgmt.querymonitor.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filters for the discovered-query list. Null fields do not filter;
 * known queries are hidden unless showKnown is set.
 *
 * groupId is "ungrouped", "all_queries" or a numeric group id.
 */
@Value
@Builder
public class DiscoveredQueryFilter {

    public static final String UNGROUPED = "ungrouped";
    public static final String ALL_QUERIES = "all_queries";

    boolean showKnown;
    String groupId;
    Instant startDate;
    Instant endDate;
    String search;

    public static DiscoveredQueryFilter none() {
        return DiscoveredQueryFilter.builder().build();
    }
}
