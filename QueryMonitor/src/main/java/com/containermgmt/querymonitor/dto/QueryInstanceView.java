package com.containermgmt.querymonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryInstanceView {

    private long id;
    private long normalizedQueryId;
    private long databaseId;
    private String queryText;
    private String queryHash;
    private long calls;
    private double totalTime;
    private double minTime;
    private double maxTime;
    private double meanTime;
    private Instant lastUpdatedAt;
}
