package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A normalized query with statistics aggregated over its literal instances.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredQuery {

    private long id;
    private long databaseId;
    private String normalizedText;
    private String normalizedHash;
    @JsonProperty("isKnown")
    private boolean known;
    private Long groupId;
    private Instant firstSeenAt;
    private Instant lastSeenAt;

    private int instanceCount;
    private long callCount;
    private double totalTime;
    private double minTime;
    private double maxTime;
    private double meanTime;
    private String sampleQueryText;
}
