package com.containermgmt.querymonitor.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one collection cycle.
 */
@Value
@Builder
public class CollectionResult {

    long databaseId;
    int rowsSeen;
    int rowsStored;
    int rowsSkipped;
    Instant collectedAt;
}
