package com.containermgmt.querymonitor.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.time.Instant;

/**
 * Body of a start request. Both fields are optional.
 */
@Data
public class StartMonitoringRequest {

    @Min(1)
    private Integer pollingIntervalSeconds;

    private Instant scheduledEndTime;
}
