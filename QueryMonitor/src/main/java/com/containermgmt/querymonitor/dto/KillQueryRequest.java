package com.containermgmt.querymonitor.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class KillQueryRequest {

    @NotNull
    @Positive
    private Integer pid;
}
