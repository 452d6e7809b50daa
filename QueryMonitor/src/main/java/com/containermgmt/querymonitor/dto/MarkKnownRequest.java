package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class MarkKnownRequest {

    @JsonProperty("isKnown")
    private boolean known = true;
}
