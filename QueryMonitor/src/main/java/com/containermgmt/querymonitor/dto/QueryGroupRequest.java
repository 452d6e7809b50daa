package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class QueryGroupRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    private String description;

    @JsonProperty("isKnown")
    private boolean known;
}
