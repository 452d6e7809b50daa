package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryGroupView {

    private long id;
    private long databaseId;
    private String name;
    private String description;
    @JsonProperty("isKnown")
    private boolean known;
    private Instant createdAt;
    private Instant updatedAt;
}
