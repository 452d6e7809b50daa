package com.containermgmt.querymonitor.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

/**
 * Target of the continuous kill loop.
 *
 * {@code signature} is used as given. {@code query} is raw SQL and is
 * normalized server-side; it is only read when no signature is sent.
 */
@Data
public class ContinuousKillRequest {

    private String signature;

    private String query;

    @JsonIgnore
    @AssertTrue(message = "signature or query is required")
    public boolean isTargetPresent() {
        return StringUtils.isNotBlank(signature) || StringUtils.isNotBlank(query);
    }
}
