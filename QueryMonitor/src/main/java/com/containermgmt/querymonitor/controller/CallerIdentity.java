package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.config.QueryMonitorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the acting user from the X-User-Id header set by the auth layer.
 */
@Component
@RequiredArgsConstructor
public class CallerIdentity {

    public static final String USER_HEADER = "X-User-Id";

    private final QueryMonitorProperties properties;

    public long resolve(Long headerUserId) {
        return headerUserId != null ? headerUserId : properties.getDefaultUserId();
    }
}
