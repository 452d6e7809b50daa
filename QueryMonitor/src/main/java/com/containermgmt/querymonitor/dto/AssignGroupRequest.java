package com.containermgmt.querymonitor.dto;

import lombok.Data;

/**
 * A null groupId removes the query from its group.
 */
@Data
public class AssignGroupRequest {

    private Long groupId;
}
