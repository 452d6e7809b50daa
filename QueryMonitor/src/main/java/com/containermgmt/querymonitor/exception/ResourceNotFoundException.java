package com.containermgmt.querymonitor.exception;

public class ResourceNotFoundException extends QueryMonitorException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }

}
