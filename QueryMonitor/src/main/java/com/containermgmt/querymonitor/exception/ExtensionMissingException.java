package com.containermgmt.querymonitor.exception;

/**
 * pg_stat_statements is not installed on the monitored database.
 */
public class ExtensionMissingException extends QueryMonitorException {

    private final String extension;

    public ExtensionMissingException(String extension) {
        super(extension + " extension is not installed");
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

}
