package com.containermgmt.querymonitor.registry;

import com.containermgmt.querymonitor.connection.ConnectionConfig;

/**
 * Lookup of the databases the dashboard manages. Instances and databases
 * are edited elsewhere; this core only reads them.
 */
public interface DatabaseRegistry {

    /**
     * @throws com.containermgmt.querymonitor.exception.ResourceNotFoundException
     *         when the database does not exist or is archived
     */
    ConnectionConfig resolve(long databaseId);
}
