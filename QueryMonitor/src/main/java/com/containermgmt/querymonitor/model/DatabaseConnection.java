package com.containermgmt.querymonitor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

/**
 * ActiveJDBC model for the database_connections table.
 * A database belongs to an instance and may carry its own SSH tunnel settings.
 */
@Table("database_connections")
@IdName("id")
@IdGenerator("nextval('database_connections_id_seq')")
public class DatabaseConnection extends Model {

    public static DatabaseConnection findActive(long id) {
        return findFirst("id = ? AND archived = FALSE", id);
    }

    public Instance findInstance() {
        return Instance.findById(get("instance_id"));
    }

    public boolean usesSshTunnel() {
        return Boolean.TRUE.equals(getBoolean("use_ssh_tunnel"));
    }
}
