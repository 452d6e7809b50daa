package com.containermgmt.querymonitor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

/**
 * ActiveJDBC model for the instances table (read-only here: managed by the registry UI)
 */
@Table("instances")
@IdName("id")
@IdGenerator("nextval('instances_id_seq')")
public class Instance extends Model {

    public boolean usesSshTunnel() {
        return Boolean.TRUE.equals(getBoolean("use_ssh_tunnel"));
    }
}
