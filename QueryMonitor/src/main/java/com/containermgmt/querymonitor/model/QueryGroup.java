package com.containermgmt.querymonitor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.util.List;

/**
 * ActiveJDBC model for query_groups
 */
@Table("query_groups")
@IdName("id")
@IdGenerator("nextval('query_groups_id_seq')")
public class QueryGroup extends Model {

    static {
        validatePresenceOf("database_id", "name");
    }

    public static List<QueryGroup> findByDatabase(long databaseId) {
        return where("database_id = ?", databaseId).orderBy("name");
    }

    public static QueryGroup findForDatabase(long databaseId, long id) {
        return findFirst("id = ? AND database_id = ?", id, databaseId);
    }
}
