package com.containermgmt.querymonitor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

/**
 * ActiveJDBC model for normalized_queries: one row per (database, signature).
 */
@Table("normalized_queries")
@IdName("id")
@IdGenerator("nextval('normalized_queries_id_seq')")
public class NormalizedQuery extends Model {

    public static NormalizedQuery findForDatabase(long databaseId, long id) {
        return findFirst("id = ? AND database_id = ?", id, databaseId);
    }
}
