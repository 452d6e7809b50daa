package com.containermgmt.querymonitor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.util.List;

/**
 * ActiveJDBC model for query_monitoring_sessions
 */
@Table("query_monitoring_sessions")
@IdName("id")
@IdGenerator("nextval('query_monitoring_sessions_id_seq')")
public class MonitoringSession extends Model {

    public static MonitoringSession findRunningForDatabase(long databaseId) {
        List<MonitoringSession> sessions = where("database_id = ? AND status = 'running'", databaseId)
            .orderBy("started_at DESC")
            .limit(1);
        return sessions.isEmpty() ? null : sessions.get(0);
    }

    public static List<MonitoringSession> findAllRunning() {
        return where("status = 'running'").orderBy("started_at");
    }
}
