package com.containermgmt.querymonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * QueryMonitor - Postgres query monitoring for the database dashboard
 *
 * Polls pg_stat_statements on the registered databases, groups literal
 * variants of the same statement under a normalized signature and exposes
 * the aggregates via REST API.
 *
 * Features:
 * - Background monitoring sessions, one per database, with optional end time
 * - SSH tunnelled connections, shared per instance
 * - Running query inspection and manual kill
 * - Continuous kill of every running query matching a signature
 */
@SpringBootApplication
public class QueryMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryMonitorApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
