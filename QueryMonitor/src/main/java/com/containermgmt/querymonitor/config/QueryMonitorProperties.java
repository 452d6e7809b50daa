package com.containermgmt.querymonitor.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Typed binding for all query-monitor.* configuration.
 * Timeouts are deployment parameters; defaults suit a LAN deployment.
 */
@Configuration
@ConfigurationProperties(prefix = "query-monitor")
@Validated
@Data
public class QueryMonitorProperties {

    /** User id recorded in the audit log when the caller sends no identity. */
    private long defaultUserId = 1;

    private Monitoring monitoring = new Monitoring();

    private Collector collector = new Collector();

    private Discovery discovery = new Discovery();

    private ContinuousKill continuousKill = new ContinuousKill();

    private Connection connection = new Connection();

    private Ssh ssh = new Ssh();

    @Data
    public static class Monitoring {
        /** Polling interval used when a start request does not specify one. */
        @Min(1)
        private int defaultPollingIntervalSeconds = 60;

        /** Threads shared by all monitoring sessions. */
        @Min(1)
        private int workerThreads = 4;

        /** Resume sessions left running by a previous process. */
        private boolean resumeOnStartup = true;

        /** Pool the target connection across cycles of the same session. */
        private boolean usePool = false;
    }

    @Data
    public static class Collector {
        /** Statements fetched from pg_stat_statements per cycle. */
        @Min(1)
        private int statementLimit = 100;
    }

    @Data
    public static class Discovery {
        @Min(1)
        private int maxResults = 100;
    }

    @Data
    public static class ContinuousKill {
        @Min(100)
        private long intervalMs = 2000;

        /** Length of the signature prefix compared by the kill loop. */
        @Min(1)
        private int signatureLength = 80;
    }

    @Data
    public static class Connection {
        @Min(1)
        private int connectTimeoutSeconds = 10;

        @Min(1)
        private int socketTimeoutSeconds = 60;

        /** Per-statement timeout for stats, activity and kill queries. */
        @Min(1)
        private int queryTimeoutSeconds = 30;

        @Min(1)
        private int maxPoolSize = 2;

        @NotBlank
        private String applicationName = "query-monitor";
    }

    @Data
    public static class Ssh {
        @Min(1)
        private int connectTimeoutMs = 15000;

        @Min(1)
        private int channelConnectTimeoutMs = 10000;

        private int serverAliveIntervalMs = 30000;

        /** "yes" requires the host key in knownHostsFile. */
        @NotBlank
        private String strictHostKeyChecking = "no";

        private String knownHostsFile;
    }
}
