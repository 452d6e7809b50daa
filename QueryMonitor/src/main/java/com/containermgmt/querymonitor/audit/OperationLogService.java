package com.containermgmt.querymonitor.audit;

import com.containermgmt.querymonitor.config.ActiveJDBCConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;

/**
 * Writes operator actions to database_operation_logs.
 *
 * Audit failures are logged and never propagated: a kill that succeeded is
 * not reported as failed because its audit row could not be written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationLogService {

    private static final String INSERT_SQL = """
        INSERT INTO database_operation_logs
            (database_id, user_id, operation_type, operation_result, details, timestamp)
        VALUES (?, ?, ?, ?, ?::jsonb, ?)
        """;

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    private final ActiveJDBCConfig activeJDBCConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(long databaseId, long userId, OperationType type, boolean success, Map<String, Object> details) {
        try {
            String json = objectMapper.writeValueAsString(details);
            activeJDBCConfig.withConnection(() -> {
                Base.exec(INSERT_SQL, databaseId, userId, type.getCode(),
                    success ? SUCCESS : FAILED, json, Timestamp.from(clock.instant()));
            });
            log.debug("Audit {} on database {} by user {}: {}", type.getCode(), databaseId, userId,
                success ? SUCCESS : FAILED);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to write audit record {} for database {}: {}", type.getCode(), databaseId, e.getMessage());
        }
    }
}
