package com.containermgmt.querymonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One pg_stat_statements row: raw statement text and its cumulative counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementStatsRow {

    private String queryText;
    private long calls;
    private double totalTime;
    private double minTime;
    private double maxTime;
    private double meanTime;

    /**
     * Maps a result row of the statement stats query.
     *
     * @throws IllegalArgumentException when the text is missing or a counter is not numeric
     */
    public static StatementStatsRow fromRow(Map<String, Object> row) {
        Object query = row.get("query");
        if (!(query instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("statement row without query text");
        }
        return StatementStatsRow.builder()
            .queryText(text)
            .calls(number(row, "calls").longValue())
            .totalTime(number(row, "total_exec_time").doubleValue())
            .minTime(number(row, "min_exec_time").doubleValue())
            .maxTime(number(row, "max_exec_time").doubleValue())
            .meanTime(number(row, "mean_exec_time").doubleValue())
            .build();
    }

    private static Number number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("column " + column + " is not numeric: " + value);
    }
}
