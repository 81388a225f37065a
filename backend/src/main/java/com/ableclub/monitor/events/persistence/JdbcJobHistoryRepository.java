package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.JobExecutionRecord;
import com.ableclub.monitor.events.model.JobExecutionStats;
import com.ableclub.monitor.events.model.JobOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ledger of job cycles. Rows are written once, after the cycle has finished,
 * and only ever removed by the retention sweep.
 */
@Repository
public class JdbcJobHistoryRepository implements JobHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobHistoryRepository.class);
    private static final TypeReference<Map<String, Integer>> MAP_INT = new TypeReference<>() {};
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int RECENT_FAILURE_LIMIT = 3;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<JobExecutionRecord> recordMapper;

    public JdbcJobHistoryRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.recordMapper = (rs, rowNum) -> new JobExecutionRecord(
            rs.getLong("id"),
            rs.getString("job_name"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getLong("duration_ms"),
            JobOutcome.fromCode(rs.getString("outcome")),
            rs.getInt("attempts"),
            rs.getString("error_summary"),
            readResultData(rs.getString("result_data"))
        );
    }

    @Override
    public long append(JobExecutionRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobName", record.jobName())
            .addValue("startedAt", Timestamp.from(record.startedAt()))
            .addValue("finishedAt", Timestamp.from(record.finishedAt()))
            .addValue("durationMs", record.durationMs())
            .addValue("outcome", record.outcome().name())
            .addValue("attempts", record.attempts())
            .addValue("errorSummary", truncate(record.errorSummary()))
            .addValue("resultData", writeResultData(record.resultData()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_execution_history (
                    job_name,
                    started_at,
                    finished_at,
                    duration_ms,
                    outcome,
                    attempts,
                    error_summary,
                    result_data
                )
                VALUES (
                    :jobName,
                    :startedAt,
                    :finishedAt,
                    :durationMs,
                    :outcome,
                    :attempts,
                    :errorSummary,
                    :resultData
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbc.update(
            """
                DELETE FROM job_execution_history
                WHERE finished_at < :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", Timestamp.from(cutoff))
        );
    }

    public List<JobExecutionRecord> findRecent(String jobName, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobName", jobName)
            .addValue("limit", limit);
        return jdbc.query(
            """
                SELECT id,
                       job_name,
                       started_at,
                       finished_at,
                       duration_ms,
                       outcome,
                       attempts,
                       error_summary,
                       result_data
                FROM job_execution_history
                WHERE job_name = :jobName
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            recordMapper
        );
    }

    public JobExecutionRecord findLatest(String jobName) {
        List<JobExecutionRecord> records = findRecent(jobName, 1);
        return records.isEmpty() ? null : records.get(0);
    }

    public JobExecutionRecord findById(String jobName, long id) {
        List<JobExecutionRecord> records = jdbc.query(
            """
                SELECT id,
                       job_name,
                       started_at,
                       finished_at,
                       duration_ms,
                       outcome,
                       attempts,
                       error_summary,
                       result_data
                FROM job_execution_history
                WHERE id = :id
                  AND job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("jobName", jobName),
            recordMapper
        );
        return records.isEmpty() ? null : records.get(0);
    }

    public JobExecutionStats computeStats(String jobName, Instant since, int days) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobName", jobName)
            .addValue("since", Timestamp.from(since))
            .addValue("limit", RECENT_FAILURE_LIMIT);

        long[] totals = new long[3];
        double[] avgDuration = new double[1];
        jdbc.query(
            """
                SELECT COUNT(*) AS total,
                       SUM(CASE WHEN outcome = 'SUCCESS' THEN 1 ELSE 0 END) AS successes,
                       SUM(CASE WHEN outcome = 'FAILURE' THEN 1 ELSE 0 END) AS failures,
                       AVG(CASE WHEN outcome = 'SUCCESS' THEN duration_ms END) AS avg_success_ms
                FROM job_execution_history
                WHERE job_name = :jobName
                  AND started_at >= :since
                """,
            params,
            rs -> {
                totals[0] = rs.getLong("total");
                totals[1] = rs.getLong("successes");
                totals[2] = rs.getLong("failures");
                avgDuration[0] = rs.getDouble("avg_success_ms");
            }
        );

        List<String> recentFailures = jdbc.query(
            """
                SELECT error_summary
                FROM job_execution_history
                WHERE job_name = :jobName
                  AND started_at >= :since
                  AND outcome = 'FAILURE'
                  AND error_summary IS NOT NULL
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getString("error_summary")
        );

        double successRate = totals[0] == 0 ? 0.0 : Math.round(totals[1] * 1000.0 / totals[0]) / 10.0;
        double averageMs = Math.round(avgDuration[0] * 10.0) / 10.0;
        return new JobExecutionStats(
            jobName,
            days,
            totals[0],
            totals[1],
            totals[2],
            successRate,
            averageMs,
            recentFailures
        );
    }

    private String writeResultData(Map<String, Integer> resultData) {
        if (resultData == null || resultData.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(resultData);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize job result data {}", resultData, e);
            return null;
        }
    }

    private Map<String, Integer> readResultData(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_INT);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable job result data", e);
            return Map.of();
        }
    }

    private String truncate(String detail) {
        if (detail == null) {
            return null;
        }
        String trimmed = detail.trim();
        if (trimmed.length() <= MAX_ERROR_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_LENGTH);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
