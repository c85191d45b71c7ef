package com.delta.siteaudit.job.persistence;

import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.model.NewAuditJob;
import com.delta.siteaudit.job.model.StatusHistoryEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job store. Every state change is a single conditional UPDATE whose WHERE clause carries the
 * expected status (and, once claimed, the owning worker and run number); a write that matches
 * no row lost the race and reports false.
 */
@Repository
public class AuditJobRepository {
    private static final Logger log = LoggerFactory.getLogger(AuditJobRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final List<String> RUNNING = JobStatus.RUNNING.stream().map(Enum::name).toList();
    private static final List<String> RETRYABLE = List.of(JobStatus.FAILED.name(), JobStatus.COMPLETED.name());

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditJob> jobRowMapper = this::mapJob;

    public AuditJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public String insert(NewAuditJob job) {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("targetDomain", job.targetDomain())
            .addValue("comparisonDomains", writeList(job.comparisonDomains()))
            .addValue("locale", job.locale())
            .addValue("context", job.businessContext())
            .addValue("status", JobStatus.PENDING.name())
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                INSERT INTO audit_jobs (
                    id, target_domain, comparison_domains, locale, business_context,
                    status, current_stage, progress_percent, run_number, total_pages,
                    created_at, updated_at
                )
                VALUES (
                    :id, :targetDomain, :comparisonDomains, :locale, :context,
                    :status, 'queued', 0, 1, 0,
                    :now, :now
                )
                """,
            params
        );
        recordStatus(id, 1, JobStatus.PENDING, now);
        return id;
    }

    public Optional<AuditJob> findById(String jobId) {
        List<AuditJob> rows = jdbc.query(
            """
                SELECT *
                FROM audit_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", jobId),
            jobRowMapper
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<String> findPendingJobIds(int limit) {
        return jdbc.queryForList(
            """
                SELECT id
                FROM audit_jobs
                WHERE status = 'PENDING'
                ORDER BY updated_at ASC, created_at ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            String.class
        );
    }

    public int countByStatus(JobStatus status) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM audit_jobs WHERE status = :status",
            new MapSqlParameterSource("status", status.name()),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    /**
     * Moves a PENDING job to CRAWLING under this worker. Exactly one concurrent caller can
     * see an affected row.
     */
    @Transactional
    public Optional<ClaimedJob> claim(String jobId, String workerId) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("workerId", workerId)
            .addValue("next", JobStatus.CRAWLING.name())
            .addValue("progress", JobStatus.PENDING.entryProgress())
            .addValue("now", Timestamp.from(now));
        int updated;
        try {
            updated = jdbc.update(
                """
                    UPDATE audit_jobs
                    SET status = :next,
                        current_stage = 'claimed',
                        progress_percent = :progress,
                        worker_id = :workerId,
                        claimed_at = :now,
                        heartbeat_at = :now,
                        updated_at = :now
                    WHERE id = :id
                      AND status = 'PENDING'
                    """,
                params
            );
        } catch (ConcurrencyFailureException e) {
            log.debug("Lost claim race for job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
        if (updated != 1) {
            return Optional.empty();
        }
        AuditJob job = findById(jobId).orElseThrow();
        recordStatus(jobId, job.runNumber(), JobStatus.CRAWLING, now);
        return Optional.of(new ClaimedJob(job, workerId));
    }

    @Transactional
    public boolean advance(ClaimedJob claimed, JobStatus from, JobStatus to, String stage) {
        if (!from.canTransitionTo(to) || to == JobStatus.FAILED) {
            throw new IllegalArgumentException("Illegal transition " + from + " -> " + to);
        }
        Instant now = Instant.now();
        MapSqlParameterSource params = ownedParams(claimed, now)
            .addValue("from", from.name())
            .addValue("to", to.name())
            .addValue("stage", stage)
            .addValue("progress", to.entryProgress());
        int updated = jdbc.update(
            """
                UPDATE audit_jobs
                SET status = :to,
                    current_stage = :stage,
                    progress_percent = :progress,
                    heartbeat_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = :from
                  AND worker_id = :workerId
                  AND run_number = :runNumber
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        recordStatus(claimed.jobId(), claimed.runNumber(), to, now);
        return true;
    }

    public boolean updateProgress(ClaimedJob claimed, JobStatus status, String stage, int progress) {
        MapSqlParameterSource params = ownedParams(claimed, Instant.now())
            .addValue("status", status.name())
            .addValue("stage", stage)
            .addValue("progress", Math.max(0, Math.min(100, progress)));
        return jdbc.update(
            """
                UPDATE audit_jobs
                SET current_stage = :stage,
                    progress_percent = :progress,
                    heartbeat_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = :status
                  AND worker_id = :workerId
                  AND run_number = :runNumber
                """,
            params
        ) == 1;
    }

    public boolean heartbeat(ClaimedJob claimed) {
        MapSqlParameterSource params = ownedParams(claimed, Instant.now())
            .addValue("running", RUNNING);
        return jdbc.update(
            """
                UPDATE audit_jobs
                SET heartbeat_at = :now
                WHERE id = :id
                  AND status IN (:running)
                  AND worker_id = :workerId
                  AND run_number = :runNumber
                """,
            params
        ) == 1;
    }

    public boolean recordCrawlOutcome(ClaimedJob claimed, int totalPages, String diagnosticsJson) {
        MapSqlParameterSource params = ownedParams(claimed, Instant.now())
            .addValue("totalPages", totalPages)
            .addValue("diagnostics", diagnosticsJson);
        return jdbc.update(
            """
                UPDATE audit_jobs
                SET total_pages = :totalPages,
                    crawl_diagnostics = :diagnostics,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'CRAWLING'
                  AND worker_id = :workerId
                  AND run_number = :runNumber
                """,
            params
        ) == 1;
    }

    @Transactional
    public boolean markCompleted(ClaimedJob claimed) {
        return advance(claimed, JobStatus.ASSEMBLING, JobStatus.COMPLETED, "completed");
    }

    /**
     * Fails a job this worker still owns. {@code errorStage} is the status the job was in when
     * the failure happened; {@code message} must already be safe to show to callers.
     */
    @Transactional
    public boolean markFailed(ClaimedJob claimed, JobStatus errorStage, String message) {
        Instant now = Instant.now();
        MapSqlParameterSource params = ownedParams(claimed, now)
            .addValue("running", RUNNING)
            .addValue("errorStage", errorStage.name())
            .addValue("message", message);
        int updated = jdbc.update(
            """
                UPDATE audit_jobs
                SET status = 'FAILED',
                    current_stage = 'failed',
                    error_stage = :errorStage,
                    error_message = :message,
                    updated_at = :now
                WHERE id = :id
                  AND status IN (:running)
                  AND worker_id = :workerId
                  AND run_number = :runNumber
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        recordStatus(claimed.jobId(), claimed.runNumber(), JobStatus.FAILED, now);
        return true;
    }

    /**
     * Puts a FAILED or COMPLETED job back to PENDING as a new run. Returns false, changing
     * nothing, for a job that is already pending or running.
     */
    @Transactional
    public boolean resetForRetry(String jobId) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("retryable", RETRYABLE)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE audit_jobs
                SET status = 'PENDING',
                    current_stage = 'queued',
                    progress_percent = 0,
                    error_stage = NULL,
                    error_message = NULL,
                    worker_id = NULL,
                    claimed_at = NULL,
                    heartbeat_at = NULL,
                    total_pages = 0,
                    crawl_diagnostics = NULL,
                    run_number = run_number + 1,
                    updated_at = :now
                WHERE id = :id
                  AND status IN (:retryable)
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        int runNumber = findById(jobId).map(AuditJob::runNumber).orElseThrow();
        recordStatus(jobId, runNumber, JobStatus.PENDING, now);
        return true;
    }

    public List<AuditJob> findStaleRunningJobs(Instant heartbeatCutoff) {
        return jdbc.query(
            """
                SELECT *
                FROM audit_jobs
                WHERE status IN (:running)
                  AND (heartbeat_at IS NULL OR heartbeat_at < :cutoff)
                ORDER BY updated_at ASC
                """,
            new MapSqlParameterSource()
                .addValue("running", RUNNING)
                .addValue("cutoff", Timestamp.from(heartbeatCutoff)),
            jobRowMapper
        );
    }

    /**
     * Fails a job whose worker stopped heart-beating, provided nothing about it changed since
     * it was read.
     */
    @Transactional
    public boolean failStale(AuditJob job, Instant heartbeatCutoff, String message) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("status", job.status().name())
            .addValue("runNumber", job.runNumber())
            .addValue("cutoff", Timestamp.from(heartbeatCutoff))
            .addValue("message", message)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE audit_jobs
                SET status = 'FAILED',
                    current_stage = 'failed',
                    error_stage = :status,
                    error_message = :message,
                    updated_at = :now
                WHERE id = :id
                  AND status = :status
                  AND run_number = :runNumber
                  AND (heartbeat_at IS NULL OR heartbeat_at < :cutoff)
                """,
            params
        );
        if (updated != 1) {
            return false;
        }
        recordStatus(job.id(), job.runNumber(), JobStatus.FAILED, now);
        return true;
    }

    public List<StatusHistoryEntry> statusHistory(String jobId, int runNumber) {
        return jdbc.query(
            """
                SELECT job_id, run_number, status, recorded_at
                FROM audit_job_status_history
                WHERE job_id = :id
                  AND run_number = :runNumber
                ORDER BY id ASC
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("runNumber", runNumber),
            (rs, rowNum) -> new StatusHistoryEntry(
                rs.getString("job_id"),
                rs.getInt("run_number"),
                JobStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("recorded_at"))
            )
        );
    }

    private void recordStatus(String jobId, int runNumber, JobStatus status, Instant at) {
        jdbc.update(
            """
                INSERT INTO audit_job_status_history (job_id, run_number, status, recorded_at)
                VALUES (:id, :runNumber, :status, :at)
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("runNumber", runNumber)
                .addValue("status", status.name())
                .addValue("at", Timestamp.from(at))
        );
    }

    private MapSqlParameterSource ownedParams(ClaimedJob claimed, Instant now) {
        return new MapSqlParameterSource()
            .addValue("id", claimed.jobId())
            .addValue("workerId", claimed.workerId())
            .addValue("runNumber", claimed.runNumber())
            .addValue("now", Timestamp.from(now));
    }

    private AuditJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        String errorStage = rs.getString("error_stage");
        return new AuditJob(
            rs.getString("id"),
            rs.getString("target_domain"),
            readList(rs.getString("comparison_domains")),
            rs.getString("locale"),
            rs.getString("business_context"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("current_stage"),
            rs.getInt("progress_percent"),
            errorStage == null ? null : JobStatus.valueOf(errorStage),
            rs.getString("error_message"),
            rs.getString("worker_id"),
            toInstant(rs.getTimestamp("claimed_at")),
            toInstant(rs.getTimestamp("heartbeat_at")),
            rs.getInt("run_number"),
            rs.getInt("total_pages"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize domain list", e);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt comparison_domains column", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
