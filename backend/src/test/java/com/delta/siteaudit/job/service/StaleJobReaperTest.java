package com.delta.siteaudit.job.service;

import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.model.NewAuditJob;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class StaleJobReaperTest {

    @Autowired
    private StaleJobReaper reaper;

    @Autowired
    private AuditJobRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void failsOnlyJobsWhoseHeartbeatIsOlderThanTheThreshold() {
        ClaimedJob stale = claimNewJob("stale-worker");
        ClaimedJob fresh = claimNewJob("fresh-worker");
        assertTrue(repository.advance(stale, JobStatus.CRAWLING, JobStatus.ANALYZING, "analyzing"));
        backdateHeartbeat(stale.jobId(), Duration.ofHours(2));

        int reaped = reaper.sweep();

        assertTrue(reaped >= 1);
        AuditJob staleJob = repository.findById(stale.jobId()).orElseThrow();
        assertEquals(JobStatus.FAILED, staleJob.status());
        assertEquals(JobStatus.ANALYZING, staleJob.errorStage());
        assertEquals(JobFailureMessages.WORKER_LOST, staleJob.errorMessage());
        assertEquals(JobStatus.CRAWLING, repository.findById(fresh.jobId()).orElseThrow().status());
    }

    @Test
    void reapedWorkerCannotWriteAnyMore() {
        ClaimedJob stale = claimNewJob("slow-worker");
        backdateHeartbeat(stale.jobId(), Duration.ofHours(1));

        reaper.sweep();

        assertFalse(repository.advance(stale, JobStatus.CRAWLING, JobStatus.ANALYZING, "analyzing"));
        assertFalse(repository.markFailed(stale, JobStatus.CRAWLING, "late"));
        assertFalse(repository.heartbeat(stale));
        assertEquals(JobFailureMessages.WORKER_LOST, repository.findById(stale.jobId()).orElseThrow().errorMessage());
    }

    @Test
    void reapedJobsStayFailedUntilRetried() {
        ClaimedJob stale = claimNewJob("gone-worker");
        backdateHeartbeat(stale.jobId(), Duration.ofHours(1));
        reaper.sweep();

        reaper.sweep();
        assertEquals(JobStatus.FAILED, repository.findById(stale.jobId()).orElseThrow().status());

        assertTrue(repository.resetForRetry(stale.jobId()));
        assertEquals(JobStatus.PENDING, repository.findById(stale.jobId()).orElseThrow().status());
    }

    private ClaimedJob claimNewJob(String workerId) {
        String jobId = repository.insert(new NewAuditJob("acme.example", List.of(), "en-US", null));
        return repository.claim(jobId, workerId).orElseThrow();
    }

    private void backdateHeartbeat(String jobId, Duration age) {
        jdbc.update(
            "UPDATE audit_jobs SET heartbeat_at = :at WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("at", Timestamp.from(Instant.now().minus(age)))
                .addValue("id", jobId)
        );
    }
}
