package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditWorkerServiceTest {
    @Mock
    private AuditJobRepository repository;

    @Mock
    private AuditOrchestratorService orchestrator;

    @Mock
    private StaleJobReaper reaper;

    private AuditWorkerService workerService;

    @BeforeEach
    void setUp() {
        workerService = new AuditWorkerService(repository, orchestrator, reaper, new AuditProperties());
    }

    @Test
    void runOnceSkipsJobsClaimedElsewhere() {
        ClaimedJob claimed = claimedJob("job-2", "worker-a");
        when(repository.findPendingJobIds(anyInt())).thenReturn(List.of("job-1", "job-2"));
        when(repository.claim("job-1", "worker-a")).thenReturn(Optional.empty());
        when(repository.claim("job-2", "worker-a")).thenReturn(Optional.of(claimed));

        assertTrue(workerService.runOnce("worker-a"));
        verify(orchestrator).process(claimed);
    }

    @Test
    void runOnceReportsIdleWhenNothingIsPending() {
        when(repository.findPendingJobIds(anyInt())).thenReturn(List.of());

        assertFalse(workerService.runOnce("worker-a"));
        verify(orchestrator, never()).process(any());
    }

    @Test
    void statusCountsPendingAndRunningJobs() {
        when(repository.countByStatus(JobStatus.PENDING)).thenReturn(3);
        when(repository.countByStatus(JobStatus.CRAWLING)).thenReturn(1);
        when(repository.countByStatus(JobStatus.ANALYZING)).thenReturn(1);
        when(repository.countByStatus(JobStatus.ASSEMBLING)).thenReturn(0);

        WorkerStatusResponse status = workerService.getStatus();

        assertFalse(status.running());
        assertEquals(3, status.pendingJobs());
        assertEquals(2, status.runningJobs());
    }

    private static ClaimedJob claimedJob(String jobId, String workerId) {
        Instant now = Instant.now();
        AuditJob job = new AuditJob(
            jobId, "acme.example", List.of(), "en-US", null,
            JobStatus.CRAWLING, "claimed", 5, null, null, workerId, now, now, 1, 0, now, now
        );
        return new ClaimedJob(job, workerId);
    }
}
