package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pool of claim-and-process loops. Workers coordinate only through the conditional claim in
 * {@link AuditJobRepository#claim}, so any number of instances can run against one database.
 */
@Service
public class AuditWorkerService {
    private static final Logger log = LoggerFactory.getLogger(AuditWorkerService.class);
    private static final int CLAIM_CANDIDATES = 5;

    private final AuditJobRepository repository;
    private final AuditOrchestratorService orchestrator;
    private final StaleJobReaper reaper;
    private final AuditProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private ScheduledExecutorService reaperSchedule;
    private int activeWorkerCount;

    public AuditWorkerService(
        AuditJobRepository repository,
        AuditOrchestratorService orchestrator,
        StaleJobReaper reaper,
        AuditProperties properties
    ) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.reaper = reaper;
        this.properties = properties;
        this.instanceId = "audit-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public WorkerStatusResponse getStatus() {
        int pending = 0;
        int runningJobs = 0;
        try {
            pending = repository.countByStatus(JobStatus.PENDING);
            for (JobStatus status : JobStatus.RUNNING) {
                runningJobs += repository.countByStatus(status);
            }
        } catch (Exception e) {
            log.warn("Failed to load audit job counts", e);
        }
        return new WorkerStatusResponse(running.get(), activeWorkerCount, pending, runningJobs);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            AuditProperties.Worker worker = properties.getWorker();
            int workerCount = worker.getWorkerCount();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("audit-worker");
                thread.setDaemon(true);
                return thread;
            });
            reaperSchedule = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("audit-stale-reaper");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, worker.getPollIntervalMs()));
            }
            long sweepMinutes = Math.max(1, worker.getStaleMinutes() / 2);
            reaperSchedule.scheduleAtFixedRate(this::sweepStaleJobs, sweepMinutes, sweepMinutes, TimeUnit.MINUTES);
            log.info("Started {} audit worker(s) as {}", workerCount, instanceId);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (reaperSchedule != null) {
                reaperSchedule.shutdownNow();
                reaperSchedule = null;
            }
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Stopped audit workers");
        }
    }

    /**
     * Claims at most one pending job and processes it on the calling thread. Returns false when
     * nothing could be claimed.
     */
    public boolean runOnce(String workerId) {
        List<String> candidates = repository.findPendingJobIds(CLAIM_CANDIDATES);
        for (String jobId : candidates) {
            Optional<ClaimedJob> claimed = repository.claim(jobId, workerId);
            if (claimed.isPresent()) {
                orchestrator.process(claimed.get());
                return true;
            }
        }
        return false;
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("audit-worker-" + workerIndex);
        String workerId = instanceId + "-" + workerIndex;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = runOnce(workerId);
            } catch (Exception e) {
                log.warn("Audit worker {} failed to claim or process a job", workerIndex, e);
                worked = false;
            }
            if (!worked) {
                sleep(pollIntervalMs);
            }
        }
    }

    private void sweepStaleJobs() {
        try {
            reaper.sweep();
        } catch (Exception e) {
            log.warn("Stale audit job sweep failed", e);
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
