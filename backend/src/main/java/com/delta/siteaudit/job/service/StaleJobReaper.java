package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails running jobs whose worker stopped heart-beating. Runs once at startup and then
 * periodically from the worker service. Reaped jobs are never requeued automatically.
 */
@Component
public class StaleJobReaper implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

    private final AuditJobRepository repository;
    private final AuditProperties properties;

    public StaleJobReaper(AuditJobRepository repository, AuditProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            sweep();
        } catch (Exception e) {
            log.warn("Skipping stale job cleanup at startup", e);
        }
    }

    public int sweep() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getWorker().getStaleMinutes()));
        List<AuditJob> stale = repository.findStaleRunningJobs(cutoff);
        int failed = 0;
        for (AuditJob job : stale) {
            if (repository.failStale(job, cutoff, JobFailureMessages.WORKER_LOST)) {
                failed++;
                log.info(
                    "Failed stale audit job {} in {} (worker={}, lastHeartbeat={})",
                    job.id(),
                    job.status(),
                    job.workerId(),
                    job.heartbeatAt()
                );
            }
        }
        return failed;
    }
}
