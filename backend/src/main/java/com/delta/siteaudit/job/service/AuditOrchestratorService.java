package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.model.CrawlDiagnostics;
import com.delta.siteaudit.crawl.model.CrawlResult;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.crawl.service.CrawlExhaustedException;
import com.delta.siteaudit.crawl.service.SiteCrawlerService;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.delta.siteaudit.generation.service.ArtifactGeneratorService;
import com.delta.siteaudit.generation.service.GeneratedArtifact;
import com.delta.siteaudit.generation.service.GenerationContext;
import com.delta.siteaudit.generation.service.PageSampler;
import com.delta.siteaudit.generation.service.SampledPages;
import com.delta.siteaudit.generation.service.SiteSignalSummary;
import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.model.StoredArtifact;
import com.delta.siteaudit.job.persistence.ArtifactRepository;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import com.delta.siteaudit.job.persistence.PageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one claimed job through CRAWLING, ANALYZING and ASSEMBLING. Every write is conditional
 * on this worker still owning the run; a write that affects nothing means the job was taken
 * away (stale recovery) and processing stops without touching it further.
 */
@Service
public class AuditOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(AuditOrchestratorService.class);
    private static final int PROGRESS_TARGET_CRAWL = 10;
    private static final int PROGRESS_COMPARISONS_START = 40;
    private static final int PROGRESS_COMPARISONS_END = 60;
    private static final int PROGRESS_GENERATED = 80;

    private final AuditJobRepository jobRepository;
    private final PageRepository pageRepository;
    private final ArtifactRepository artifactRepository;
    private final SiteCrawlerService crawlerService;
    private final PageSampler pageSampler;
    private final ArtifactGeneratorService generatorService;
    private final CrawlerProperties crawlerProperties;
    private final AuditProperties auditProperties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public AuditOrchestratorService(
        AuditJobRepository jobRepository,
        PageRepository pageRepository,
        ArtifactRepository artifactRepository,
        SiteCrawlerService crawlerService,
        PageSampler pageSampler,
        ArtifactGeneratorService generatorService,
        CrawlerProperties crawlerProperties,
        AuditProperties auditProperties,
        ObjectMapper objectMapper,
        TransactionTemplate transactionTemplate
    ) {
        this.jobRepository = jobRepository;
        this.pageRepository = pageRepository;
        this.artifactRepository = artifactRepository;
        this.crawlerService = crawlerService;
        this.pageSampler = pageSampler;
        this.generatorService = generatorService;
        this.crawlerProperties = crawlerProperties;
        this.auditProperties = auditProperties;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
    }

    public void process(ClaimedJob claimed) {
        String jobId = claimed.jobId();
        log.info("Worker {} processing audit job {} run {}", claimed.workerId(), jobId, claimed.runNumber());
        ScheduledExecutorService heartbeat = startHeartbeat(claimed);
        JobStatus stage = JobStatus.CRAWLING;
        try {
            List<CrawledPage> pages = crawl(claimed);
            if (!jobRepository.advance(claimed, JobStatus.CRAWLING, JobStatus.ANALYZING, "analyzing")) {
                logLostOwnership(claimed, JobStatus.CRAWLING);
                return;
            }
            stage = JobStatus.ANALYZING;
            GeneratedArtifact artifact = analyze(claimed, pages);
            jobRepository.updateProgress(claimed, JobStatus.ANALYZING, "generated", PROGRESS_GENERATED);
            if (!jobRepository.advance(claimed, JobStatus.ANALYZING, JobStatus.ASSEMBLING, "assembling")) {
                logLostOwnership(claimed, JobStatus.ANALYZING);
                return;
            }
            stage = JobStatus.ASSEMBLING;
            StoredArtifact stored = publish(claimed, artifact);
            log.info(
                "Audit job {} completed: artifact v{} from {} attempt(s)",
                jobId,
                stored.version(),
                stored.attempts()
            );
        } catch (Exception e) {
            log.warn("Audit job {} failed during {}", jobId, stage, e);
            fail(claimed, stage, e);
        } finally {
            heartbeat.shutdownNow();
        }
    }

    private List<CrawledPage> crawl(ClaimedJob claimed) {
        AuditJob job = claimed.job();
        jobRepository.updateProgress(claimed, JobStatus.CRAWLING, "crawling_target", PROGRESS_TARGET_CRAWL);

        List<CrawlDiagnostics> diagnostics = new ArrayList<>();
        CrawlResult target = crawlerService.crawl(job.targetDomain(), true, crawlerProperties.getMaxPagesTarget());
        diagnostics.add(target.diagnostics());
        if (target.isEmpty()) {
            jobRepository.recordCrawlOutcome(claimed, 0, toJson(diagnostics));
            throw new CrawlExhaustedException(job.targetDomain(), target.diagnostics().blockedReason());
        }
        int stored = pageRepository.insertPages(claimed, target.pages());

        List<String> comparisons = job.comparisonDomains();
        jobRepository.updateProgress(claimed, JobStatus.CRAWLING, "crawling_comparisons", PROGRESS_COMPARISONS_START);
        for (int i = 0; i < comparisons.size(); i++) {
            String domain = comparisons.get(i);
            try {
                CrawlResult comparison = crawlerService.crawl(domain, false, crawlerProperties.getMaxPagesComparison());
                diagnostics.add(comparison.diagnostics());
                stored += pageRepository.insertPages(claimed, comparison.pages());
            } catch (RuntimeException e) {
                log.warn("Comparison crawl of {} failed for job {}", domain, claimed.jobId(), e);
            }
            int progress = PROGRESS_COMPARISONS_START
                + (PROGRESS_COMPARISONS_END - PROGRESS_COMPARISONS_START) * (i + 1) / comparisons.size();
            jobRepository.updateProgress(claimed, JobStatus.CRAWLING, "crawling_comparisons", progress);
        }
        jobRepository.recordCrawlOutcome(claimed, stored, toJson(diagnostics));
        return pageRepository.findPages(claimed.jobId(), claimed.runNumber());
    }

    private GeneratedArtifact analyze(ClaimedJob claimed, List<CrawledPage> pages) {
        AuditJob job = claimed.job();
        List<String> comparisonOrder = job.comparisonDomains().stream()
            .map(domain -> SiteOrigin.parse(domain).displayName())
            .toList();
        SampledPages sample = pageSampler.sample(pages, comparisonOrder);
        GenerationContext context = new GenerationContext(
            job.targetDomain(),
            job.comparisonDomains(),
            job.locale(),
            job.businessContext(),
            SiteSignalSummary.of(pages)
        );
        log.info(
            "Generating artifact for job {} from {} target and {} comparison page(s)",
            claimed.jobId(),
            sample.target().size(),
            sample.comparisonPageCount()
        );
        return generatorService.generate(sample, context);
    }

    /** Writes the artifact and completes the job together, or neither. */
    private StoredArtifact publish(ClaimedJob claimed, GeneratedArtifact artifact) {
        return transactionTemplate.execute(status -> {
            StoredArtifact stored = artifactRepository.insert(
                claimed,
                ArtifactSchema.VERSION,
                artifact.payloadJson(),
                artifact.sampledUrls(),
                artifact.model(),
                artifact.attempts()
            );
            if (!jobRepository.markCompleted(claimed)) {
                throw new IllegalStateException("Job " + claimed.jobId() + " is no longer owned by " + claimed.workerId());
            }
            return stored;
        });
    }

    private void fail(ClaimedJob claimed, JobStatus stage, Exception failure) {
        try {
            if (!jobRepository.markFailed(claimed, stage, JobFailureMessages.forFailure(failure))) {
                logLostOwnership(claimed, stage);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of audit job {}", claimed.jobId(), e);
        }
    }

    private ScheduledExecutorService startHeartbeat(ClaimedJob claimed) {
        int intervalSeconds = auditProperties.getWorker().getHeartbeatSeconds();
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("audit-heartbeat-" + claimed.jobId());
            thread.setDaemon(true);
            return thread;
        });
        heartbeat.scheduleAtFixedRate(
            () -> {
                try {
                    jobRepository.heartbeat(claimed);
                } catch (Exception e) {
                    log.debug("Heartbeat for job {} failed: {}", claimed.jobId(), e.getMessage());
                }
            },
            intervalSeconds,
            intervalSeconds,
            TimeUnit.SECONDS
        );
        return heartbeat;
    }

    private String toJson(List<CrawlDiagnostics> diagnostics) {
        try {
            return objectMapper.writeValueAsString(diagnostics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize crawl diagnostics", e);
        }
    }

    private static void logLostOwnership(ClaimedJob claimed, JobStatus stage) {
        log.warn("Worker {} no longer owns job {} (run {}) in {}; stopping",
            claimed.workerId(), claimed.jobId(), claimed.runNumber(), stage);
    }
}
