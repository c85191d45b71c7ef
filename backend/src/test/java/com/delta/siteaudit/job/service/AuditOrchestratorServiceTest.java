package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.model.CrawlDiagnostics;
import com.delta.siteaudit.crawl.model.CrawlResult;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.crawl.service.SiteCrawlerService;
import com.delta.siteaudit.generation.ArtifactFixtures;
import com.delta.siteaudit.generation.client.GenerationCallException;
import com.delta.siteaudit.generation.service.ArtifactGeneratorService;
import com.delta.siteaudit.generation.service.GeneratedArtifact;
import com.delta.siteaudit.generation.service.PageSampler;
import com.delta.siteaudit.generation.service.SchemaValidationException;
import com.delta.siteaudit.generation.schema.SchemaViolation;
import com.delta.siteaudit.generation.schema.ViolationKind;
import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.JobStatus;
import com.delta.siteaudit.job.model.StoredArtifact;
import com.delta.siteaudit.job.persistence.ArtifactRepository;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import com.delta.siteaudit.job.persistence.PageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditOrchestratorServiceTest {
    private AuditJobRepository jobRepository;
    private PageRepository pageRepository;
    private ArtifactRepository artifactRepository;
    private SiteCrawlerService crawlerService;
    private ArtifactGeneratorService generatorService;
    private AuditOrchestratorService orchestrator;
    private ClaimedJob claimed;
    private List<CrawledPage> targetPages;

    @BeforeEach
    void setUp() {
        jobRepository = mock(AuditJobRepository.class);
        pageRepository = mock(PageRepository.class);
        artifactRepository = mock(ArtifactRepository.class);
        crawlerService = mock(SiteCrawlerService.class);
        generatorService = mock(ArtifactGeneratorService.class);
        AuditProperties auditProperties = new AuditProperties();
        orchestrator = new AuditOrchestratorService(
            jobRepository,
            pageRepository,
            artifactRepository,
            crawlerService,
            new PageSampler(auditProperties),
            generatorService,
            new CrawlerProperties(),
            auditProperties,
            ArtifactFixtures.MAPPER,
            new TransactionTemplate(mock(PlatformTransactionManager.class))
        );

        Instant now = Instant.now();
        AuditJob job = new AuditJob(
            "job-1", "acme.example", List.of("rival.example"), "en-US", null,
            JobStatus.CRAWLING, "claimed", 5, null, null, "worker-1", now, now, 1, 0, now, now
        );
        claimed = new ClaimedJob(job, "worker-1");
        targetPages = List.of(ArtifactFixtures.page("acme.example", true, "https://acme.example/", 0, 100));

        when(jobRepository.advance(eq(claimed), any(), any(), anyString())).thenReturn(true);
        when(jobRepository.updateProgress(eq(claimed), any(), anyString(), anyInt())).thenReturn(true);
        when(jobRepository.recordCrawlOutcome(eq(claimed), anyInt(), anyString())).thenReturn(true);
        when(jobRepository.markCompleted(claimed)).thenReturn(true);
        when(jobRepository.markFailed(eq(claimed), any(), anyString())).thenReturn(true);
        when(pageRepository.insertPages(eq(claimed), anyList())).thenAnswer(invocation -> invocation.<List<?>>getArgument(1).size());
        when(pageRepository.findPages("job-1", 1)).thenReturn(targetPages);
        when(crawlerService.crawl("acme.example", true, 60)).thenReturn(result("acme.example", true, targetPages, null));
        when(crawlerService.crawl("rival.example", false, 15)).thenReturn(result("rival.example", false, List.of(), null));
    }

    @Test
    void happyPathPublishesArtifactAndCompletes() {
        GeneratedArtifact generated = new GeneratedArtifact(null, "{}", List.of("https://acme.example/"), "test-model", 1);
        when(generatorService.generate(any(), any())).thenReturn(generated);
        when(artifactRepository.insert(eq(claimed), anyString(), eq("{}"), anyList(), eq("test-model"), eq(1)))
            .thenReturn(new StoredArtifact("job-1", 1, 1, "2", "{}", List.of(), "test-model", 1, Instant.now()));

        orchestrator.process(claimed);

        InOrder order = inOrder(jobRepository, artifactRepository);
        order.verify(jobRepository).advance(claimed, JobStatus.CRAWLING, JobStatus.ANALYZING, "analyzing");
        order.verify(jobRepository).advance(claimed, JobStatus.ANALYZING, JobStatus.ASSEMBLING, "assembling");
        order.verify(artifactRepository).insert(eq(claimed), anyString(), eq("{}"), anyList(), anyString(), anyInt());
        order.verify(jobRepository).markCompleted(claimed);
        verify(jobRepository).recordCrawlOutcome(eq(claimed), eq(1), anyString());
        verify(jobRepository, never()).markFailed(any(), any(), anyString());
    }

    @Test
    void robotsBlockedTargetFailsDuringCrawlingWithoutGenerating() {
        when(crawlerService.crawl("acme.example", true, 60))
            .thenReturn(result("acme.example", true, List.of(), "robots_disallow"));

        orchestrator.process(claimed);

        verify(jobRepository).markFailed(claimed, JobStatus.CRAWLING, JobFailureMessages.ROBOTS_BLOCKED);
        verify(pageRepository, never()).insertPages(any(), anyList());
        verify(generatorService, never()).generate(any(), any());
        verify(jobRepository, never()).advance(any(), any(), any(), anyString());
    }

    @Test
    void comparisonCrawlFailureIsNotFatal() {
        when(crawlerService.crawl("rival.example", false, 15)).thenThrow(new IllegalStateException("boom"));
        when(generatorService.generate(any(), any()))
            .thenReturn(new GeneratedArtifact(null, "{}", List.of(), "m", 1));
        when(artifactRepository.insert(any(), anyString(), anyString(), anyList(), anyString(), anyInt()))
            .thenReturn(new StoredArtifact("job-1", 1, 1, "2", "{}", List.of(), "m", 1, Instant.now()));

        orchestrator.process(claimed);

        verify(jobRepository).markCompleted(claimed);
        verify(jobRepository, never()).markFailed(any(), any(), anyString());
    }

    @Test
    void invalidGeneratedOutputFailsDuringAnalyzingWithSafeMessage() {
        when(generatorService.generate(any(), any())).thenThrow(new SchemaValidationException(
            List.of(new SchemaViolation("packages", ViolationKind.MISSING, "required field is missing")),
            2
        ));

        orchestrator.process(claimed);

        verify(jobRepository).markFailed(claimed, JobStatus.ANALYZING, JobFailureMessages.INVALID_OUTPUT);
        verify(artifactRepository, never()).insert(any(), anyString(), anyString(), anyList(), anyString(), anyInt());
    }

    @Test
    void generationOutageFailsWithRetryHint() {
        when(generatorService.generate(any(), any()))
            .thenThrow(new GenerationCallException("Generation endpoint returned HTTP 503", 503));

        orchestrator.process(claimed);

        verify(jobRepository).markFailed(claimed, JobStatus.ANALYZING, JobFailureMessages.GENERATION_UNAVAILABLE);
    }

    @Test
    void lostOwnershipStopsWithoutFurtherWrites() {
        when(jobRepository.advance(claimed, JobStatus.CRAWLING, JobStatus.ANALYZING, "analyzing")).thenReturn(false);

        orchestrator.process(claimed);

        verify(generatorService, never()).generate(any(), any());
        verify(jobRepository, never()).markFailed(any(), any(), anyString());
        verify(jobRepository, never()).markCompleted(any());
    }

    @Test
    void completionRaceLeavesNoCompletedJob() {
        when(generatorService.generate(any(), any()))
            .thenReturn(new GeneratedArtifact(null, "{}", List.of(), "m", 1));
        when(artifactRepository.insert(any(), anyString(), anyString(), anyList(), anyString(), anyInt()))
            .thenReturn(new StoredArtifact("job-1", 1, 1, "2", "{}", List.of(), "m", 1, Instant.now()));
        when(jobRepository.markCompleted(claimed)).thenReturn(false);
        when(jobRepository.markFailed(eq(claimed), any(), anyString())).thenReturn(false);

        orchestrator.process(claimed);

        verify(jobRepository).markFailed(claimed, JobStatus.ASSEMBLING, JobFailureMessages.UNEXPECTED);
    }

    private static CrawlResult result(String domain, boolean target, List<CrawledPage> pages, String blockedReason) {
        CrawlDiagnostics diagnostics = new CrawlDiagnostics(
            domain, target, pages.size(), pages.size(), 0, 0, Map.of(), List.of(), blockedReason, false, 0, 5L
        );
        return new CrawlResult(pages, diagnostics);
    }
}
