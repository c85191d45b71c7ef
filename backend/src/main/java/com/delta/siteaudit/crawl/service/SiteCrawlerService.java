package com.delta.siteaudit.crawl.service;

import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.http.GuardedHttpClient;
import com.delta.siteaudit.crawl.model.CrawlDiagnostics;
import com.delta.siteaudit.crawl.model.CrawlResult;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.crawl.model.ExtractedContent;
import com.delta.siteaudit.crawl.model.HttpFetchResult;
import com.delta.siteaudit.crawl.model.SitemapDiscoveryResult;
import com.delta.siteaudit.crawl.robots.RobotsRules;
import com.delta.siteaudit.crawl.robots.RobotsTxtService;
import com.delta.siteaudit.crawl.sitemap.SitemapService;
import com.delta.siteaudit.crawl.util.HashUtils;
import com.delta.siteaudit.crawl.util.PagePriorityClassifier;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import com.delta.siteaudit.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded crawl of a single site. The frontier is drained in (priority tier, discovery order),
 * fetches run in waves on a fixed pool, and everything outstanding is cancelled once the
 * wall-clock budget runs out. Whatever was collected by then is the result.
 */
@Service
public class SiteCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SiteCrawlerService.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";
    private static final int MAX_ERROR_SAMPLES = 20;

    private final CrawlerProperties properties;
    private final GuardedHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final PageContentExtractor extractor;
    private final ExecutorService fetchExecutor;

    public SiteCrawlerService(
        CrawlerProperties properties,
        GuardedHttpClient httpClient,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        PageContentExtractor extractor,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.extractor = extractor;
        this.fetchExecutor = fetchExecutor;
    }

    public CrawlResult crawl(String domain, boolean isTarget, int maxPages) {
        SiteOrigin origin = SiteOrigin.parse(domain);
        Instant startedAt = Instant.now();
        Instant deadline = startedAt.plusSeconds(properties.getCrawlBudgetSeconds());
        CrawlState state = new CrawlState(origin, isTarget, Math.max(1, maxPages), startedAt);
        log.info("Crawling {} (target={}, maxPages={})", origin.displayName(), isTarget, state.maxPages);

        RobotsRules robots = robotsTxtService.rulesFor(origin, deadline);
        if (robots.blocksEntireSite()) {
            log.info("robots.txt disallows crawling {}", origin.displayName());
            state.blockedReason = "robots_disallow";
            return state.toResult();
        }
        if (budgetExceeded(deadline)) {
            log.warn("Crawl budget for {} spent before the first page", origin.displayName());
            state.budgetExhausted = true;
            return state.toResult();
        }

        state.offer(origin.homepageUrl(), PagePriorityClassifier.HOMEPAGE);
        boolean sitemapSeeded = false;

        try {
            while (!state.frontier.isEmpty() && state.pages.size() < state.maxPages) {
                if (budgetExceeded(deadline)) {
                    state.budgetExhausted = true;
                    break;
                }
                List<FrontierEntry> batch = nextBatch(state, robots);
                if (batch.isEmpty()) {
                    continue;
                }
                boolean completed = runBatch(state, batch, deadline);
                if (!completed) {
                    break;
                }
                if (!sitemapSeeded) {
                    sitemapSeeded = true;
                    seedFromSitemaps(state, robots, deadline);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Crawl of {} interrupted with {} pages collected", origin.displayName(), state.pages.size());
        }

        log.info(
            "Crawled {}: {} pages, {} failed, {} skipped in {} ms",
            origin.displayName(),
            state.pages.size(),
            state.failed,
            state.skipped,
            Duration.between(startedAt, Instant.now()).toMillis()
        );
        return state.toResult();
    }

    private List<FrontierEntry> nextBatch(CrawlState state, RobotsRules robots) {
        int batchSize = Math.min(properties.getFetchConcurrency(), state.maxPages - state.pages.size());
        List<FrontierEntry> batch = new ArrayList<>();
        while (batch.size() < batchSize && !state.frontier.isEmpty()) {
            FrontierEntry entry = state.frontier.poll();
            if (!robotsTxtService.isAllowed(robots, entry.url())) {
                state.skip("blocked_by_robots");
                continue;
            }
            batch.add(entry);
        }
        return batch;
    }

    /**
     * Fetches one wave concurrently and folds the results in submission order so discovery
     * order stays deterministic. Returns false when the budget ran out mid-wave; fetches of
     * that wave which had already finished are still kept.
     *
     * <p>Every fetch carries the crawl deadline, so a worker stuck on a slow body is released
     * when the budget ends rather than when the server gives up.
     */
    private boolean runBatch(CrawlState state, List<FrontierEntry> batch, Instant deadline) throws InterruptedException {
        List<Future<HttpFetchResult>> futures = new ArrayList<>(batch.size());
        for (FrontierEntry entry : batch) {
            futures.add(fetchExecutor.submit(() -> httpClient.get(entry.url(), HTML_ACCEPT, deadline)));
            state.attempted++;
        }
        try {
            for (int i = 0; i < batch.size(); i++) {
                long remainingMs = Duration.between(Instant.now(), deadline).toMillis();
                FrontierEntry entry = batch.get(i);
                HttpFetchResult fetch;
                try {
                    fetch = futures.get(i).get(Math.max(0, remainingMs), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    state.budgetExhausted = true;
                    state.fail(entry.url(), "crawl_budget_exhausted");
                    collectFinished(state, batch, futures, i + 1);
                    return false;
                } catch (ExecutionException | CancellationException e) {
                    state.fail(entry.url(), "fetch_error");
                    log.debug("Fetch of {} failed", entry.url(), e);
                    continue;
                }
                accept(state, entry, fetch);
                if (state.pages.size() >= state.maxPages) {
                    return true;
                }
            }
            return true;
        } finally {
            for (Future<HttpFetchResult> future : futures) {
                future.cancel(true);
            }
        }
    }

    private void collectFinished(
        CrawlState state,
        List<FrontierEntry> batch,
        List<Future<HttpFetchResult>> futures,
        int from
    ) throws InterruptedException {
        for (int j = from; j < batch.size() && state.pages.size() < state.maxPages; j++) {
            Future<HttpFetchResult> future = futures.get(j);
            if (!future.isDone() || future.isCancelled()) {
                state.fail(batch.get(j).url(), "crawl_budget_exhausted");
                continue;
            }
            try {
                accept(state, batch.get(j), future.get());
            } catch (ExecutionException e) {
                state.fail(batch.get(j).url(), "fetch_error");
                log.debug("Fetch of {} failed", batch.get(j).url(), e);
            }
        }
    }

    private void accept(CrawlState state, FrontierEntry entry, HttpFetchResult fetch) {
        if (!fetch.isSuccessful()) {
            state.fail(entry.url(), fetch.failureCode());
            log.debug("Skipping {}: {} {}", entry.url(), fetch.failureCode(), fetch.errorMessage());
            return;
        }
        if (!fetch.isHtml()) {
            state.skip("not_html");
            return;
        }
        String finalUrl = fetch.finalUrlOrRequested();
        if (!state.origin.isSameSite(fetch.finalUri())) {
            state.skip("offsite_redirect");
            return;
        }
        String normalized = UrlNormalizer.normalize(finalUrl);
        if (normalized == null) {
            state.skip("invalid_url");
            return;
        }
        String urlHash = HashUtils.sha256Hex(normalized);
        if (!urlHash.equals(entry.urlHash()) && !state.seenHashes.add(urlHash)) {
            state.skip("duplicate_after_redirect");
            return;
        }

        ExtractedContent content = extractor.extract(fetch.body(), finalUrl, state.origin);
        state.pages.add(new CrawledPage(
            state.origin.displayName(),
            state.target,
            finalUrl,
            normalized,
            urlHash,
            content.title(),
            content.metaDescription(),
            fetch.body(),
            content.text(),
            content.wordCount(),
            entry.tier(),
            HashUtils.sha256Hex(content.text()),
            fetch.fetchedAt()
        ));

        // comparison sites only expand from their homepage
        if (state.target || entry.tier() == PagePriorityClassifier.HOMEPAGE) {
            enqueueLinks(state, content.links());
        }
    }

    private void enqueueLinks(CrawlState state, List<String> links) {
        List<String> ranked = new ArrayList<>(links);
        ranked.sort(Comparator.comparingInt(PagePriorityClassifier::classify));
        int added = 0;
        for (String link : ranked) {
            if (added >= properties.getMaxLinksPerPage()) {
                break;
            }
            if (state.offer(link, PagePriorityClassifier.classify(link))) {
                added++;
            }
        }
    }

    private void seedFromSitemaps(CrawlState state, RobotsRules robots, Instant deadline) {
        if (state.pages.size() >= state.maxPages || budgetExceeded(deadline)) {
            return;
        }
        SitemapDiscoveryResult sitemaps = sitemapService.discover(state.origin, robots, deadline);
        state.sitemapUrls = sitemaps.urls().size();
        for (String url : sitemaps.urls()) {
            state.offer(url, PagePriorityClassifier.classify(url));
        }
    }

    private boolean budgetExceeded(Instant deadline) {
        return Instant.now().isAfter(deadline);
    }

    record FrontierEntry(String url, String urlHash, int tier, long sequence) {
    }

    private static final class CrawlState {
        private final SiteOrigin origin;
        private final boolean target;
        private final int maxPages;
        private final Instant startedAt;
        private final PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>(
            Comparator.comparingInt(FrontierEntry::tier).thenComparingLong(FrontierEntry::sequence)
        );
        private final Set<String> seenHashes = new HashSet<>();
        private final List<CrawledPage> pages = new ArrayList<>();
        private final Map<String, Integer> errors = new LinkedHashMap<>();
        private final List<String> errorSamples = new ArrayList<>();
        private long sequence;
        private int attempted;
        private int failed;
        private int skipped;
        private int sitemapUrls;
        private boolean budgetExhausted;
        private String blockedReason;

        private CrawlState(SiteOrigin origin, boolean target, int maxPages, Instant startedAt) {
            this.origin = origin;
            this.target = target;
            this.maxPages = maxPages;
            this.startedAt = startedAt;
        }

        boolean offer(String url, int tier) {
            String normalized = UrlNormalizer.normalize(url);
            if (normalized == null) {
                return false;
            }
            String hash = HashUtils.sha256Hex(normalized);
            if (!seenHashes.add(hash)) {
                return false;
            }
            frontier.add(new FrontierEntry(normalized, hash, tier, sequence++));
            return true;
        }

        void fail(String url, String code) {
            failed++;
            errors.merge(code, 1, Integer::sum);
            if (errorSamples.size() < MAX_ERROR_SAMPLES) {
                errorSamples.add(code + " " + url);
            }
        }

        void skip(String code) {
            skipped++;
            errors.merge(code, 1, Integer::sum);
        }

        CrawlResult toResult() {
            CrawlDiagnostics diagnostics = new CrawlDiagnostics(
                origin.displayName(),
                target,
                attempted,
                pages.size(),
                failed,
                skipped,
                Collections.unmodifiableMap(new LinkedHashMap<>(errors)),
                List.copyOf(errorSamples),
                blockedReason,
                budgetExhausted,
                sitemapUrls,
                Duration.between(startedAt, Instant.now()).toMillis()
            );
            return new CrawlResult(List.copyOf(pages), diagnostics);
        }
    }
}
