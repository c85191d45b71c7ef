package com.delta.siteaudit.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * What happened during one domain crawl. Stored with the job for operators, never shown to
 * callers.
 */
public record CrawlDiagnostics(
    String domain,
    boolean target,
    int pagesAttempted,
    int pagesSucceeded,
    int pagesFailed,
    int pagesSkipped,
    Map<String, Integer> errorsByCode,
    List<String> errorSamples,
    String blockedReason,
    boolean budgetExhausted,
    int sitemapUrls,
    long durationMs
) {
}
