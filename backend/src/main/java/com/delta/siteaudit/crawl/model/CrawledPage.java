package com.delta.siteaudit.crawl.model;

import java.time.Instant;

public record CrawledPage(
    String domain,
    boolean target,
    String url,
    String normalizedUrl,
    String urlHash,
    String title,
    String metaDescription,
    String rawContent,
    String extractedText,
    int wordCount,
    int priorityTier,
    String contentHash,
    Instant fetchedAt
) {
}
