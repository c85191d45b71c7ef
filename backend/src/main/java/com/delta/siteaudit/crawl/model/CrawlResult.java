package com.delta.siteaudit.crawl.model;

import java.util.List;

public record CrawlResult(List<CrawledPage> pages, CrawlDiagnostics diagnostics) {

    public boolean isEmpty() {
        return pages.isEmpty();
    }
}
