package com.delta.siteaudit.crawl.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> urls,
    int sitemapsFetched,
    Map<String, Integer> errors
) {
    public static SitemapDiscoveryResult empty() {
        return new SitemapDiscoveryResult(List.of(), 0, Map.of());
    }
}
