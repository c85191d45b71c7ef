package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.crawl.model.CrawledPage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pages chosen as generation input: the target's, and separately each comparison domain's.
 */
public record SampledPages(List<CrawledPage> target, Map<String, List<CrawledPage>> comparisons) {

    public SampledPages {
        target = List.copyOf(target);
        Map<String, List<CrawledPage>> copy = new LinkedHashMap<>();
        comparisons.forEach((domain, pages) -> copy.put(domain, List.copyOf(pages)));
        comparisons = Collections.unmodifiableMap(copy);
    }

    public int comparisonPageCount() {
        return comparisons.values().stream().mapToInt(List::size).sum();
    }

    public List<String> allUrls() {
        List<String> urls = new ArrayList<>();
        target.forEach(page -> urls.add(page.url()));
        comparisons.values().forEach(pages -> pages.forEach(page -> urls.add(page.url())));
        return urls;
    }
}
