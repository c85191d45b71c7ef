package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.crawl.model.CrawledPage;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic page selection: priority tier ascending, then word count descending, then
 * normalized URL, capped per domain.
 */
@Component
public class PageSampler {
    static final Comparator<CrawledPage> SAMPLE_ORDER = Comparator
        .comparingInt(CrawledPage::priorityTier)
        .thenComparing(Comparator.comparingInt(CrawledPage::wordCount).reversed())
        .thenComparing(CrawledPage::normalizedUrl);

    private final AuditProperties.Sampling properties;

    public PageSampler(AuditProperties properties) {
        this.properties = properties.getSampling();
    }

    public SampledPages sample(List<CrawledPage> pages, List<String> comparisonDomainOrder) {
        List<CrawledPage> target = pages.stream()
            .filter(CrawledPage::target)
            .sorted(SAMPLE_ORDER)
            .limit(properties.getTargetPages())
            .toList();

        Map<String, List<CrawledPage>> comparisons = new LinkedHashMap<>();
        for (String domain : comparisonDomainOrder) {
            List<CrawledPage> selected = pages.stream()
                .filter(page -> !page.target() && domain.equals(page.domain()))
                .sorted(SAMPLE_ORDER)
                .limit(properties.getComparisonPages())
                .toList();
            if (!selected.isEmpty()) {
                comparisons.put(domain, selected);
            }
        }
        return new SampledPages(target, comparisons);
    }
}
