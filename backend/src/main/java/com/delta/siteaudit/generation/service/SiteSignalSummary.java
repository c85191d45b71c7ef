package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.crawl.util.PagePriorityClassifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Coarse facts about the crawled sites handed to the generator alongside the page text:
 * page counts per tier and which kinds of decision pages exist.
 */
public record SiteSignalSummary(Map<String, DomainSignals> domains) {
    private static final Map<String, List<String>> PAGE_KINDS = new LinkedHashMap<>();

    static {
        PAGE_KINDS.put("pricing", List.of("pricing", "price", "plans"));
        PAGE_KINDS.put("about", List.of("about", "team", "company"));
        PAGE_KINDS.put("faq", List.of("faq", "questions", "help"));
        PAGE_KINDS.put("case_studies", List.of("case-stud", "customers", "portfolio", "testimonial"));
        PAGE_KINDS.put("contact", List.of("contact"));
        PAGE_KINDS.put("blog", List.of("blog", "articles", "news"));
        PAGE_KINDS.put("comparison", List.of("compare", "vs-", "-vs", "alternative"));
    }

    public static SiteSignalSummary of(List<CrawledPage> pages) {
        Map<String, DomainSignals> domains = new LinkedHashMap<>();
        Map<String, List<CrawledPage>> byDomain = new LinkedHashMap<>();
        for (CrawledPage page : pages) {
            byDomain.computeIfAbsent(page.domain(), ignored -> new ArrayList<>()).add(page);
        }
        byDomain.forEach((domain, domainPages) -> domains.put(domain, summarize(domainPages)));
        return new SiteSignalSummary(domains);
    }

    private static DomainSignals summarize(List<CrawledPage> pages) {
        int[] tiers = new int[PagePriorityClassifier.OTHER + 1];
        TreeSet<String> kinds = new TreeSet<>();
        long words = 0;
        for (CrawledPage page : pages) {
            tiers[Math.min(PagePriorityClassifier.OTHER, Math.max(0, page.priorityTier()))]++;
            words += page.wordCount();
            String url = page.normalizedUrl() == null ? "" : page.normalizedUrl().toLowerCase(Locale.ROOT);
            PAGE_KINDS.forEach((kind, hints) -> {
                if (hints.stream().anyMatch(url::contains)) {
                    kinds.add(kind);
                }
            });
        }
        boolean target = !pages.isEmpty() && pages.get(0).target();
        return new DomainSignals(target, pages.size(), tiers[0], tiers[1], tiers[2], tiers[3], words, List.copyOf(kinds));
    }

    public record DomainSignals(
        boolean target,
        int pages,
        int homepagePages,
        int primaryPages,
        int secondaryPages,
        int otherPages,
        long totalWords,
        List<String> pageKinds
    ) {
    }
}
