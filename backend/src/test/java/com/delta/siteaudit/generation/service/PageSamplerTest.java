package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.generation.ArtifactFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageSamplerTest {

    @Test
    void ordersByTierThenWordCountThenUrlAndCapsPerDomain() {
        AuditProperties properties = new AuditProperties();
        properties.getSampling().setTargetPages(3);
        properties.getSampling().setComparisonPages(1);
        PageSampler sampler = new PageSampler(properties);

        List<CrawledPage> pages = new ArrayList<>(List.of(
            ArtifactFixtures.page("acme.example", true, "https://acme.example/blog", 2, 900),
            ArtifactFixtures.page("acme.example", true, "https://acme.example/pricing", 1, 100),
            ArtifactFixtures.page("acme.example", true, "https://acme.example/about", 1, 100),
            ArtifactFixtures.page("acme.example", true, "https://acme.example/services", 1, 400),
            ArtifactFixtures.page("acme.example", true, "https://acme.example/", 0, 10),
            ArtifactFixtures.page("rival.example", false, "https://rival.example/pricing", 1, 50),
            ArtifactFixtures.page("rival.example", false, "https://rival.example/", 0, 50),
            ArtifactFixtures.page("other.example", false, "https://other.example/", 0, 50)
        ));
        Collections.shuffle(pages);

        SampledPages sample = sampler.sample(pages, List.of("rival.example", "missing.example", "other.example"));

        assertThat(sample.target()).extracting(CrawledPage::url).containsExactly(
            "https://acme.example/",
            "https://acme.example/services",
            "https://acme.example/about"
        );
        assertThat(sample.comparisons()).containsOnlyKeys("rival.example", "other.example");
        assertThat(sample.comparisons().get("rival.example"))
            .extracting(CrawledPage::url)
            .containsExactly("https://rival.example/");
        assertThat(sample.comparisonPageCount()).isEqualTo(2);
    }
}
