package com.delta.siteaudit.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PagePriorityClassifierTest {

    @Test
    void homepageVariantsAreTierZero() {
        assertThat(PagePriorityClassifier.classify("https://example.com/")).isEqualTo(PagePriorityClassifier.HOMEPAGE);
        assertThat(PagePriorityClassifier.classify("https://example.com")).isEqualTo(PagePriorityClassifier.HOMEPAGE);
        assertThat(PagePriorityClassifier.classify("https://example.com/index.html"))
            .isEqualTo(PagePriorityClassifier.HOMEPAGE);
    }

    @Test
    void decisionPagesOutrankSupportPages() {
        assertThat(PagePriorityClassifier.classify("https://example.com/pricing")).isEqualTo(PagePriorityClassifier.PRIMARY);
        assertThat(PagePriorityClassifier.classify("https://example.com/about-us")).isEqualTo(PagePriorityClassifier.PRIMARY);
        assertThat(PagePriorityClassifier.classify("https://example.com/case-studies/acme"))
            .isEqualTo(PagePriorityClassifier.PRIMARY);
        assertThat(PagePriorityClassifier.classify("https://example.com/faq")).isEqualTo(PagePriorityClassifier.SECONDARY);
        assertThat(PagePriorityClassifier.classify("https://example.com/blog/post-1"))
            .isEqualTo(PagePriorityClassifier.SECONDARY);
        assertThat(PagePriorityClassifier.classify("https://example.com/legal/imprint"))
            .isEqualTo(PagePriorityClassifier.OTHER);
    }
}
