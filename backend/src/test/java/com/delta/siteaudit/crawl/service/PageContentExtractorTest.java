package com.delta.siteaudit.crawl.service;

import com.delta.siteaudit.crawl.model.ExtractedContent;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageContentExtractorTest {
    private final PageContentExtractor extractor = new PageContentExtractor();

    @Test
    void extractsTextWithoutChromeAndKeepsOnlySameSiteLinks() {
        String html = """
            <html>
              <head>
                <title> Acme Plumbing </title>
                <meta name="description" content="Emergency plumbing in Springfield">
                <script>var tracking = 1;</script>
              </head>
              <body>
                <header>Top banner</header>
                <nav><a href="/pricing">Pricing</a></nav>
                <main>
                  <p>We fix leaks fast.</p>
                  <a href="https://www.acme.example/about#team">About</a>
                  <a href="https://other.example/partner">Partner</a>
                  <a href="mailto:hello@acme.example">Mail</a>
                  <a href="/brochure.pdf">Brochure</a>
                  <a href="#top">Top</a>
                </main>
                <footer>Copyright</footer>
              </body>
            </html>
            """;

        ExtractedContent content = extractor.extract(html, "https://acme.example/", SiteOrigin.parse("acme.example"));

        assertThat(content.title()).isEqualTo("Acme Plumbing");
        assertThat(content.metaDescription()).isEqualTo("Emergency plumbing in Springfield");
        assertThat(content.text()).isEqualTo("We fix leaks fast. About Partner Mail Brochure Top");
        assertThat(content.text()).doesNotContain("Top banner", "Copyright", "tracking");
        assertThat(content.wordCount()).isEqualTo(9);
        assertThat(content.links()).containsExactly(
            "https://acme.example/pricing",
            "https://www.acme.example/about"
        );
    }
}
