package com.delta.siteaudit.crawl.sitemap;

import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.http.GuardedHttpClient;
import com.delta.siteaudit.crawl.model.HttpFetchResult;
import com.delta.siteaudit.crawl.model.SitemapDiscoveryResult;
import com.delta.siteaudit.crawl.robots.RobotsRules;
import com.delta.siteaudit.crawl.robots.RobotsTxtService;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import com.delta.siteaudit.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Collects same-site page URLs from the conventional sitemap locations and any sitemaps
 * named in robots.txt. Index files are followed one level deep.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 2_000_000;
    private static final int MAX_INFLATED_BYTES = 10_000_000;
    private static final int MAX_DEPTH = 1;

    private final CrawlerProperties properties;
    private final GuardedHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;

    public SitemapService(
        CrawlerProperties properties,
        GuardedHttpClient httpClient,
        RobotsTxtService robotsTxtService
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
    }

    /**
     * Walks the sitemaps for {@code origin}. Files still queued when {@code deadline} passes are
     * left unfetched and the URLs found so far are returned.
     */
    public SitemapDiscoveryResult discover(SiteOrigin origin, RobotsRules robotsRules, Instant deadline) {
        int maxUrls = properties.getSitemap().getMaxUrls();
        if (maxUrls == 0) {
            return SitemapDiscoveryResult.empty();
        }
        int maxSitemaps = 3 + properties.getSitemap().getMaxChildSitemaps();

        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedUrls(origin, robotsRules)) {
            queue.addLast(new SitemapTask(seed, 0));
        }

        LinkedHashSet<String> visited = new LinkedHashSet<>();
        LinkedHashSet<String> discovered = new LinkedHashSet<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        int fetched = 0;

        while (!queue.isEmpty() && visited.size() < maxSitemaps && discovered.size() < maxUrls) {
            if (!Instant.now().isBefore(deadline)) {
                increment(errors, "crawl_budget_exhausted");
                break;
            }
            SitemapTask current = queue.removeFirst();
            if (!visited.add(current.url())) {
                continue;
            }
            if (!robotsTxtService.isAllowed(robotsRules, current.url())) {
                increment(errors, "blocked_by_robots");
                continue;
            }
            HttpFetchResult fetch = httpClient.get(
                current.url(),
                "application/xml,text/xml;q=0.9,*/*;q=0.1",
                MAX_SITEMAP_BYTES,
                deadline
            );
            if (!fetch.isSuccessful()) {
                increment(errors, fetch.failureCode());
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(current.url(), fetch);
            } catch (IOException e) {
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }
            fetched++;

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            if (current.depth() < MAX_DEPTH) {
                int children = 0;
                for (Element loc : xml.select("sitemap > loc")) {
                    if (children >= properties.getSitemap().getMaxChildSitemaps()) {
                        break;
                    }
                    String child = loc.text().trim();
                    if (isSameSite(origin, child) && !visited.contains(child)) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                        children++;
                    }
                }
            }
            for (Element loc : xml.select("url > loc")) {
                if (discovered.size() >= maxUrls) {
                    break;
                }
                String pageUrl = loc.text().trim();
                if (isSameSite(origin, pageUrl)) {
                    discovered.add(pageUrl);
                }
            }
        }
        log.debug("Sitemaps for {} yielded {} urls from {} files", origin.displayName(), discovered.size(), fetched);
        return new SitemapDiscoveryResult(new ArrayList<>(discovered), fetched, errors);
    }

    private List<String> seedUrls(SiteOrigin origin, RobotsRules robotsRules) {
        LinkedHashSet<String> seeds = new LinkedHashSet<>();
        seeds.add(origin.resolve("/sitemap.xml"));
        seeds.add(origin.resolve("/sitemap_index.xml"));
        if (isRegisteredName(origin.host()) && !origin.host().startsWith("www.")) {
            seeds.add(origin.withHost("www." + origin.host()).resolve("/sitemap.xml"));
        }
        for (String hint : robotsRules.getSitemapUrls()) {
            if (isSameSite(origin, hint)) {
                seeds.add(hint.trim());
            }
        }
        return new ArrayList<>(seeds);
    }

    private static boolean isRegisteredName(String host) {
        return host.contains(".") && host.chars().anyMatch(Character::isLetter) && !host.contains(":");
    }

    private boolean isSameSite(SiteOrigin origin, String url) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return (scheme.equals("http") || scheme.equals("https")) && origin.isSameSite(uri);
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return fetch.body();
        }
        if (isGzipPayload(sitemapUrl, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                byte[] inflated = gzipInputStream.readNBytes(MAX_INFLATED_BYTES + 1);
                if (inflated.length > MAX_INFLATED_BYTES) {
                    throw new IOException("inflated sitemap exceeds " + MAX_INFLATED_BYTES + " bytes");
                }
                return new String(inflated, StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, byte[] bodyBytes) {
        if (sitemapUrl != null && sitemapUrl.toLowerCase(Locale.ROOT).endsWith(".gz")) {
            return true;
        }
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private record SitemapTask(String url, int depth) {
    }
}
