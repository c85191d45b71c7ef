package com.delta.siteaudit.crawl.robots;

import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.http.GuardedHttpClient;
import com.delta.siteaudit.crawl.model.HttpFetchResult;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final Duration CACHE_TTL = Duration.ofHours(1);
    private static final int ROBOTS_MAX_BYTES = 512 * 1024;

    private final CrawlerProperties properties;
    private final GuardedHttpClient httpClient;
    private final Map<String, CachedRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(CrawlerProperties properties, GuardedHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    /**
     * Rules for {@code origin}, fetched at most once an hour. A fetch that fails at the transport
     * level is answered by the fail-open setting but not cached.
     *
     * @param deadline latest instant the robots.txt fetch may run until
     */
    public RobotsRules rulesFor(SiteOrigin origin, Instant deadline) {
        String key = origin.homepageUrl();
        CachedRules cached = cache.get(key);
        if (cached != null && cached.loadedAt().plus(CACHE_TTL).isAfter(Instant.now())) {
            return cached.rules();
        }
        LoadedRules loaded = load(origin, deadline);
        if (loaded.cacheable()) {
            cache.put(key, new CachedRules(loaded.rules(), Instant.now()));
        }
        return loaded.rules();
    }

    public boolean isAllowed(RobotsRules rules, String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return false;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    private LoadedRules load(SiteOrigin origin, Instant deadline) {
        String robotsUrl = origin.resolve("/robots.txt");
        HttpFetchResult fetch = httpClient.get(
            robotsUrl,
            "text/plain,text/*;q=0.9,*/*;q=0.1",
            ROBOTS_MAX_BYTES,
            deadline
        );
        if (fetch.errorCode() == null && (fetch.statusCode() == 404 || fetch.statusCode() == 410)) {
            log.debug("No robots.txt for {}", origin.displayName());
            return new LoadedRules(RobotsRules.allowAll(), true);
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getRobots().isFailOpen();
            log.warn(
                "robots fetch failed host={} status={} errorCode={} decision={}",
                origin.displayName(),
                fetch.statusCode(),
                fetch.errorCode(),
                failOpen ? "allow_all" : "disallow_all"
            );
            RobotsRules fallback = failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
            return new LoadedRules(fallback, fetch.errorCode() == null);
        }
        RobotsRules rules = RobotsRules.parse(fetch.body(), agentToken());
        log.debug("Loaded robots for {} with {} sitemap hints", origin.displayName(), rules.getSitemapUrls().size());
        return new LoadedRules(rules, true);
    }

    private String agentToken() {
        String userAgent = properties.getUserAgent().toLowerCase(Locale.ROOT);
        int slash = userAgent.indexOf('/');
        return slash > 0 ? userAgent.substring(0, slash).trim() : userAgent.trim();
    }

    private record CachedRules(RobotsRules rules, Instant loadedAt) {
    }

    private record LoadedRules(RobotsRules rules, boolean cacheable) {
    }
}
