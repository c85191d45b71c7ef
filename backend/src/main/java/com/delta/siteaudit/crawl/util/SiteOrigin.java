package com.delta.siteaudit.crawl.util;

import java.net.URI;
import java.util.Locale;

/**
 * Scheme, host and port a crawl is pinned to. Bare domains default to https.
 */
public record SiteOrigin(String scheme, String host, int port) {

    public static SiteOrigin parse(String domainOrUrl) {
        if (domainOrUrl == null || domainOrUrl.isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        String value = domainOrUrl.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        URI uri = UrlNormalizer.safeUri(value);
        if (uri == null || uri.getHost() == null) {
            throw new IllegalArgumentException("invalid domain: " + domainOrUrl);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return new SiteOrigin(scheme, uri.getHost().toLowerCase(Locale.ROOT), uri.getPort());
    }

    public String homepageUrl() {
        return resolve("/");
    }

    public String resolve(String path) {
        String suffix = path == null || path.isEmpty() ? "/" : (path.startsWith("/") ? path : "/" + path);
        return base() + suffix;
    }

    public SiteOrigin withHost(String otherHost) {
        return new SiteOrigin(scheme, otherHost, port);
    }

    /** True when the URL is on this site, ignoring a {@code www.} prefix on either side. */
    public boolean isSameSite(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        return UrlNormalizer.siteKey(uri.getHost()).equals(UrlNormalizer.siteKey(host));
    }

    public String displayName() {
        return port == -1 ? host : host + ":" + port;
    }

    private String base() {
        return scheme + "://" + host + (port == -1 ? "" : ":" + port);
    }
}
