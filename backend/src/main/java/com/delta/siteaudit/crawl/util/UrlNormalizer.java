package com.delta.siteaudit.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical form used for deduplication: lowercase scheme and host, default port dropped,
 * fragment removed, trailing slash removed (an empty path becomes {@code /}), query kept.
 */
public final class UrlNormalizer {
    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || (scheme.equals("http") && port == 80)
            || (scheme.equals("https") && port == 443);

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else {
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
        }

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (!defaultPort) {
            out.append(':').append(port);
        }
        out.append(path);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            out.append('?').append(uri.getRawQuery());
        }
        return out.toString();
    }

    public static String hash(String url) {
        String normalized = normalize(url);
        return normalized == null ? null : HashUtils.sha256Hex(normalized);
    }

    /** Host with a leading {@code www.} removed, lowercased. */
    public static String siteKey(String host) {
        if (host == null) {
            return null;
        }
        String value = host.toLowerCase(Locale.ROOT);
        return value.startsWith("www.") ? value.substring(4) : value;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
