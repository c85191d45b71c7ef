package com.delta.siteaudit.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    int redirectCount,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isHtml() {
        if (contentType == null) {
            return false;
        }
        String value = contentType.toLowerCase(Locale.ROOT);
        return value.contains("text/html") || value.contains("application/xhtml");
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /** Short failure label for diagnostics: the error code, or {@code http_<status>}. */
    public String failureCode() {
        if (errorCode != null) {
            return errorCode;
        }
        return "http_" + statusCode;
    }
}
