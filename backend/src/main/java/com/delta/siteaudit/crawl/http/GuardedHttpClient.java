package com.delta.siteaudit.crawl.http;

import com.delta.siteaudit.config.CrawlerProperties;
import com.delta.siteaudit.crawl.model.HttpFetchResult;
import jakarta.annotation.PreDestroy;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.Proxy;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Outbound GET client for crawling untrusted sites. Redirects are followed by hand so that
 * {@link SsrfGuard} sees every hop, connections resolve through {@link GuardedDns}, and bodies
 * are read with a hard byte cap.
 *
 * <p>Each fetch runs against a deadline covering connect, headers and body together: the
 * request timeout, or the caller's deadline when that comes first. When it passes the call is
 * cancelled and its socket closed, so the calling thread is released on time even if the
 * server keeps trickling bytes.
 */
@Service
public class GuardedHttpClient {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String BODY_TOO_LARGE = "body_too_large";
    public static final String TOO_MANY_REDIRECTS = "too_many_redirects";
    public static final String INTERRUPTED = "interrupted";

    private static final Logger log = LoggerFactory.getLogger(GuardedHttpClient.class);

    private final CrawlerProperties properties;
    private final SsrfGuard ssrfGuard;
    private final OkHttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public GuardedHttpClient(CrawlerProperties properties, SsrfGuard ssrfGuard) {
        this.properties = properties;
        this.ssrfGuard = ssrfGuard;
        Duration timeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.client = new OkHttpClient.Builder()
            .dns(new GuardedDns(ssrfGuard))
            .proxy(Proxy.NO_PROXY)
            .followRedirects(false)
            .followSslRedirects(false)
            .retryOnConnectionFailure(false)
            .protocols(List.of(Protocol.HTTP_1_1))
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader, Instant deadline) {
        return get(url, acceptHeader, properties.getMaxResponseBytes(), deadline);
    }

    /**
     * Fetches {@code url}, following up to the configured number of redirects.
     *
     * @param deadline latest instant the whole fetch may run until, or null for the request
     *                 timeout alone
     */
    public HttpFetchResult get(String url, String acceptHeader, int maxBytes, Instant deadline) {
        Instant startedAt = Instant.now();
        Instant fetchDeadline = startedAt.plusSeconds(properties.getRequestTimeoutSeconds());
        if (deadline != null && deadline.isBefore(fetchDeadline)) {
            fetchDeadline = deadline;
        }
        URI current = toUri(url);
        if (current == null || current.getHost() == null) {
            return errorResult(url, null, 0, startedAt, SsrfGuard.INVALID_URL, "URL missing host or malformed");
        }
        int maxRedirects = properties.getMaxRedirects();
        for (int hop = 0; hop <= maxRedirects; hop++) {
            GuardDecision decision = ssrfGuard.inspect(current);
            if (!decision.allowed()) {
                return errorResult(url, current, hop, startedAt, decision.errorCode(), decision.reason());
            }
            Request request;
            try {
                request = buildRequest(current, acceptHeader);
            } catch (IllegalArgumentException e) {
                return errorResult(url, current, hop, startedAt, SsrfGuard.INVALID_URL, e.getMessage());
            }
            try {
                if (!enforcePerHostDelay(current.getHost().toLowerCase(Locale.ROOT), fetchDeadline)) {
                    return errorResult(url, current, hop, startedAt, TIMEOUT, "deadline passed before request");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return errorResult(url, current, hop, startedAt, INTERRUPTED, e.getMessage());
            }
            long remainingMs = Duration.between(Instant.now(), fetchDeadline).toMillis();
            if (remainingMs <= 0) {
                return errorResult(url, current, hop, startedAt, TIMEOUT, "deadline passed before request");
            }

            Call call = client.newCall(request);
            call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);
            try (Response response = call.execute()) {
                String location = response.header("Location");
                if (isRedirect(response.code()) && location != null) {
                    URI next = resolveLocation(current, location);
                    if (next == null) {
                        return errorResult(url, current, hop, startedAt, SsrfGuard.INVALID_URL, "bad redirect location");
                    }
                    current = next;
                    continue;
                }
                return readBody(url, current, hop, response, maxBytes, startedAt);
            } catch (BlockedAddressException e) {
                return errorResult(url, current, hop, startedAt, SsrfGuard.SSRF_BLOCKED, e.getMessage());
            } catch (IOException e) {
                if (isBlocked(e)) {
                    return errorResult(url, current, hop, startedAt, SsrfGuard.SSRF_BLOCKED, e.getMessage());
                }
                if (e instanceof InterruptedIOException || !Instant.now().isBefore(fetchDeadline)) {
                    return errorResult(url, current, hop, startedAt, TIMEOUT, e.getMessage());
                }
                return errorResult(url, current, hop, startedAt, IO_ERROR, e.getMessage());
            }
        }
        return errorResult(url, current, maxRedirects, startedAt, TOO_MANY_REDIRECTS,
            "more than " + maxRedirects + " redirects");
    }

    @PreDestroy
    public void shutdown() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Request buildRequest(URI uri, String acceptHeader) {
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        return new Request.Builder()
            .url(uri.toString())
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8")
            .get()
            .build();
    }

    private HttpFetchResult readBody(
        String url,
        URI finalUri,
        int redirects,
        Response response,
        int maxBytes,
        Instant startedAt
    ) throws IOException {
        String contentType = response.header("Content-Type");
        ResponseBody body = response.body();
        if (body == null) {
            return success(url, finalUri, redirects, response.code(), new byte[0], contentType, startedAt);
        }
        long declaredLength = body.contentLength();
        if (declaredLength > maxBytes) {
            return errorResult(url, finalUri, redirects, startedAt, BODY_TOO_LARGE,
                "declared length " + declaredLength + " exceeds " + maxBytes);
        }
        byte[] bytes;
        try (InputStream in = body.byteStream()) {
            bytes = in.readNBytes(maxBytes + 1);
        }
        if (bytes.length > maxBytes) {
            return errorResult(url, finalUri, redirects, startedAt, BODY_TOO_LARGE,
                "body exceeds " + maxBytes + " bytes");
        }
        return success(url, finalUri, redirects, response.code(), bytes, contentType, startedAt);
    }

    /**
     * Waits out the politeness delay for {@code host}. Returns false without sleeping when the
     * wait would run past {@code deadline}.
     */
    private boolean enforcePerHostDelay(String host, Instant deadline) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(deadline)) {
                return false;
            }
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
            return true;
        }
    }

    private static boolean isBlocked(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof BlockedAddressException) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static URI resolveLocation(URI base, String location) {
        try {
            URI resolved = base.resolve(new URI(location.trim()));
            return resolved.getHost() == null ? null : resolved;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    private static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static HttpFetchResult success(
        String url,
        URI finalUri,
        int redirects,
        int status,
        byte[] bytes,
        String contentType,
        Instant startedAt
    ) {
        return new HttpFetchResult(
            url,
            finalUri,
            status,
            new String(bytes, charsetOf(contentType)),
            bytes,
            contentType,
            redirects,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            null,
            null
        );
    }

    private static HttpFetchResult errorResult(
        String url,
        URI lastUri,
        int redirects,
        Instant startedAt,
        String code,
        String message
    ) {
        log.debug("GET {} failed at {}: {} {}", url, lastUri, code, message);
        return new HttpFetchResult(
            url,
            lastUri,
            0,
            null,
            null,
            null,
            redirects,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
