package com.delta.siteaudit.crawl.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether an outbound request may be made to a URI. The scheme must be http or https
 * and every address the host resolves to must be publicly routable.
 *
 * <p>{@link #inspect} runs before each hop, including every redirect. The connection itself
 * resolves through {@link #resolvePermitted} again, so only addresses that passed the check
 * are ever dialed.
 */
@Component
public class SsrfGuard {
    public static final String SSRF_BLOCKED = "ssrf_blocked";
    public static final String DNS_ERROR = "dns_error";
    public static final String INVALID_URL = "invalid_url";

    private static final Logger log = LoggerFactory.getLogger(SsrfGuard.class);

    private final HostResolver hostResolver;
    private final AddressPolicy addressPolicy;

    public SsrfGuard(HostResolver hostResolver, AddressPolicy addressPolicy) {
        this.hostResolver = hostResolver;
        this.addressPolicy = addressPolicy;
    }

    public GuardDecision inspect(URI uri) {
        if (uri == null) {
            return GuardDecision.reject(INVALID_URL, "missing URI");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return GuardDecision.reject(SSRF_BLOCKED, "scheme not allowed: " + scheme);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return GuardDecision.reject(INVALID_URL, "URL missing host");
        }
        String bareHost = host.startsWith("[") && host.endsWith("]")
            ? host.substring(1, host.length() - 1)
            : host;
        try {
            resolvePermitted(bareHost);
        } catch (BlockedAddressException e) {
            return GuardDecision.reject(SSRF_BLOCKED, "non-public address for " + bareHost);
        } catch (UnknownHostException e) {
            return GuardDecision.reject(DNS_ERROR, "unresolvable host " + bareHost);
        }
        return GuardDecision.allow();
    }

    /**
     * Resolves a host and returns its addresses only if all of them are permitted.
     *
     * @throws BlockedAddressException if any address is private or otherwise reserved
     */
    public List<InetAddress> resolvePermitted(String host) throws UnknownHostException {
        InetAddress[] addresses = hostResolver.resolve(host);
        if (addresses == null || addresses.length == 0) {
            throw new UnknownHostException("no addresses for " + host);
        }
        for (InetAddress address : addresses) {
            if (!addressPolicy.permits(host, address)) {
                log.info("Blocked request to {} resolving to {}", host, address.getHostAddress());
                throw new BlockedAddressException(host, address.getHostAddress());
            }
        }
        return List.of(addresses);
    }

    static boolean isDisallowed(InetAddress address) {
        if (address.isAnyLocalAddress()
            || address.isLoopbackAddress()
            || address.isLinkLocalAddress()
            || address.isSiteLocalAddress()
            || address.isMulticastAddress()) {
            return true;
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = raw[0] & 0xff;
            int second = raw[1] & 0xff;
            // 0.0.0.0/8 and carrier-grade NAT 100.64.0.0/10
            return first == 0 || (first == 100 && second >= 64 && second <= 127);
        }
        if (address instanceof Inet6Address) {
            // unique local fc00::/7
            return (raw[0] & 0xfe) == 0xfc;
        }
        return false;
    }
}
