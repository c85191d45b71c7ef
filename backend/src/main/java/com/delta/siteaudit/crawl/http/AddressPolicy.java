package com.delta.siteaudit.crawl.http;

import java.net.InetAddress;

/**
 * Decides whether a resolved address may be connected to for a given host name.
 */
@FunctionalInterface
public interface AddressPolicy {

    boolean permits(String host, InetAddress address);

    static AddressPolicy publicOnly() {
        return (host, address) -> !SsrfGuard.isDisallowed(address);
    }
}
