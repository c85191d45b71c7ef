package com.delta.siteaudit.crawl.http;

import java.net.UnknownHostException;

/**
 * Raised during resolution when a host maps to an address the {@link AddressPolicy} rejects.
 * It is an {@link UnknownHostException} so the HTTP client aborts the connect before any
 * socket is opened.
 */
public class BlockedAddressException extends UnknownHostException {
    private final String host;

    public BlockedAddressException(String host, String address) {
        super("non-public address " + address + " for " + host);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
