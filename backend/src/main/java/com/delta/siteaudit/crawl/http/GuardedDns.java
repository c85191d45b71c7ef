package com.delta.siteaudit.crawl.http;

import okhttp3.Dns;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Connection-time resolver. The addresses handed to the socket are the ones the guard just
 * checked, so a DNS answer that changes after {@link SsrfGuard#inspect} cannot redirect the
 * connection to a private network.
 */
class GuardedDns implements Dns {
    private final SsrfGuard ssrfGuard;

    GuardedDns(SsrfGuard ssrfGuard) {
        this.ssrfGuard = ssrfGuard;
    }

    @Override
    public List<InetAddress> lookup(String hostname) throws UnknownHostException {
        return ssrfGuard.resolvePermitted(hostname);
    }
}
