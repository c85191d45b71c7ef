package com.delta.siteaudit.crawl.http;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves a host name to every address it maps to. Production uses the system resolver;
 * tests substitute a fixed mapping.
 */
@FunctionalInterface
public interface HostResolver {
    InetAddress[] resolve(String host) throws UnknownHostException;
}
