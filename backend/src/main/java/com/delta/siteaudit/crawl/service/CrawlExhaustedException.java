package com.delta.siteaudit.crawl.service;

/**
 * No usable page was obtained for the target domain.
 */
public class CrawlExhaustedException extends RuntimeException {
    private final String domain;
    private final String blockedReason;

    public CrawlExhaustedException(String domain, String blockedReason) {
        super("No pages could be crawled for " + domain
            + (blockedReason == null ? "" : " (" + blockedReason + ")"));
        this.domain = domain;
        this.blockedReason = blockedReason;
    }

    public String getDomain() {
        return domain;
    }

    public String getBlockedReason() {
        return blockedReason;
    }
}
