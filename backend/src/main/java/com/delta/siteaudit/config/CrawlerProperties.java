package com.delta.siteaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "site-audit/0.1 (+contact)";
    private static final int MAX_REDIRECT_CAP = 10;

    private String userAgent;
    private int requestTimeoutSeconds = 10;
    private int maxResponseBytes = 5 * 1024 * 1024;
    private int fetchConcurrency = 4;
    private int perHostDelayMs = 200;
    private int crawlBudgetSeconds = 300;
    private int maxPagesTarget = 60;
    private int maxPagesComparison = 15;
    private int maxRedirects = 5;
    private int maxLinksPerPage = 30;
    private Robots robots = new Robots();
    private Sitemap sitemap = new Sitemap();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxResponseBytes() {
        return Math.max(1024, maxResponseBytes);
    }

    public void setMaxResponseBytes(int maxResponseBytes) {
        this.maxResponseBytes = Math.max(1024, maxResponseBytes);
    }

    public int getFetchConcurrency() {
        return Math.max(1, fetchConcurrency);
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = Math.max(1, fetchConcurrency);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getCrawlBudgetSeconds() {
        return Math.max(1, crawlBudgetSeconds);
    }

    public void setCrawlBudgetSeconds(int crawlBudgetSeconds) {
        this.crawlBudgetSeconds = Math.max(1, crawlBudgetSeconds);
    }

    public int getMaxPagesTarget() {
        return Math.max(1, maxPagesTarget);
    }

    public void setMaxPagesTarget(int maxPagesTarget) {
        this.maxPagesTarget = Math.max(1, maxPagesTarget);
    }

    public int getMaxPagesComparison() {
        return Math.max(1, maxPagesComparison);
    }

    public void setMaxPagesComparison(int maxPagesComparison) {
        this.maxPagesComparison = Math.max(1, maxPagesComparison);
    }

    public int getMaxRedirects() {
        return Math.min(MAX_REDIRECT_CAP, Math.max(0, maxRedirects));
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = Math.min(MAX_REDIRECT_CAP, Math.max(0, maxRedirects));
    }

    public int getMaxLinksPerPage() {
        return Math.max(1, maxLinksPerPage);
    }

    public void setMaxLinksPerPage(int maxLinksPerPage) {
        this.maxLinksPerPage = Math.max(1, maxLinksPerPage);
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Robots {
        private boolean failOpen = true;

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }

    public static class Sitemap {
        private int maxUrls = 100;
        private int maxChildSitemaps = 5;

        public int getMaxUrls() {
            return Math.max(0, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(0, maxUrls);
        }

        public int getMaxChildSitemaps() {
            return Math.max(0, maxChildSitemaps);
        }

        public void setMaxChildSitemaps(int maxChildSitemaps) {
            this.maxChildSitemaps = Math.max(0, maxChildSitemaps);
        }
    }
}
