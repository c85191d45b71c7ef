package com.delta.siteaudit.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("site-audit/0.1"));
    }

    @Test
    void concurrencyDelayAndRedirectsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setFetchConcurrency(0);
        properties.setPerHostDelayMs(-10);
        properties.setMaxRedirects(50);
        properties.setMaxPagesTarget(0);
        assertEquals(1, properties.getFetchConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(10, properties.getMaxRedirects());
        assertEquals(1, properties.getMaxPagesTarget());
    }

    @Test
    void generationAttemptsStayWithinOneToFive() {
        AuditProperties properties = new AuditProperties();
        properties.getGeneration().setMaxAttempts(0);
        assertEquals(1, properties.getGeneration().getMaxAttempts());
        properties.getGeneration().setMaxAttempts(9);
        assertEquals(5, properties.getGeneration().getMaxAttempts());
    }
}
