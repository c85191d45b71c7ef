package com.delta.siteaudit.job.service;

import com.delta.siteaudit.crawl.service.CrawlExhaustedException;
import com.delta.siteaudit.generation.client.GenerationCallException;
import com.delta.siteaudit.generation.service.SchemaValidationException;

/**
 * Fixed, caller-facing wording for job failures. Exception messages never reach callers.
 */
public final class JobFailureMessages {
    public static final String ROBOTS_BLOCKED = "The website does not allow automated analysis.";
    public static final String NO_PAGES = "We could not read any pages from the website.";
    public static final String GENERATION_UNAVAILABLE = "The analysis service is unavailable. Please retry later.";
    public static final String INVALID_OUTPUT = "The analysis could not be completed. Please retry.";
    public static final String UNEXPECTED = "Something went wrong while processing this audit.";
    public static final String WORKER_LOST = "worker lost";

    private JobFailureMessages() {
    }

    public static String forFailure(Throwable failure) {
        if (failure instanceof CrawlExhaustedException exhausted) {
            return "robots_disallow".equals(exhausted.getBlockedReason()) ? ROBOTS_BLOCKED : NO_PAGES;
        }
        if (failure instanceof GenerationCallException) {
            return GENERATION_UNAVAILABLE;
        }
        if (failure instanceof SchemaValidationException) {
            return INVALID_OUTPUT;
        }
        return UNEXPECTED;
    }
}
