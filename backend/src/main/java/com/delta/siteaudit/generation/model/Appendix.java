package com.delta.siteaudit.generation.model;

import java.util.List;

/**
 * Filled by the pipeline from the sampled pages, never taken from generated output.
 */
public record Appendix(
    List<String> sampledUrls,
    String dataLimitations,
    int pagesAnalyzedTarget,
    int pagesAnalyzedCompetitors
) {
    public Appendix {
        sampledUrls = List.copyOf(sampledUrls);
    }
}
