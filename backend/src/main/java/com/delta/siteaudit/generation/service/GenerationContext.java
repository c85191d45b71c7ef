package com.delta.siteaudit.generation.service;

import java.util.List;

public record GenerationContext(
    String targetDomain,
    List<String> comparisonDomains,
    String locale,
    String businessContext,
    SiteSignalSummary signals
) {
}
