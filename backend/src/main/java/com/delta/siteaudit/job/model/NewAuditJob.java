package com.delta.siteaudit.job.model;

import java.util.List;

public record NewAuditJob(
    String targetDomain,
    List<String> comparisonDomains,
    String locale,
    String businessContext
) {
}
