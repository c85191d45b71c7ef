package com.delta.siteaudit.job.model;

import java.time.Instant;
import java.util.List;

public record AuditJob(
    String id,
    String targetDomain,
    List<String> comparisonDomains,
    String locale,
    String businessContext,
    JobStatus status,
    String currentStage,
    int progressPercent,
    JobStatus errorStage,
    String errorMessage,
    String workerId,
    Instant claimedAt,
    Instant heartbeatAt,
    int runNumber,
    int totalPages,
    Instant createdAt,
    Instant updatedAt
) {
}
