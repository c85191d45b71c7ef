package com.delta.siteaudit.generation.model;

public record RequirementBefore(
    String requirementName,
    RequirementCategory category,
    String whyAiNeedsThis,
    RequirementStatus currentStatus,
    String impactIfMissing
) {
}
