package com.delta.siteaudit.generation.model;

public record RequirementAfter(
    String requirementName,
    RequirementCategory category,
    String whatMustBeBuilt,
    String aiOutcomeUnlocked
) {
}
