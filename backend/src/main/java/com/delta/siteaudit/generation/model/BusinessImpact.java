package com.delta.siteaudit.generation.model;

public record BusinessImpact(
    String costOfInvisibility,
    String whyVisibilityCompounds,
    String whyWaitingHurts,
    String recommendedOption,
    String closingLine
) {
}
