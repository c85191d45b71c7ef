package com.delta.siteaudit.generation.model;

public record ReadinessItem(
    String elementName,
    ReadinessStatus status,
    String whatAiRequires,
    String whatWeFound,
    String impactOnRecommendation
) {
}
