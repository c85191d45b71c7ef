package com.delta.siteaudit.generation.model;

public record CompetitorReason(
    String howLlmsDecide,
    String whatWeFoundOnYourSite,
    String whatAiDoesInstead,
    String whatMustBeBuilt
) {
}
