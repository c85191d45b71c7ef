package com.delta.siteaudit.generation.model;

public record VisibilitySummary(
    int chatgptVisibilityPercent,
    int geminiVisibilityPercent,
    int perplexityVisibilityPercent,
    VisibilityLabel chatgptLabel,
    VisibilityLabel geminiLabel,
    VisibilityLabel perplexityLabel,
    String headline
) {
}
