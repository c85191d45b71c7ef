package com.delta.siteaudit.generation.model;

import java.util.List;

public record AiInterpretation(
    String summary,
    Confidence confidence,
    int basedOnPages,
    List<String> detectedSignals,
    List<MissingElement> missingElements
) {
    public AiInterpretation {
        detectedSignals = detectedSignals == null ? List.of() : List.copyOf(detectedSignals);
        missingElements = List.copyOf(missingElements);
    }

    public AiInterpretation withBasedOnPages(int pages) {
        return new AiInterpretation(summary, confidence, pages, detectedSignals, missingElements);
    }
}
