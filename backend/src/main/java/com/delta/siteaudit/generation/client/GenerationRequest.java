package com.delta.siteaudit.generation.client;

public record GenerationRequest(String systemPrompt, String userPrompt, int attempt) {
}
