package com.delta.siteaudit.generation.client;

public record GenerationResponse(String content, String finishReason, String model) {

    public boolean isTruncated() {
        return "length".equals(finishReason);
    }
}
