package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.generation.model.AuditArtifactPayload;

import java.util.List;

public record GeneratedArtifact(
    AuditArtifactPayload payload,
    String payloadJson,
    List<String> sampledUrls,
    String model,
    int attempts
) {
}
