package com.delta.siteaudit.job.model;

import java.time.Instant;
import java.util.List;

/**
 * One immutable artifact version. {@code payloadJson} is the validated, reconciled payload
 * exactly as written.
 */
public record StoredArtifact(
    String jobId,
    int version,
    int runNumber,
    String schemaVersion,
    String payloadJson,
    List<String> sampledUrls,
    String model,
    int attempts,
    Instant createdAt
) {
}
