package com.delta.siteaudit.job.model;

import java.time.Instant;

public record StatusHistoryEntry(String jobId, int runNumber, JobStatus status, Instant recordedAt) {
}
