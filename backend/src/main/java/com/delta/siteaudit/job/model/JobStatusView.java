package com.delta.siteaudit.job.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(
    String jobId,
    JobStatus status,
    String stage,
    int progress,
    JobError error,
    int totalPages,
    Instant createdAt,
    Instant updatedAt
) {
    public static JobStatusView of(AuditJob job) {
        JobError error = job.status() == JobStatus.FAILED
            ? new JobError(job.errorStage(), job.errorMessage())
            : null;
        return new JobStatusView(
            job.id(),
            job.status(),
            job.currentStage(),
            job.progressPercent(),
            error,
            job.totalPages(),
            job.createdAt(),
            job.updatedAt()
        );
    }
}
