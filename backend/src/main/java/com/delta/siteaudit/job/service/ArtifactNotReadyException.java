package com.delta.siteaudit.job.service;

import com.delta.siteaudit.job.model.JobStatus;

public class ArtifactNotReadyException extends RuntimeException {
    private final JobStatus status;

    public ArtifactNotReadyException(String jobId, JobStatus status) {
        super("Audit " + jobId + " has no artifact yet (status " + status + ")");
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
