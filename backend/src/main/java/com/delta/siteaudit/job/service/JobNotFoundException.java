package com.delta.siteaudit.job.service;

public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No audit job with id " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
