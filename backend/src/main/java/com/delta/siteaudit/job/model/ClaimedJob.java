package com.delta.siteaudit.job.model;

/**
 * A job this worker owns for one run. Every later write is conditional on both values.
 */
public record ClaimedJob(AuditJob job, String workerId) {

    public String jobId() {
        return job.id();
    }

    public int runNumber() {
        return job.runNumber();
    }
}
