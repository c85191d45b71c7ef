package com.delta.siteaudit.job.model;

public record CreateJobResponse(String jobId) {
}
