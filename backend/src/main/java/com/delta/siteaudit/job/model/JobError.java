package com.delta.siteaudit.job.model;

public record JobError(JobStatus stage, String message) {
}
