package com.delta.siteaudit.job.service;

public record WorkerStatusResponse(boolean running, int workerCount, int pendingJobs, int runningJobs) {
}
