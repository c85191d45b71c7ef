package com.delta.siteaudit.job.model;

import java.util.List;

/**
 * Job lifecycle. Running stages advance strictly in declaration order; FAILED is reachable
 * from every non-terminal state.
 */
public enum JobStatus {
    PENDING(5),
    CRAWLING(10),
    ANALYZING(65),
    ASSEMBLING(90),
    COMPLETED(100),
    FAILED(0);

    public static final List<JobStatus> RUNNING = List.of(CRAWLING, ANALYZING, ASSEMBLING);
    public static final List<JobStatus> HAPPY_PATH = List.of(PENDING, CRAWLING, ANALYZING, ASSEMBLING, COMPLETED);

    private final int entryProgress;

    JobStatus(int entryProgress) {
        this.entryProgress = entryProgress;
    }

    public int entryProgress() {
        return entryProgress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isRunning() {
        return RUNNING.contains(this);
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        int index = HAPPY_PATH.indexOf(this);
        return index >= 0 && index + 1 < HAPPY_PATH.size() && HAPPY_PATH.get(index + 1) == target;
    }
}
