package io.cronhive.core;

import java.time.Instant;

/**
 * The job is being executed; its fields belong to the running execution until the lock is released
 * or goes stale.
 */
public class JobLockedException extends IllegalStateException {

    private final String jobId;
    private final Instant lockedAt;

    public JobLockedException(String jobId, Instant lockedAt) {
        super("Job " + jobId + " is running (locked at " + lockedAt + "); try again once it has finished");
        this.jobId = jobId;
        this.lockedAt = lockedAt;
    }

    public String jobId() {
        return jobId;
    }

    public Instant lockedAt() {
        return lockedAt;
    }
}
