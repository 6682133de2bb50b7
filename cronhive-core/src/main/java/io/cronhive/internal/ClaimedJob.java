package io.cronhive.internal;

import io.cronhive.core.JobRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * A job this process holds the lock on.
 *
 * @param job          the record as seen at claim time, with {@code lockedAt} set to this claim
 * @param lockedAt     the lock value written by the claim; doubles as the ownership token
 * @param lockLifetime how long the claim is honored before others may recover it
 */
public record ClaimedJob(JobRecord job, Instant lockedAt, Duration lockLifetime) {

    public String id() {
        return job.id();
    }

    public String name() {
        return job.name();
    }

    public Instant expiresAt() {
        return lockedAt.plus(lockLifetime);
    }
}
