package io.cronhive.internal;

import io.cronhive.core.JobRecord;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Claims, releases and recovers job locks.
 *
 * <p>All lock changes go through {@link JobStore#compareAndSwapLock}; the store arbitrates every race.
 * A lock older than its lock lifetime is stale and may be claimed as if absent, which is how work
 * abandoned by a crashed process is recovered.
 *
 * <p>The worker id is not stored; lock ownership is the {@code lockedAt} value itself. It tags
 * claim, recovery and release log lines so contention across processes can be traced.
 */
public class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final JobStore jobStore;
    private final Clock clock;
    private final String workerId;

    public LockManager(JobStore jobStore, Clock clock, String workerId) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Unlocked, or locked at or before {@code now - lockLifetime}.
     */
    public static boolean isClaimable(JobRecord job, Duration lockLifetime, Instant now) {
        Instant lockedAt = job.lockedAt();
        return lockedAt == null || !lockedAt.isAfter(now.minus(lockLifetime));
    }

    /**
     * Try to take the lock on {@code job}, expecting the lock value observed in this snapshot.
     *
     * @return the claim, or empty when the lock is live, another claimer won the race or the job is
     * no longer due
     */
    public Optional<ClaimedJob> tryClaim(JobRecord job, Duration lockLifetime) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }

        Instant now = now();
        if (!isClaimable(job, lockLifetime, now)) {
            return Optional.empty();
        }

        // a claimable lock is strictly older than now, so the swap always changes the stored value
        Instant observed = job.lockedAt();
        Instant lockedAt = now;

        if (!jobStore.compareAndSwapLock(job.id(), observed, lockedAt)) {
            log.debug("cronhive lock contention name={} id={} worker={}", job.name(), job.id(), workerId);
            return Optional.empty();
        }

        // the snapshot may predate a whole run elsewhere (lock taken and released again)
        Optional<JobRecord> current = jobStore.findById(job.id());
        if (current.isEmpty()) {
            return Optional.empty();
        }
        if (!current.get().isDue(now)) {
            log.debug("cronhive job no longer due after claim name={} id={} nextRunAt={} worker={}",
                    job.name(), job.id(), current.get().nextRunAt(), workerId);
            jobStore.compareAndSwapLock(job.id(), lockedAt, null);
            return Optional.empty();
        }

        if (observed != null) {
            log.warn("cronhive recovered stale lock name={} id={} lockedAt={} lockLifetime={} worker={}",
                    job.name(), job.id(), observed, lockLifetime, workerId);
        } else {
            log.debug("cronhive job claimed name={} id={} lockedAt={} worker={}",
                    job.name(), job.id(), lockedAt, workerId);
        }
        return Optional.of(new ClaimedJob(current.get(), lockedAt, lockLifetime));
    }

    /**
     * Release a lock this process holds. A no-op when the lock has since been recovered by someone else.
     *
     * @return true when the lock was cleared
     */
    public boolean release(ClaimedJob claim) {
        Objects.requireNonNull(claim, "claim must not be null");
        boolean released = jobStore.compareAndSwapLock(claim.id(), claim.lockedAt(), null);
        if (!released) {
            log.warn("cronhive lock already taken over name={} id={} lockedAt={} worker={}",
                    claim.name(), claim.id(), claim.lockedAt(), workerId);
        }
        return released;
    }

    /**
     * Clear the lock whoever holds it.
     *
     * @return true when a lock was cleared
     */
    public boolean release(String id) {
        Objects.requireNonNull(id, "id must not be null");
        for (int attempt = 0; attempt < 5; attempt++) {
            Optional<JobRecord> current = jobStore.findById(id);
            if (current.isEmpty() || current.get().lockedAt() == null) {
                return false;
            }
            if (jobStore.compareAndSwapLock(id, current.get().lockedAt(), null)) {
                return true;
            }
        }
        throw new IllegalStateException("Could not release lock of job " + id + " after repeated contention");
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
