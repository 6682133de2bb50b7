package io.cronhive.admin;

import io.cronhive.core.JobQuery;
import io.cronhive.core.JobStats;
import io.cronhive.store.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Read-only counts by job state, one store count per state.
 *
 * <p>The counts are taken one after another, so a job changing state mid-call can show up in two
 * states or none.
 */
public class JobStatsService {

    private final JobStore jobStore;
    private final Clock clock;

    public JobStatsService(JobStore jobStore, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public JobStats stats() {
        return stats(clock.instant());
    }

    public JobStats stats(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        long total = jobStore.count(JobQuery.all());
        long scheduled = jobStore.count(JobQuery.builder()
                .scheduledAfter(now)
                .disabled(false)
                .build());
        long queued = jobStore.count(JobQuery.builder().locked(true).build());
        long completed = jobStore.count(JobQuery.builder()
                .finished(true)
                .failed(false)
                .build());
        long failed = jobStore.count(JobQuery.builder().failed(true).build());
        return JobStats.of(total, scheduled, queued, completed, failed);
    }
}
