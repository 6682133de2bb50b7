package io.cronhive.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.JobBuilder;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobLockedException;
import io.cronhive.core.JobNotFoundException;
import io.cronhive.core.JobPage;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.core.JobType;
import io.cronhive.core.Priority;
import io.cronhive.internal.JobPersister;
import io.cronhive.internal.LockManager;
import io.cronhive.internal.SimpleJobBuilder;
import io.cronhive.schedule.ScheduleCalculator;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * CRUD surface over the job store for an outer layer (HTTP controller, CLI, dashboard).
 *
 * <p>Edits never touch {@code lockedAt}. A job under a live lock belongs to its running execution,
 * whose write-back would replace the edited fields, so {@link #update} and {@link #retry} refuse it
 * with {@link JobLockedException}. A stale lock does not block edits. Each edit is applied only if
 * the lock observed when reading the record is still in place, and re-read on contention, so an
 * edit cannot land on top of a claim it did not see.
 */
public class JobAdmin {
    private static final Logger log = LoggerFactory.getLogger(JobAdmin.class);

    public static final int DEFAULT_PURGE_DAYS = 7;
    private static final int EDIT_ATTEMPTS = 3;

    private final JobStore jobStore;
    private final DefinitionRegistry registry;
    private final JobPersister persister;
    private final ScheduleCalculator calculator;
    private final Clock clock;

    public JobAdmin(JobStore jobStore, DefinitionRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = new JobPersister(jobStore, registry, objectMapper);
        this.calculator = new ScheduleCalculator(clock);
    }

    /**
     * Insert a new job. Without a schedule or a repeat the job runs now.
     *
     * @throws io.cronhive.core.InvalidScheduleSpecException on a bad schedule, repeat or timezone
     */
    public JobRecord create(CreateJobRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        JobBuilder<Map<String, Object>> builder =
                new SimpleJobBuilder<>(request.name(), request.data(), persister::save, calculator, clock);
        if (hasText(request.timezone())) {
            builder.timezone(request.timezone());
        }
        if (hasText(request.schedule())) {
            builder.schedule(request.schedule());
        }
        if (hasText(request.priority())) {
            builder.priority(Priority.parse(request.priority()));
        }
        if (hasText(request.repeatInterval())) {
            builder.repeatEvery(request.repeatInterval(),
                    new JobBuilder.RepeatOptions(request.skipImmediate(), request.timezone()));
        }

        JobRecord created = builder.save().job();
        log.info("cronhive job created name={} id={} nextRunAt={}", created.name(), created.id(), created.nextRunAt());
        return created;
    }

    /**
     * @param page  1-based page number
     * @param limit page size
     * @param sort  null means nextRunAt ascending
     */
    public JobPage list(JobQuery query, int page, int limit, JobSort sort) {
        Objects.requireNonNull(query, "query must not be null");
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        JobSort order = sort == null ? JobSort.NEXT_RUN_ASC : sort;

        long total = jobStore.count(query);
        long skip = (long) (page - 1) * limit;
        List<JobRecord> data = skip >= total
                ? List.of()
                : jobStore.findMany(query, order, (int) skip, limit);
        return JobPage.of(data, total, page, limit);
    }

    public JobRecord get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.findById(id)
                .orElseThrow(() -> new JobNotFoundException(id, "Job not found: " + id));
    }

    /**
     * Apply a partial update. A new schedule or repeat is validated before anything is written;
     * a repeat or timezone change recomputes {@code nextRunAt} unless a schedule is given too.
     *
     * @throws JobLockedException while the job is running
     */
    public JobRecord update(String id, UpdateJobRequest request) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(request, "request must not be null");

        JobRecord updated = editGuarded(id, current -> buildUpdate(current, request));
        log.info("cronhive job updated name={} id={} nextRunAt={} disabled={}",
                updated.name(), updated.id(), updated.nextRunAt(), updated.disabled());
        return updated;
    }

    public long delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return delete(JobQuery.byId(id));
    }

    public long delete(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids must not be null");
        if (ids.isEmpty()) {
            return 0;
        }
        return delete(JobQuery.builder().ids(ids).build());
    }

    public long delete(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        long deleted = jobStore.deleteMany(query);
        log.info("cronhive jobs deleted query={} deletedCount={}", query, deleted);
        return deleted;
    }

    /**
     * Put a failed job back in line: clears the failure and finish fields, resets {@code failCount}
     * and makes the job due now.
     *
     * @throws JobNotFoundException when no failed job has this id
     * @throws JobLockedException    while the job is running
     */
    public JobRecord retry(String id) {
        Objects.requireNonNull(id, "id must not be null");

        JobRecord retried = editGuarded(id, current -> {
            if (!current.isFailed()) {
                throw new JobNotFoundException(id, "No failed job found with this ID: " + id);
            }
            return JobPatch.builder()
                    .failedAt(null)
                    .failReason(null)
                    .lastFinishedAt(null)
                    .failCount(0)
                    .nextRunAt(now());
        });
        log.info("cronhive job retried name={} id={}", retried.name(), retried.id());
        return retried;
    }

    public long purge() {
        return purge(DEFAULT_PURGE_DAYS);
    }

    /**
     * Delete finished, non-failed, unlocked jobs with nothing left to run whose last finish is older
     * than {@code daysOld} days.
     *
     * @return number of deleted jobs
     */
    public long purge(int daysOld) {
        if (daysOld < 0) {
            throw new IllegalArgumentException("daysOld must not be negative");
        }
        Instant cutoff = now().minus(Duration.ofDays(daysOld));
        long deleted = jobStore.deleteMany(JobQuery.builder()
                .finishedBefore(cutoff)
                .failed(false)
                .hasNextRun(false)
                .locked(false)
                .build());
        log.info("cronhive purge finished jobs daysOld={} cutoff={} deletedCount={}", daysOld, cutoff, deleted);
        return deleted;
    }

    private JobPatch.Builder buildUpdate(JobRecord current, UpdateJobRequest request) {
        JobPatch.Builder patch = JobPatch.builder();
        if (request.name() != null) {
            patch.name(request.name());
        }
        if (request.data() != null) {
            patch.data(request.data());
        }
        if (hasText(request.priority())) {
            patch.priority(Priority.parse(request.priority()));
        }
        if (request.disabled() != null) {
            patch.disabled(request.disabled());
        }

        String timezone = request.timezone() != null
                ? emptyToNull(request.timezone())
                : current.repeat() != null ? current.repeat().timezone() : null;
        Instant now = now();
        Instant nextRunAt = null;

        if (request.changesRepeat()) {
            JobRecord.Repeat repeat = resolveRepeat(current, request, timezone);
            patch.repeat(repeat).type(JobType.forRepeat(repeat));
            if (repeat != null) {
                nextRunAt = calculator.nextRun(repeat.interval(), repeat.timezone(), now);
            }
        }
        if (hasText(request.schedule())) {
            nextRunAt = calculator.parseRunAt(request.schedule(), timezone, now);
        }
        if (nextRunAt != null) {
            patch.nextRunAt(nextRunAt.truncatedTo(ChronoUnit.MILLIS));
        }
        return patch;
    }

    private JobRecord.Repeat resolveRepeat(JobRecord current, UpdateJobRequest request, String timezone) {
        String interval;
        if (request.repeatInterval() != null) {
            interval = emptyToNull(request.repeatInterval());
        } else {
            interval = current.repeat() != null ? current.repeat().interval() : null;
        }
        if (interval == null) {
            return null;
        }
        calculator.validate(interval, timezone);
        return new JobRecord.Repeat(interval.trim(), timezone);
    }

    /**
     * Read, build a patch from what was read, and apply it only while the lock is unchanged.
     */
    private JobRecord editGuarded(String id, Function<JobRecord, JobPatch.Builder> edit) {
        for (int attempt = 0; attempt < EDIT_ATTEMPTS; attempt++) {
            JobRecord current = get(id);
            Duration lockLifetime = lockLifetimeOf(current);
            if (!LockManager.isClaimable(current, lockLifetime, now())) {
                log.debug("cronhive edit refused while running name={} id={} lockedAt={}",
                        current.name(), id, current.lockedAt());
                throw new JobLockedException(id, current.lockedAt());
            }
            JobPatch patch = edit.apply(current)
                    .whenLockedAt(current.lockedAt())
                    .build();
            Optional<JobRecord> updated = jobStore.updateOne(id, patch);
            if (updated.isPresent()) {
                return updated.get();
            }
            log.debug("cronhive edit raced with a lock change id={} attempt={}", id, attempt + 1);
        }
        throw new IllegalStateException("Job " + id + " kept changing lock while being edited; try again");
    }

    private Duration lockLifetimeOf(JobRecord job) {
        return registry.find(job.name())
                .map(JobDefinition::lockLifetime)
                .orElseGet(() -> registry.defaults().lockLifetime());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String emptyToNull(String s) {
        return hasText(s) ? s.trim() : null;
    }
}
