package io.cronhive.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.Cronhive;
import io.cronhive.CronhiveListener;
import io.cronhive.JobBuilder;
import io.cronhive.JobHandler;
import io.cronhive.config.CronhiveProperties;
import io.cronhive.core.DefinitionOptions;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.core.JobType;
import io.cronhive.core.PersistResult;
import io.cronhive.schedule.ScheduleCalculator;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cronhive is a polling job scheduler &amp; runner over a {@link JobStore}.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-time jobs (run at a specific Instant/ISO string/"in 10 minutes")</li>
 *   <li>Recurring jobs (cron expression / repeatEvery interval)</li>
 *   <li>Distributed-safe execution via compare-and-swap locks with stale-lock recovery</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * cronhive.define(new SendReportHandler());
 * cronhive.start();
 *
 * cronhive.create("send-report", data)
 *       .schedule("2026-01-20T09:30:00Z")
 *       .save();
 *
 * cronhive.every("cleanup", "0 3 * * *", JobBuilder.RepeatOptions.defaults());
 * cronhive.now("sync-something", data);
 * cronhive.stop();
 * }</pre>
 */
public class DefaultCronhive implements Cronhive {
    private static final Logger log = LoggerFactory.getLogger(DefaultCronhive.class);

    private final CronhiveProperties props;
    private final JobStore jobStore;
    private final DefinitionRegistry registry;
    private final Clock clock;
    private final ScheduleCalculator calculator;
    private final JobPersister persister;
    private final CronhiveEvents events = new CronhiveEvents();
    private final WorkerPool workerPool;
    private final JobPoller poller;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultCronhive(CronhiveProperties props, JobStore jobStore, DefinitionRegistry registry,
                           ObjectMapper objectMapper) {
        this(props, jobStore, registry, objectMapper, Clock.systemUTC());
    }

    public DefaultCronhive(CronhiveProperties props, JobStore jobStore, DefinitionRegistry registry,
                           ObjectMapper objectMapper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        this.calculator = new ScheduleCalculator(clock);
        this.persister = new JobPersister(jobStore, registry, objectMapper);
        this.workerId = resolveWorkerId(props.getWorkerId());
        LockManager lockManager = new LockManager(jobStore, clock, workerId);
        this.workerPool = new WorkerPool(jobStore, lockManager, calculator, props, events, clock);
        this.poller = new JobPoller(jobStore, registry, lockManager, workerPool, props, events, clock);
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     *
     * @throws IllegalArgumentException on invalid configuration, including an invalid startup recurring job
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            validateProperties();
            log.info("Cronhive starting with processEvery={}, defaultLockLifetime={}, workerId={}, maxConcurrency={}, batchSize={}, definitions={}",
                    props.getProcessEvery(),
                    props.getDefaultLockLifetime(),
                    workerId,
                    props.getMaxConcurrency(),
                    props.getBatchSize(),
                    registry.names());
            registerRecurringJobs();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        poller.start();
        log.info("Cronhive started successfully.");
        events.ready();
    }

    /**
     * Stop polling, then wait up to the default lock lifetime for running jobs. Idempotent.
     */
    @Override
    public void stop() {
        boolean wasStarted = started.compareAndSet(true, false);
        if (!wasStarted && !workerPool.isActive()) {
            return;
        }

        log.info("Cronhive stopping...");
        poller.stop();
        workerPool.shutdown(props.getDefaultLockLifetime());
        log.info("Cronhive stopped successfully.");
        events.stopped();
    }

    @Override
    public <T> JobDefinition<T> define(JobHandler<T> handler) {
        return registry.define(handler);
    }

    @Override
    public <T> JobDefinition<T> define(String name, DefinitionOptions options, JobHandler<T> handler) {
        return registry.define(name, options, handler);
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public <T> JobBuilder<T> create(String name, T data) {
        return new SimpleJobBuilder<>(name, data, persister::save, calculator, clock);
    }

    /**
     * Create a job builder without data.
     */
    @Override
    public JobBuilder<Void> create(String name) {
        return new SimpleJobBuilder<>(name, null, persister::save, calculator, clock);
    }

    @Override
    public <T> JobBuilder<T> schedule(String name, Instant time, T data) {
        return this.create(name, data)
                .schedule(time);
    }

    @Override
    public JobBuilder<Void> schedule(String name, Instant time) {
        return this.create(name)
                .schedule(time);
    }

    @Override
    public <T> PersistResult every(String name, String interval, T data, JobBuilder.RepeatOptions options) {
        JobBuilder<T> b = this.create(name, data).single();
        if (options != null) {
            b.repeatEvery(interval, options);
        } else {
            b.repeatEvery(interval);
        }
        return b.save();
    }

    @Override
    public PersistResult every(String name, String interval, JobBuilder.RepeatOptions options) {
        return this.every(name, interval, null, options);
    }

    @Override
    public <T> PersistResult every(String name, Number interval, T data, JobBuilder.RepeatOptions options) {
        JobBuilder<T> b = this.create(name, data).single();
        if (options != null) {
            b.repeatEvery(interval, options);
        } else {
            b.repeatEvery(interval);
        }
        return b.save();
    }

    @Override
    public PersistResult every(String name, Number interval, JobBuilder.RepeatOptions options) {
        return this.every(name, interval, null, options);
    }

    /**
     * Create and persist a job that runs immediately (nextRunAt = now).
     * Callers do not need to call {@code save()}.
     */
    @Override
    public <T> PersistResult now(String name, T data) {
        return this.create(name, data)
                .schedule(nowInstant())
                .save();
    }

    @Override
    public PersistResult now(String name) {
        return this.create(name)
                .schedule(nowInstant())
                .save();
    }

    @Override
    public List<JobRecord> jobs(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return jobStore.findMany(query, JobSort.NEXT_RUN_ASC, 0, 0);
    }

    @Override
    public long disable(JobQuery query) {
        return setDisabled(query, true);
    }

    @Override
    public long enable(JobQuery query) {
        return setDisabled(query, false);
    }

    @Override
    public void addListener(CronhiveListener listener) {
        events.add(listener);
    }

    @Override
    public void removeListener(CronhiveListener listener) {
        events.remove(listener);
    }

    /**
     * Run one poll tick on the calling thread. Works whether or not the scheduler is started.
     *
     * @return number of jobs dispatched
     */
    public int pollOnce() {
        return poller.tick();
    }

    public JobPoller.State pollerState() {
        return poller.state();
    }

    /**
     * Executions dispatched and not yet settled.
     */
    public int running() {
        return workerPool.running();
    }

    public String workerId() {
        return workerId;
    }

    public DefinitionRegistry registry() {
        return registry;
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private long setDisabled(JobQuery query, boolean disabled) {
        Objects.requireNonNull(query, "query must not be null");
        long changed = 0;
        for (JobRecord job : jobStore.findMany(query)) {
            if (job.disabled() == disabled) {
                continue;
            }
            if (jobStore.updateOne(job.id(), JobPatch.builder().disabled(disabled).build()).isPresent()) {
                changed++;
            }
        }
        log.debug("cronhive {} jobs query={} changed={}", disabled ? "disabled" : "enabled", query, changed);
        return changed;
    }

    private void validateProperties() {
        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "cronhive.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("cronhive.processEvery must be a positive duration");
        }

        Duration lockLifetime = Objects.requireNonNull(props.getDefaultLockLifetime(), "cronhive.defaultLockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("cronhive.defaultLockLifetime must be a positive duration");
        }
        if (props.getBatchSize() <= 0) {
            throw new IllegalArgumentException("cronhive.batchSize must be a positive number");
        }
        if (props.getMaxRetryCount() < 0) {
            throw new IllegalArgumentException("cronhive.maxRetryCount must not be negative");
        }
    }

    /**
     * Jobs from {@code cronhive.recurring.*} are created once; an existing recurring job of the
     * same name is left as it is, including edits made through the admin API.
     */
    private void registerRecurringJobs() {
        for (Map.Entry<String, CronhiveProperties.RecurringJob> entry : props.getRecurring().entrySet()) {
            String name = entry.getKey();
            CronhiveProperties.RecurringJob recurring = entry.getValue();
            if (recurring.getInterval() == null || recurring.getInterval().isBlank()) {
                throw new IllegalArgumentException("cronhive.recurring." + name + ".interval must not be blank");
            }
            calculator.validate(recurring.getInterval(), recurring.getTimezone());

            long existing = jobStore.count(JobQuery.builder().name(name).type(JobType.RECURRING).build());
            if (existing > 0) {
                log.debug("cronhive recurring job already present name={}", name);
                continue;
            }
            PersistResult result = every(name, recurring.getInterval(), recurring.getData(),
                    new JobBuilder.RepeatOptions(recurring.isSkipImmediate(), recurring.getTimezone()));
            log.info("cronhive recurring job registered name={} interval={} nextRunAt={}",
                    name, recurring.getInterval(), result.job().nextRunAt());
        }
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "cronhive";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("cronhive could not resolve host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
