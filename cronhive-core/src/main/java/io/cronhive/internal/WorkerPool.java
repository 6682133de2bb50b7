package io.cronhive.internal;

import io.cronhive.config.CronhiveProperties;
import io.cronhive.core.HandlerTimeoutException;
import io.cronhive.core.InvalidScheduleSpecException;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.schedule.ScheduleCalculator;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs claimed jobs and writes their outcome back.
 *
 * <p>Capacity is bounded twice: a global semaphore of {@code maxConcurrency} permits and the
 * per-name slots of each {@link JobDefinition}. A caller reserves a {@link Slot} before claiming,
 * then hands the claim and slot to {@link #submit}.
 *
 * <p>Every execution ends in exactly one settle: success, failure, or timeout when the handler is
 * still running once its lock lifetime is used up. All write-backs are guarded by the claim's
 * {@code lockedAt}, so a run whose lock was recovered elsewhere cannot overwrite the newer run.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobStore jobStore;
    private final LockManager lockManager;
    private final ScheduleCalculator calculator;
    private final CronhiveProperties props;
    private final CronhiveEvents events;
    private final Clock clock;
    private final Semaphore globalSem;
    private final Set<Execution> inFlight = ConcurrentHashMap.newKeySet();

    private ExecutorService handlerExecutor;
    private ScheduledExecutorService timeoutScheduler;

    public WorkerPool(JobStore jobStore, LockManager lockManager, ScheduleCalculator calculator,
                      CronhiveProperties props, CronhiveEvents events, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("cronhive.maxConcurrency must be a positive number");
        }
        this.globalSem = new Semaphore(props.getMaxConcurrency());
    }

    /**
     * Reserve one global permit and one slot of {@code definition}.
     *
     * @return the reservation, or empty when either bound is exhausted
     */
    public Optional<Slot> tryReserve(JobDefinition<?> definition) {
        if (!globalSem.tryAcquire()) {
            return Optional.empty();
        }
        if (!definition.slots().tryAcquire()) {
            globalSem.release();
            return Optional.empty();
        }
        return Optional.of(new Slot(definition));
    }

    /**
     * No global permit left; nothing more can be dispatched until an execution settles.
     */
    public boolean isSaturated() {
        return globalSem.availablePermits() == 0;
    }

    /**
     * Executions not yet settled.
     */
    public int running() {
        return inFlight.size();
    }

    public synchronized boolean isActive() {
        return handlerExecutor != null;
    }

    /**
     * Run {@code claim} asynchronously. The slot is released when the execution settles.
     */
    public void submit(ClaimedJob claim, JobDefinition<?> definition, Slot slot) {
        Objects.requireNonNull(claim, "claim must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(slot, "slot must not be null");

        ensureExecutors();
        Execution execution = new Execution(claim, definition, slot);
        inFlight.add(execution);
        try {
            execution.future = handlerExecutor.submit(execution);
            long delayMs = Math.max(0L, Duration.between(clock.instant(), claim.expiresAt()).toMillis());
            execution.timer = timeoutScheduler.schedule(execution::timeout, delayMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // executor rejected the task; give the lock and slot back
            log.error("cronhive submit failed name={} id={} msg={}", claim.name(), claim.id(), e.getMessage(), e);
            execution.abandon();
            throw e;
        }
    }

    /**
     * Stop accepting work and wait up to {@code drain} for running handlers.
     * Handlers still running afterwards are interrupted; their locks go stale and are recovered later.
     */
    public void shutdown(Duration drain) {
        ExecutorService handlers;
        ScheduledExecutorService timers;
        synchronized (this) {
            handlers = handlerExecutor;
            timers = timeoutScheduler;
            handlerExecutor = null;
            timeoutScheduler = null;
        }
        if (handlers == null) {
            return;
        }

        handlers.shutdown();
        try {
            if (!handlers.awaitTermination(drain.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("cronhive workers still running after drain={} running={}", drain, inFlight.size());
                handlers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlers.shutdownNow();
        } finally {
            timers.shutdownNow();
        }
    }

    private synchronized void ensureExecutors() {
        if (handlerExecutor == null) {
            handlerExecutor = Executors.newCachedThreadPool(namedDaemon("cronhive.worker"));
        }
        if (timeoutScheduler == null) {
            timeoutScheduler = Executors.newSingleThreadScheduledExecutor(namedDaemon("cronhive.timeout"));
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Job retry delay for one-shot failures.
     * attempt starts from 1 (first failure).
     * 10s, 20s, 40s, 80s... capped at 10 minutes.
     */
    static Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(10_000L * (1L << exp), 600_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * One global permit plus one per-name slot. Releasing is idempotent.
     */
    public final class Slot {
        private final JobDefinition<?> definition;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Slot(JobDefinition<?> definition) {
            this.definition = definition;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                definition.slots().release();
                globalSem.release();
            }
        }
    }

    private record Outcome(Map<String, Object> data, Throwable error) {
        static Outcome success(Map<String, Object> data) {
            return new Outcome(data, null);
        }

        static Outcome failure(Throwable error) {
            return new Outcome(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }

    private final class Execution implements Runnable {
        private final ClaimedJob claim;
        private final JobDefinition<?> definition;
        private final Slot slot;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private volatile Future<?> future;
        private volatile ScheduledFuture<?> timer;
        private volatile JobRecord running;
        private volatile Instant startedAt;

        private Execution(ClaimedJob claim, JobDefinition<?> definition, Slot slot) {
            this.claim = claim;
            this.definition = definition;
            this.slot = slot;
        }

        @Override
        public void run() {
            Instant started = now();
            Optional<JobRecord> marked;
            try {
                marked = jobStore.updateOne(claim.id(), JobPatch.builder()
                        .lastRunAt(started)
                        .whenLockedAt(claim.lockedAt())
                        .build());
            } catch (RuntimeException e) {
                log.error("cronhive could not mark job running name={} id={} msg={}",
                        claim.name(), claim.id(), e.getMessage(), e);
                abandon();
                return;
            }
            if (marked.isEmpty()) {
                log.warn("cronhive lock lost before start name={} id={}", claim.name(), claim.id());
                abandon();
                return;
            }

            startedAt = started;
            running = marked.get();
            log.debug("cronhive job started name={} id={} at={}", claim.name(), claim.id(), started);
            events.jobStarted(running);

            Map<String, Object> result;
            try {
                result = definition.invoke(running.data());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                settle(Outcome.failure(e));
                return;
            } catch (Exception e) {
                settle(Outcome.failure(e));
                return;
            } catch (Error e) {
                settle(Outcome.failure(e));
                throw e;
            }
            settle(Outcome.success(result));
        }

        void timeout() {
            HandlerTimeoutException error = new HandlerTimeoutException(claim.name(), claim.lockLifetime());
            if (running == null) {
                // not started yet; the handler thread will find its lock gone and give up
                log.warn("cronhive job did not start within lockLifetime name={} id={}", claim.name(), claim.id());
                return;
            }
            if (settle(Outcome.failure(error))) {
                Future<?> f = future;
                if (f != null) {
                    f.cancel(true);
                }
            }
        }

        /**
         * Give the lock and slot back without touching the record's run fields.
         */
        void abandon() {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            cancelTimer();
            try {
                lockManager.release(claim);
            } catch (RuntimeException e) {
                log.error("cronhive lock release failed name={} id={} msg={}",
                        claim.name(), claim.id(), e.getMessage(), e);
            } finally {
                slot.release();
                inFlight.remove(this);
            }
        }

        private boolean settle(Outcome outcome) {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            cancelTimer();

            boolean recordKept = true;
            try {
                recordKept = writeBack(outcome);
            } catch (RuntimeException e) {
                log.error("cronhive write-back failed name={} id={} msg={}",
                        claim.name(), claim.id(), e.getMessage(), e);
            } finally {
                try {
                    if (recordKept) {
                        lockManager.release(claim);
                    }
                } catch (RuntimeException e) {
                    log.error("cronhive lock release failed name={} id={} msg={}",
                            claim.name(), claim.id(), e.getMessage(), e);
                } finally {
                    slot.release();
                    inFlight.remove(this);
                }
            }
            return true;
        }

        private void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }

        /**
         * @return false when the record was deleted instead of updated
         */
        private boolean writeBack(Outcome outcome) {
            Instant finishedAt = now();
            JobRecord job = running;
            JobPatch.Builder patch = JobPatch.builder()
                    .lastFinishedAt(finishedAt)
                    .whenLockedAt(claim.lockedAt());

            if (outcome.succeeded()) {
                log.debug("cronhive job succeeded name={} id={} at={}", job.name(), job.id(), finishedAt);
                patch.failedAt(null).failReason(null).data(outcome.data());

                if (job.isRecurring()) {
                    scheduleNext(job, finishedAt, patch);
                } else if (props.isCleanupFinishedJobs()) {
                    jobStore.deleteMany(JobQuery.byId(job.id()));
                    events.jobSucceeded(job.toBuilder()
                            .lastFinishedAt(finishedAt)
                            .nextRunAt(null)
                            .lockedAt(null)
                            .build());
                    return false;
                } else {
                    patch.nextRunAt(null);
                }

                Optional<JobRecord> updated = jobStore.updateOne(job.id(), patch.build());
                if (updated.isEmpty()) {
                    log.warn("cronhive lock lost before write-back name={} id={}", job.name(), job.id());
                    return true;
                }
                events.jobSucceeded(updated.get());
                return true;
            }

            Throwable error = outcome.error();
            if (error instanceof HandlerTimeoutException) {
                log.warn("cronhive job timed out name={} id={} lockLifetime={}",
                        job.name(), job.id(), claim.lockLifetime());
            } else {
                log.error("cronhive job failed name={} id={} msg={}", job.name(), job.id(), error.getMessage(), error);
            }
            patch.failedAt(finishedAt)
                    .failReason(error.getMessage() != null ? error.getMessage() : error.getClass().getName())
                    .incrementFailCount();

            if (job.isRecurring()) {
                scheduleNext(job, finishedAt, patch);
            } else {
                int attempt = job.failCount() + 1;
                int maxRetry = props.getMaxRetryCount();
                if (maxRetry > 0 && attempt < maxRetry) {
                    patch.nextRunAt(finishedAt.plus(retryDelay(attempt)));
                } else {
                    if (maxRetry > 0) {
                        log.warn("cronhive job reached max retries name={} id={} attempts={} maxRetry={}",
                                job.name(), job.id(), attempt, maxRetry);
                    }
                    patch.nextRunAt(null);
                }
            }

            Optional<JobRecord> updated = jobStore.updateOne(job.id(), patch.build());
            if (updated.isEmpty()) {
                log.warn("cronhive lock lost before write-back name={} id={}", job.name(), job.id());
                return true;
            }
            events.jobFailed(updated.get(), error);
            return true;
        }

        // Next occurrence after the run's start; if that already passed while running, after the finish.
        private void scheduleNext(JobRecord job, Instant finishedAt, JobPatch.Builder patch) {
            JobRecord.Repeat repeat = job.repeat();
            try {
                Instant next = calculator.nextRun(repeat.interval(), repeat.timezone(), startedAt);
                if (!next.isAfter(finishedAt)) {
                    next = calculator.nextRun(repeat.interval(), repeat.timezone(), finishedAt);
                }
                patch.nextRunAt(next.truncatedTo(ChronoUnit.MILLIS));
            } catch (InvalidScheduleSpecException e) {
                log.error("cronhive disabling job with invalid repeat name={} id={} interval={} msg={}",
                        job.name(), job.id(), repeat.interval(), e.getMessage());
                patch.nextRunAt(null)
                        .disabled(true)
                        .failReason(e.getMessage());
            }
        }
    }
}
