package io.cronhive.internal;

import io.cronhive.config.CronhiveProperties;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically scans for due jobs and dispatches them to the {@link WorkerPool}.
 *
 * <p>Each tick reads a batch of due, enabled, claimable jobs in dispatch order (priority desc,
 * nextRunAt asc), then for each: reserve a slot, claim the lock, submit. A full name is skipped
 * so lower-priority jobs of other names still get a turn; a full pool ends the tick.
 *
 * <p>Store errors end the tick and are retried on the next one.
 */
public class JobPoller {
    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private static final int UNKNOWN_SCAN_LIMIT = 10;

    public enum State {
        IDLE,
        SCANNING,
        DISPATCHING
    }

    private final JobStore jobStore;
    private final DefinitionRegistry registry;
    private final LockManager lockManager;
    private final WorkerPool workerPool;
    private final CronhiveProperties props;
    private final CronhiveEvents events;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> reportedUnknown = ConcurrentHashMap.newKeySet();
    private final Object tickLock = new Object();

    private Thread pollerThread;
    private int consecutiveErrors = 0;

    public JobPoller(JobStore jobStore, DefinitionRegistry registry, LockManager lockManager, WorkerPool workerPool,
                     CronhiveProperties props, CronhiveEvents events, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager must not be null");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public State state() {
        return state.get();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("cronhive.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    /**
     * Stop the loop. A tick in progress finishes its current dispatch; running executions are unaffected.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = pollerThread;
        pollerThread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Run one scan-and-dispatch pass. Never throws.
     *
     * @return number of jobs handed to the worker pool
     */
    public int tick() {
        synchronized (tickLock) {
            try {
                int dispatched = scanAndDispatch();
                consecutiveErrors = 0;
                return dispatched;
            } catch (RuntimeException e) {
                consecutiveErrors++;
                log.error("cronhive poll failed consecutiveErrors={} msg={}", consecutiveErrors, e.getMessage(), e);
                events.pollError(e);
                return 0;
            } finally {
                state.set(State.IDLE);
            }
        }
    }

    private void pollerLoop() {
        while (running.get()) {
            tick();
            if (!running.get()) {
                break;
            }
            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private int scanAndDispatch() {
        state.set(State.SCANNING);
        Instant now = clock.instant();
        Set<String> names = registry.names();

        reportUnknown(now, names);
        if (names.isEmpty()) {
            return 0;
        }

        List<JobRecord> candidates = jobStore.findMany(JobQuery.builder()
                        .names(names)
                        .disabled(false)
                        .dueBy(now)
                        .lockAvailableAsOf(now.minus(registry.shortestLockLifetime()))
                        .build(),
                JobSort.DISPATCH_ORDER, 0, Math.max(1, props.getBatchSize()));
        log.debug("cronhive polled jobs count={} now={}", candidates.size(), now);

        state.set(State.DISPATCHING);
        int dispatched = 0;
        for (JobRecord job : candidates) {
            if (workerPool.isSaturated()) {
                log.debug("cronhive worker pool full; ending tick dispatched={}", dispatched);
                break;
            }
            Optional<JobDefinition<?>> definition = registry.find(job.name());
            if (definition.isEmpty()) {
                // undefined since the scan started
                continue;
            }
            if (dispatch(job, definition.get())) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean dispatch(JobRecord job, JobDefinition<?> definition) {
        Duration lockLifetime = definition.lockLifetime();
        if (!LockManager.isClaimable(job, lockLifetime, clock.instant())) {
            return false;
        }

        Optional<WorkerPool.Slot> slot = workerPool.tryReserve(definition);
        if (slot.isEmpty()) {
            log.debug("cronhive concurrency limit reached name={} concurrency={}", job.name(), definition.concurrency());
            return false;
        }

        Optional<ClaimedJob> claim;
        try {
            claim = lockManager.tryClaim(job, lockLifetime);
        } catch (RuntimeException e) {
            slot.get().release();
            throw e;
        }
        if (claim.isEmpty()) {
            slot.get().release();
            return false;
        }

        workerPool.submit(claim.get(), definition, slot.get());
        return true;
    }

    private void reportUnknown(Instant now, Set<String> known) {
        List<JobRecord> unknown = jobStore.findMany(JobQuery.builder()
                        .excludedNames(known)
                        .disabled(false)
                        .dueBy(now)
                        .locked(false)
                        .build(),
                JobSort.DISPATCH_ORDER, 0, UNKNOWN_SCAN_LIMIT);
        for (JobRecord job : unknown) {
            if (reportedUnknown.add(job.name())) {
                log.warn("cronhive no handler registered for due job name={} id={}", job.name(), job.id());
            } else {
                log.debug("cronhive skipping job without handler name={} id={}", job.name(), job.id());
            }
            events.unknownJob(job);
        }
    }
}
