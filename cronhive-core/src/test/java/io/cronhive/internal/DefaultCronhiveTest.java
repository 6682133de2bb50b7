package io.cronhive.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.CronhiveListener;
import io.cronhive.JobHandler;
import io.cronhive.MutableClock;
import io.cronhive.admin.JobAdmin;
import io.cronhive.admin.UpdateJobRequest;
import io.cronhive.config.CronhiveProperties;
import io.cronhive.core.DefinitionOptions;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.HandlerTimeoutException;
import io.cronhive.core.JobLockedException;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobType;
import io.cronhive.core.PersistResult;
import io.cronhive.store.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultCronhiveTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final List<DefaultCronhive> instances = new ArrayList<>();
    private final List<CountDownLatch> gates = new ArrayList<>();

    @AfterEach
    void tearDown() {
        gates.forEach(CountDownLatch::countDown);
        instances.forEach(DefaultCronhive::stop);
    }

    @Test
    void recurringJobShouldRunOncePerIntervalAsTheClockAdvances() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        AtomicInteger runs = new AtomicInteger();
        cronhive.define(JobHandler.of("tick", data -> runs.incrementAndGet()));
        cronhive.every("tick", "5 seconds", null);

        for (int second = 0; second < 12; second++) {
            cronhive.pollOnce();
            settle(cronhive);
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(3, runs.get());
        JobRecord job = store.findOne(JobQuery.byName("tick")).orElseThrow();
        assertEquals(T0.plusSeconds(15), job.nextRunAt());
        assertEquals(T0.plusSeconds(10), job.lastRunAt());
        assertNull(job.lockedAt());
        assertNull(job.failedAt());
    }

    @Test
    void failingRecurringJobShouldRecordTheFailureAndKeepItsSchedule() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        AtomicReference<Throwable> failure = new AtomicReference<>();
        cronhive.addListener(new CronhiveListener() {
            @Override
            public void onJobFailed(JobRecord job, Throwable error) {
                failure.set(error);
            }
        });
        cronhive.define(JobHandler.of("failing-job", data -> {
            throw new IllegalStateException("simulated failure");
        }));
        cronhive.every("failing-job", "1 hour", null);

        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);

        JobRecord job = store.findOne(JobQuery.byName("failing-job")).orElseThrow();
        assertEquals(1, job.failCount());
        assertEquals("simulated failure", job.failReason());
        assertEquals(T0, job.failedAt());
        assertEquals(T0.plus(Duration.ofHours(1)), job.nextRunAt());
        assertNull(job.lockedAt());
        assertInstanceOf(IllegalStateException.class, failure.get());

        assertEquals(0, cronhive.pollOnce());
    }

    @Test
    void twoSchedulersSharingAStoreShouldRunEachJobExactlyOnce() throws Exception {
        Map<Integer, AtomicInteger> runsByJob = new ConcurrentHashMap<>();
        CronhiveProperties props = props();
        props.setMaxConcurrency(4);
        props.setDefaultConcurrency(4);

        DefaultCronhive first = newCronhive(props);
        DefaultCronhive second = newCronhive(props);
        for (DefaultCronhive cronhive : List.of(first, second)) {
            cronhive.define(JobHandler.of("work", Payload.class, payload -> {
                runsByJob.computeIfAbsent(payload.n, n -> new AtomicInteger()).incrementAndGet();
                Thread.sleep(5);
            }));
        }
        for (int i = 0; i < 20; i++) {
            first.now("work", Payload.of(i));
        }

        AtomicBoolean done = new AtomicBoolean(false);
        ExecutorService pollers = Executors.newFixedThreadPool(2);
        List<Future<?>> loops = new ArrayList<>();
        for (DefaultCronhive cronhive : List.of(first, second)) {
            loops.add(pollers.submit(() -> {
                while (!done.get()) {
                    cronhive.pollOnce();
                    Thread.sleep(2);
                }
                return null;
            }));
        }

        boolean finished = waitUntil(10, TimeUnit.SECONDS, () ->
                store.count(JobQuery.builder().name("work").finished(true).locked(false).build()) == 20);
        done.set(true);
        for (Future<?> loop : loops) {
            loop.get(5, TimeUnit.SECONDS);
        }
        pollers.shutdownNow();
        settle(first);
        settle(second);

        assertTrue(finished);
        assertEquals(20, runsByJob.size());
        runsByJob.forEach((n, runs) -> assertEquals(1, runs.get(), "job " + n));
    }

    @Test
    void twoSchedulersPollingTheSameRecurringOccurrenceShouldRunItOnce() throws Exception {
        DefaultCronhive first = newCronhive(props());
        DefaultCronhive second = newCronhive(props());
        AtomicInteger runs = new AtomicInteger();
        for (DefaultCronhive cronhive : List.of(first, second)) {
            cronhive.define(JobHandler.of("serial", data -> runs.incrementAndGet()));
        }
        first.every("serial", "1 minute", null);

        ExecutorService pollers = Executors.newFixedThreadPool(2);
        try {
            for (int occurrence = 1; occurrence <= 5; occurrence++) {
                CountDownLatch go = new CountDownLatch(1);
                Future<Integer> a = pollers.submit(() -> {
                    go.await();
                    return first.pollOnce();
                });
                Future<Integer> b = pollers.submit(() -> {
                    go.await();
                    return second.pollOnce();
                });
                go.countDown();
                int dispatched = a.get(5, TimeUnit.SECONDS) + b.get(5, TimeUnit.SECONDS);
                settle(first);
                settle(second);

                assertEquals(1, dispatched, "occurrence " + occurrence);
                assertEquals(occurrence, runs.get());
                clock.advance(Duration.ofMinutes(1));
            }
        } finally {
            pollers.shutdownNow();
        }

        JobRecord job = store.findOne(JobQuery.byName("serial")).orElseThrow();
        assertEquals(T0.plus(Duration.ofMinutes(5)), job.nextRunAt());
        assertNull(job.lockedAt());
    }

    @Test
    void dueJobWithoutHandlerShouldBeReportedAndLeftAlone() {
        DefaultCronhive cronhive = newCronhive(props());
        List<JobRecord> unknown = new CopyOnWriteArrayList<>();
        cronhive.addListener(new CronhiveListener() {
            @Override
            public void onUnknownJob(JobRecord job) {
                unknown.add(job);
            }
        });
        cronhive.now("ghost");

        assertEquals(0, cronhive.pollOnce());
        assertEquals(0, cronhive.pollOnce());

        assertEquals(2, unknown.size());
        assertEquals("ghost", unknown.get(0).name());
        JobRecord job = store.findOne(JobQuery.byName("ghost")).orElseThrow();
        assertNull(job.lockedAt());
        assertNull(job.lastRunAt());
    }

    @Test
    void perNameConcurrencyShouldHoldBackFurtherRunsOfThatName() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        CountDownLatch gate = gate();
        AtomicInteger runs = new AtomicInteger();
        cronhive.define(JobHandler.of("slow", data -> {
            runs.incrementAndGet();
            gate.await(10, TimeUnit.SECONDS);
        }));
        AtomicInteger quick = new AtomicInteger();
        cronhive.define(JobHandler.of("quick", data -> quick.incrementAndGet()));
        for (int i = 0; i < 3; i++) {
            cronhive.now("slow");
        }
        cronhive.now("quick");

        assertEquals(2, cronhive.pollOnce());
        assertEquals(0, cronhive.pollOnce());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> quick.get() == 1 && cronhive.running() == 1));

        gate.countDown();
        settle(cronhive);
        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);
        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);

        assertEquals(3, runs.get());
        assertEquals(0, cronhive.pollOnce());
    }

    @Test
    void redefiningANameWhileItRunsShouldKeepItsConcurrency() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        CountDownLatch gate = gate();
        AtomicInteger live = new AtomicInteger();
        AtomicInteger maxLive = new AtomicInteger();
        JobHandler<Void> handler = JobHandler.of("serial", data -> {
            maxLive.accumulateAndGet(live.incrementAndGet(), Math::max);
            try {
                gate.await(10, TimeUnit.SECONDS);
            } finally {
                live.decrementAndGet();
            }
        });
        cronhive.define(handler);
        cronhive.now("serial");
        cronhive.now("serial");

        assertEquals(1, cronhive.pollOnce());
        cronhive.define(handler);
        assertEquals(0, cronhive.pollOnce());

        gate.countDown();
        settle(cronhive);
        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);
        assertEquals(1, maxLive.get());
    }

    @Test
    void adminEditsShouldWaitUntilTheRunHasFinished() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        JobAdmin admin = new JobAdmin(store, cronhive.registry(), new ObjectMapper(), clock);
        CountDownLatch gate = gate();
        CountDownLatch started = new CountDownLatch(1);
        cronhive.define(JobHandler.of("email", data -> {
            started.countDown();
            gate.await(10, TimeUnit.SECONDS);
        }));
        String id = cronhive.now("email").job().id();
        UpdateJobRequest reschedule = UpdateJobRequest.builder().schedule("2026-02-01T00:00:00Z").build();

        assertEquals(1, cronhive.pollOnce());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertThrows(JobLockedException.class, () -> admin.update(id, reschedule));

        gate.countDown();
        settle(cronhive);
        assertNull(store.findById(id).orElseThrow().nextRunAt());

        admin.update(id, reschedule);
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), store.findById(id).orElseThrow().nextRunAt());
    }

    @Test
    void fullWorkerPoolShouldEndTheTick() throws Exception {
        CronhiveProperties props = props();
        props.setMaxConcurrency(2);
        DefaultCronhive cronhive = newCronhive(props);
        CountDownLatch gate = gate();
        cronhive.define("wide", DefinitionOptions.defaults().withConcurrency(5),
                JobHandler.of("wide", data -> gate.await(10, TimeUnit.SECONDS)));
        for (int i = 0; i < 3; i++) {
            cronhive.now("wide");
        }

        assertEquals(2, cronhive.pollOnce());
        assertEquals(0, cronhive.pollOnce());

        gate.countDown();
        settle(cronhive);
        assertEquals(1, cronhive.pollOnce());
    }

    @Test
    void handlerOutlivingItsLockLifetimeShouldFailWithATimeout() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        AtomicReference<Throwable> failure = new AtomicReference<>();
        cronhive.addListener(new CronhiveListener() {
            @Override
            public void onJobFailed(JobRecord job, Throwable error) {
                failure.set(error);
            }
        });
        CountDownLatch gate = gate();
        cronhive.define("hang", DefinitionOptions.defaults().withLockLifetime(Duration.ofMillis(300)),
                JobHandler.of("hang", data -> gate.await(10, TimeUnit.SECONDS)));
        cronhive.now("hang");

        assertEquals(1, cronhive.pollOnce());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> failure.get() != null));
        settle(cronhive);

        assertInstanceOf(HandlerTimeoutException.class, failure.get());
        JobRecord job = store.findOne(JobQuery.byName("hang")).orElseThrow();
        assertEquals(1, job.failCount());
        assertTrue(job.failReason().contains("exceeded its lock lifetime"), job.failReason());
        assertNotNull(job.failedAt());
        assertNull(job.nextRunAt());
        assertNull(job.lockedAt());
    }

    @Test
    void oneShotFailuresShouldBackOffUntilTheRetryLimit() throws Exception {
        CronhiveProperties props = props();
        props.setMaxRetryCount(3);
        DefaultCronhive cronhive = newCronhive(props);
        AtomicInteger runs = new AtomicInteger();
        cronhive.define(JobHandler.of("flaky", data -> {
            runs.incrementAndGet();
            throw new IllegalStateException("down");
        }));
        String id = cronhive.now("flaky").job().id();

        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);
        assertEquals(T0.plusSeconds(10), store.findById(id).orElseThrow().nextRunAt());

        clock.advance(Duration.ofSeconds(10));
        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);
        assertEquals(T0.plusSeconds(30), store.findById(id).orElseThrow().nextRunAt());

        clock.advance(Duration.ofSeconds(20));
        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);

        JobRecord job = store.findById(id).orElseThrow();
        assertEquals(3, runs.get());
        assertEquals(3, job.failCount());
        assertNull(job.nextRunAt());
        clock.advance(Duration.ofHours(1));
        assertEquals(0, cronhive.pollOnce());
    }

    @Test
    void retryDelayShouldDoubleUpToTenMinutes() {
        assertEquals(Duration.ofSeconds(10), WorkerPool.retryDelay(1));
        assertEquals(Duration.ofSeconds(20), WorkerPool.retryDelay(2));
        assertEquals(Duration.ofSeconds(40), WorkerPool.retryDelay(3));
        assertEquals(Duration.ofSeconds(320), WorkerPool.retryDelay(6));
        assertEquals(Duration.ofMinutes(10), WorkerPool.retryDelay(7));
        assertEquals(Duration.ofMinutes(10), WorkerPool.retryDelay(100));
    }

    @Test
    void finishedOneShotJobsShouldBeDeletedWhenCleanupIsOn() throws Exception {
        CronhiveProperties props = props();
        props.setCleanupFinishedJobs(true);
        DefaultCronhive cronhive = newCronhive(props);
        List<JobRecord> succeeded = new CopyOnWriteArrayList<>();
        cronhive.addListener(new CronhiveListener() {
            @Override
            public void onJobSucceeded(JobRecord job) {
                succeeded.add(job);
            }
        });
        cronhive.define("tick", DefinitionOptions.defaults().withConcurrency(2), JobHandler.of("tick", data -> {
        }));
        cronhive.now("tick");
        cronhive.every("tick", "1 hour", null);

        assertEquals(2, cronhive.pollOnce());
        settle(cronhive);

        List<JobRecord> left = store.findMany(JobQuery.byName("tick"));
        assertEquals(1, left.size());
        assertEquals(JobType.RECURRING, left.get(0).type());
        assertEquals(2, succeeded.size());
    }

    @Test
    void successfulRunShouldWriteBackHandlerData() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        cronhive.define(JobHandler.of("count", Counter.class, counter -> counter.runs++));
        cronhive.every("count", "1 minute", new Counter(), null);

        cronhive.pollOnce();
        settle(cronhive);
        clock.advance(Duration.ofMinutes(1));
        cronhive.pollOnce();
        settle(cronhive);

        assertEquals(2, store.findOne(JobQuery.byName("count")).orElseThrow().data().get("runs"));
    }

    @Test
    void invalidStoredRepeatShouldDisableTheJob() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        cronhive.define(JobHandler.of("tick", data -> {
        }));
        String id = store.insert(JobRecord.builder("tick")
                .type(JobType.RECURRING)
                .repeat(new JobRecord.Repeat("every blue moon", null))
                .nextRunAt(T0)
                .build());

        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);

        JobRecord job = store.findById(id).orElseThrow();
        assertTrue(job.disabled());
        assertNull(job.nextRunAt());
        assertTrue(job.failReason().contains("every blue moon"), job.failReason());
    }

    @Test
    void repeatOverflowingTheTimeLineShouldDisableTheJob() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        AtomicInteger runs = new AtomicInteger();
        cronhive.define(JobHandler.of("tick", data -> runs.incrementAndGet()));
        String id = store.insert(JobRecord.builder("tick")
                .type(JobType.RECURRING)
                .repeat(new JobRecord.Repeat("10000000000000 days", null))
                .nextRunAt(T0)
                .build());

        assertEquals(1, cronhive.pollOnce());
        settle(cronhive);

        JobRecord job = store.findById(id).orElseThrow();
        assertEquals(1, runs.get());
        assertTrue(job.disabled());
        assertNull(job.nextRunAt());
        assertNull(job.lockedAt());
    }

    @Test
    void everyShouldKeepOneRecurringJobPerName() {
        DefaultCronhive cronhive = newCronhive(props());
        PersistResult created = cronhive.every("report", "5 minutes", null);
        PersistResult updated = cronhive.every("report", "10 minutes", null);

        assertFalse(created.updated());
        assertTrue(updated.updated());
        List<JobRecord> jobs = cronhive.jobs(JobQuery.byName("report"));
        assertEquals(1, jobs.size());
        assertEquals("10 minutes", jobs.get(0).repeat().interval());
        assertEquals(T0, jobs.get(0).nextRunAt());
    }

    @Test
    void disabledJobsShouldNotBeDispatched() throws Exception {
        DefaultCronhive cronhive = newCronhive(props());
        AtomicInteger runs = new AtomicInteger();
        cronhive.define("tick", DefinitionOptions.defaults().withConcurrency(2),
                JobHandler.of("tick", data -> runs.incrementAndGet()));
        cronhive.now("tick");
        cronhive.now("tick");

        assertEquals(2, cronhive.disable(JobQuery.byName("tick")));
        assertEquals(0, cronhive.disable(JobQuery.byName("tick")));
        assertEquals(0, cronhive.pollOnce());

        assertEquals(2, cronhive.enable(JobQuery.byName("tick")));
        assertEquals(2, cronhive.pollOnce());
        settle(cronhive);
        assertEquals(2, runs.get());
    }

    @Test
    void startShouldRegisterConfiguredRecurringJobsOnce() {
        CronhiveProperties props = props();
        CronhiveProperties.RecurringJob cleanup = new CronhiveProperties.RecurringJob();
        cleanup.setInterval("0 3 * * *");
        cleanup.setTimezone("UTC");
        cleanup.setSkipImmediate(true);
        props.getRecurring().put("cleanup", cleanup);

        DefaultCronhive cronhive = newCronhive(props);
        AtomicInteger ready = new AtomicInteger();
        AtomicInteger stopped = new AtomicInteger();
        cronhive.addListener(new CronhiveListener() {
            @Override
            public void onReady() {
                ready.incrementAndGet();
            }

            @Override
            public void onStopped() {
                stopped.incrementAndGet();
            }
        });

        cronhive.start();
        cronhive.start();
        newCronhive(props).start();

        List<JobRecord> jobs = store.findMany(JobQuery.byName("cleanup"));
        assertEquals(1, jobs.size());
        assertEquals(Instant.parse("2026-01-01T03:00:00Z"), jobs.get(0).nextRunAt());
        assertEquals(1, ready.get());

        cronhive.stop();
        cronhive.stop();
        assertEquals(1, stopped.get());
    }

    @Test
    void startShouldRejectInvalidConfiguration() {
        CronhiveProperties badBatch = props();
        badBatch.setBatchSize(0);
        assertThrows(IllegalArgumentException.class, () -> newCronhive(badBatch).start());

        CronhiveProperties badRecurring = props();
        badRecurring.getRecurring().put("cleanup", new CronhiveProperties.RecurringJob());
        assertThrows(IllegalArgumentException.class, () -> newCronhive(badRecurring).start());
        assertEquals(0, store.count(JobQuery.all()));
    }

    private DefaultCronhive newCronhive(CronhiveProperties props) {
        DefinitionRegistry registry = new DefinitionRegistry(new ObjectMapper(), props.definitionDefaults());
        DefaultCronhive cronhive = new DefaultCronhive(props, store, registry, new ObjectMapper(), clock);
        instances.add(cronhive);
        return cronhive;
    }

    private CountDownLatch gate() {
        CountDownLatch gate = new CountDownLatch(1);
        gates.add(gate);
        return gate;
    }

    private static CronhiveProperties props() {
        CronhiveProperties props = new CronhiveProperties();
        props.setProcessEvery(Duration.ofSeconds(1));
        props.setDefaultLockLifetime(Duration.ofMinutes(10));
        props.setMaxConcurrency(4);
        props.setDefaultConcurrency(1);
        props.setBatchSize(10);
        props.setWorkerId("test-worker");
        return props;
    }

    private static void settle(DefaultCronhive cronhive) throws InterruptedException {
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> cronhive.running() == 0), "executions did not settle");
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    public static class Payload {
        public int n;

        static Payload of(int n) {
            Payload p = new Payload();
            p.n = n;
            return p;
        }
    }

    public static class Counter {
        public int runs;
    }
}
