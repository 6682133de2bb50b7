package io.cronhive.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.JobHandler;
import io.cronhive.MutableClock;
import io.cronhive.core.DefinitionOptions;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.InvalidScheduleSpecException;
import io.cronhive.core.JobLockedException;
import io.cronhive.core.JobNotFoundException;
import io.cronhive.core.JobPage;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.core.JobType;
import io.cronhive.store.InMemoryJobStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobAdminTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final DefinitionRegistry registry =
            new DefinitionRegistry(new ObjectMapper(), new DefinitionOptions(1, Duration.ofMinutes(10), null));
    private final JobAdmin admin = new JobAdmin(store, registry, new ObjectMapper(), clock);

    @Test
    void createWithoutScheduleShouldRunNow() {
        JobRecord job = admin.create(CreateJobRequest.builder("email")
                .data(Map.of("to", "ops@example.com"))
                .build());

        assertEquals(T0, job.nextRunAt());
        assertEquals(JobType.ONE_SHOT, job.type());
        assertEquals(0, job.priority());
        assertEquals("ops@example.com", store.findById(job.id()).orElseThrow().data().get("to"));
    }

    @Test
    void createShouldResolveScheduleRepeatAndPriority() {
        JobRecord later = admin.create(CreateJobRequest.builder("email")
                .schedule("in 10 minutes")
                .priority("high")
                .build());
        assertEquals(T0.plus(Duration.ofMinutes(10)), later.nextRunAt());
        assertEquals(10, later.priority());

        JobRecord recurring = admin.create(CreateJobRequest.builder("report")
                .repeatInterval("0 9 * * *")
                .timezone("Asia/Taipei")
                .skipImmediate(true)
                .build());
        assertEquals(JobType.RECURRING, recurring.type());
        assertEquals("Asia/Taipei", recurring.repeat().timezone());
        assertEquals(Instant.parse("2026-01-01T01:00:00Z"), recurring.nextRunAt());
    }

    @Test
    void createShouldRejectBadInput() {
        assertThrows(InvalidScheduleSpecException.class,
                () -> admin.create(CreateJobRequest.builder("report").repeatInterval("every blue moon").build()));
        assertThrows(InvalidScheduleSpecException.class,
                () -> admin.create(CreateJobRequest.builder("report").timezone("Mars/Olympus").build()));
        assertThrows(IllegalArgumentException.class,
                () -> admin.create(CreateJobRequest.builder("report").priority("urgent").build()));
        assertEquals(0, store.count(JobQuery.all()));
    }

    @Test
    void listShouldPageInNextRunOrder() {
        for (int i = 5; i >= 1; i--) {
            admin.create(CreateJobRequest.builder("email").schedule("in " + i + " minutes").build());
        }

        JobPage first = admin.list(JobQuery.all(), 1, 2, null);
        assertEquals(5, first.total());
        assertEquals(3, first.totalPages());
        assertEquals(2, first.data().size());
        assertEquals(T0.plus(Duration.ofMinutes(1)), first.data().get(0).nextRunAt());
        assertEquals(T0.plus(Duration.ofMinutes(2)), first.data().get(1).nextRunAt());

        JobPage last = admin.list(JobQuery.all(), 3, 2, JobSort.NEXT_RUN_ASC);
        assertEquals(1, last.data().size());
        assertEquals(T0.plus(Duration.ofMinutes(5)), last.data().get(0).nextRunAt());

        JobPage beyond = admin.list(JobQuery.all(), 4, 2, null);
        assertTrue(beyond.data().isEmpty());
        assertEquals(5, beyond.total());

        assertThrows(IllegalArgumentException.class, () -> admin.list(JobQuery.all(), 0, 2, null));
        assertThrows(IllegalArgumentException.class, () -> admin.list(JobQuery.all(), 1, 0, null));
    }

    @Test
    void updatingTheRepeatShouldRecomputeTheNextRunFromNow() {
        JobRecord job = admin.create(CreateJobRequest.builder("sync")
                .repeatInterval("5 minutes")
                .skipImmediate(true)
                .build());
        clock.advance(Duration.ofMinutes(1));

        JobRecord updated = admin.update(job.id(), UpdateJobRequest.builder().repeatInterval("1 hour").build());

        assertEquals("1 hour", updated.repeat().interval());
        assertEquals(JobType.RECURRING, updated.type());
        assertEquals(T0.plus(Duration.ofMinutes(61)), updated.nextRunAt());
    }

    @Test
    void blankRepeatShouldTurnTheJobIntoAOneShot() {
        JobRecord job = admin.create(CreateJobRequest.builder("sync")
                .repeatInterval("5 minutes")
                .skipImmediate(true)
                .build());

        JobRecord updated = admin.update(job.id(), UpdateJobRequest.builder().repeatInterval("").build());

        assertNull(updated.repeat());
        assertEquals(JobType.ONE_SHOT, updated.type());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.nextRunAt());
    }

    @Test
    void updateShouldApplyPlainFieldsAndKeepAStaleLock() {
        JobRecord job = admin.create(CreateJobRequest.builder("email").build());
        assertTrue(store.compareAndSwapLock(job.id(), null, T0));
        clock.advance(Duration.ofMinutes(10));

        JobRecord updated = admin.update(job.id(), UpdateJobRequest.builder()
                .priority("low")
                .disabled(true)
                .schedule("2026-02-01T00:00:00Z")
                .data(Map.of("to", "dev@example.com"))
                .build());

        assertEquals(-10, updated.priority());
        assertTrue(updated.disabled());
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), updated.nextRunAt());
        assertEquals("dev@example.com", updated.data().get("to"));
        assertEquals(T0, updated.lockedAt());
    }

    @Test
    void editsShouldBeRefusedWhileTheJobIsRunning() {
        registry.define("report", DefinitionOptions.defaults().withLockLifetime(Duration.ofMinutes(2)),
                JobHandler.of("report", data -> {
                }));
        JobRecord job = admin.create(CreateJobRequest.builder("report").build());
        assertTrue(store.compareAndSwapLock(job.id(), null, T0));
        store.updateOne(job.id(), JobPatch.builder().failedAt(T0).failReason("boom").build());
        JobRecord locked = store.findById(job.id()).orElseThrow();

        clock.advance(Duration.ofMinutes(1));
        JobLockedException refused = assertThrows(JobLockedException.class, () -> admin.update(job.id(),
                UpdateJobRequest.builder().schedule("2026-02-01T00:00:00Z").build()));
        assertEquals(job.id(), refused.jobId());
        assertEquals(T0, refused.lockedAt());
        assertThrows(JobLockedException.class, () -> admin.retry(job.id()));
        assertEquals(locked, store.findById(job.id()).orElseThrow());

        clock.advance(Duration.ofMinutes(1));
        JobRecord updated = admin.update(job.id(), UpdateJobRequest.builder().schedule("2026-02-01T00:00:00Z").build());
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), updated.nextRunAt());
    }

    @Test
    void invalidUpdateShouldLeaveTheJobUntouched() {
        JobRecord job = admin.create(CreateJobRequest.builder("sync").repeatInterval("5 minutes").build());

        assertThrows(InvalidScheduleSpecException.class,
                () -> admin.update(job.id(), UpdateJobRequest.builder().repeatInterval("every blue moon").build()));
        assertEquals(job, store.findById(job.id()).orElseThrow());
        assertThrows(JobNotFoundException.class,
                () -> admin.update("missing", UpdateJobRequest.builder().disabled(true).build()));
    }

    @Test
    void deleteShouldAcceptIdsAndQueries() {
        String a = admin.create(CreateJobRequest.builder("a").build()).id();
        String b = admin.create(CreateJobRequest.builder("b").build()).id();
        String c = admin.create(CreateJobRequest.builder("c").build()).id();
        admin.create(CreateJobRequest.builder("d").build());

        assertEquals(1, admin.delete(a));
        assertEquals(0, admin.delete(a));
        assertEquals(2, admin.delete(List.of(b, c)));
        assertEquals(0, admin.delete(List.of()));
        assertEquals(1, admin.delete(JobQuery.byName("d")));
        assertEquals(0, store.count(JobQuery.all()));
    }

    @Test
    void retryShouldPutAFailedJobBackInLine() {
        String id = store.insert(JobRecord.builder("email")
                .failedAt(T0.minusSeconds(60))
                .failReason("boom")
                .failCount(3)
                .lastFinishedAt(T0.minusSeconds(60))
                .build());

        JobRecord retried = admin.retry(id);

        assertNull(retried.failedAt());
        assertNull(retried.failReason());
        assertNull(retried.lastFinishedAt());
        assertEquals(0, retried.failCount());
        assertFalse(retried.nextRunAt().isAfter(clock.instant()));
    }

    @Test
    void retryShouldOnlyAcceptFailedJobs() {
        String id = store.insert(JobRecord.builder("email").nextRunAt(T0).build());

        assertThrows(JobNotFoundException.class, () -> admin.retry(id));
        assertThrows(JobNotFoundException.class, () -> admin.retry("missing"));
        assertEquals(T0, store.findById(id).orElseThrow().nextRunAt());
    }

    @Test
    void purgeShouldOnlyRemoveOldFinishedJobsAndBeIdempotent() {
        Instant old = T0.minus(Duration.ofDays(10));
        String purgeable = store.insert(JobRecord.builder("a").lastFinishedAt(old).build());
        store.insert(JobRecord.builder("a").lastFinishedAt(old).failedAt(old).build());
        store.insert(JobRecord.builder("a").lastFinishedAt(old).lockedAt(T0).build());
        store.insert(JobRecord.builder("a").lastFinishedAt(old).nextRunAt(T0.plusSeconds(60))
                .repeat(new JobRecord.Repeat("1 minute", null)).build());
        String recent = store.insert(JobRecord.builder("a").lastFinishedAt(T0.minus(Duration.ofDays(1))).build());

        assertEquals(1, admin.purge());
        assertEquals(0, admin.purge());
        assertTrue(store.findById(purgeable).isEmpty());

        assertEquals(1, admin.purge(0));
        assertTrue(store.findById(recent).isEmpty());
        assertEquals(3, store.count(JobQuery.all()));
        assertThrows(IllegalArgumentException.class, () -> admin.purge(-1));
    }
}
