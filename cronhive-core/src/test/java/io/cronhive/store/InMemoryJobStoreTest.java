package io.cronhive.store;

import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.core.JobType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    void insertShouldAssignAnIdAndRejectPresetIds() {
        String id = store.insert(JobRecord.builder("email").nextRunAt(NOW).build());
        assertNotNull(id);
        assertEquals("email", store.findById(id).orElseThrow().name());
        assertEquals(JobType.ONE_SHOT, store.findById(id).orElseThrow().type());

        assertThrows(IllegalArgumentException.class,
                () -> store.insert(JobRecord.builder("email").id("preset").build()));
        assertThrows(IllegalArgumentException.class, () -> store.insert(JobRecord.builder(" ").build()));
    }

    @Test
    void findManyShouldSortSkipAndLimit() {
        store.insert(JobRecord.builder("a").nextRunAt(NOW.plusSeconds(3)).priority(0).build());
        store.insert(JobRecord.builder("a").nextRunAt(NOW.plusSeconds(1)).priority(0).build());
        store.insert(JobRecord.builder("a").nextRunAt(NOW.plusSeconds(2)).priority(10).build());

        List<JobRecord> ordered = store.findMany(JobQuery.all(), JobSort.DISPATCH_ORDER, 0, 0);
        assertEquals(10, ordered.get(0).priority());
        assertEquals(NOW.plusSeconds(1), ordered.get(1).nextRunAt());
        assertEquals(NOW.plusSeconds(3), ordered.get(2).nextRunAt());

        List<JobRecord> page = store.findMany(JobQuery.all(), JobSort.NEXT_RUN_ASC, 1, 1);
        assertEquals(1, page.size());
        assertEquals(NOW.plusSeconds(2), page.get(0).nextRunAt());

        assertTrue(store.findMany(JobQuery.all(), JobSort.NEXT_RUN_ASC, 5, 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.findMany(JobQuery.all(), JobSort.UNSORTED, -1, 0));
    }

    @Test
    void queryShouldFilterByNamesAndLockAvailability() {
        store.insert(JobRecord.builder("a").nextRunAt(NOW).build());
        store.insert(JobRecord.builder("a").nextRunAt(NOW).lockedAt(NOW.minusSeconds(5)).build());
        store.insert(JobRecord.builder("a").nextRunAt(NOW).lockedAt(NOW.minusSeconds(600)).build());
        store.insert(JobRecord.builder("b").nextRunAt(NOW).build());
        store.insert(JobRecord.builder("c").nextRunAt(NOW.plusSeconds(60)).build());

        JobQuery claimable = JobQuery.builder()
                .names(List.of("a", "c"))
                .dueBy(NOW)
                .lockAvailableAsOf(NOW.minusSeconds(60))
                .build();
        assertEquals(2, store.count(claimable));

        JobQuery unknown = JobQuery.builder().excludedNames(List.of("a", "c")).build();
        assertEquals("b", store.findOne(unknown).orElseThrow().name());
    }

    @Test
    void updateOneShouldApplyPatchesOnlyWhileTheLockIsUnchanged() {
        String id = store.insert(JobRecord.builder("a").nextRunAt(NOW).failCount(1).build());
        assertTrue(store.compareAndSwapLock(id, null, NOW));

        Optional<JobRecord> stale = store.updateOne(id, JobPatch.builder()
                .failReason("late")
                .whenLockedAt(NOW.minusSeconds(1))
                .build());
        assertTrue(stale.isEmpty());
        assertNull(store.findById(id).orElseThrow().failReason());

        JobRecord updated = store.updateOne(id, JobPatch.builder()
                .failReason("boom")
                .incrementFailCount()
                .whenLockedAt(NOW)
                .build()).orElseThrow();
        assertEquals("boom", updated.failReason());
        assertEquals(2, updated.failCount());

        assertTrue(store.updateOne("missing", JobPatch.builder().failReason("x").build()).isEmpty());
    }

    @Test
    void compareAndSwapLockShouldRequireTheExpectedValue() {
        String id = store.insert(JobRecord.builder("a").nextRunAt(NOW).build());

        assertTrue(store.compareAndSwapLock(id, null, NOW));
        assertFalse(store.compareAndSwapLock(id, null, NOW.plusSeconds(1)));
        assertFalse(store.compareAndSwapLock(id, NOW.minusSeconds(1), null));
        assertTrue(store.compareAndSwapLock(id, NOW, null));
        assertNull(store.findById(id).orElseThrow().lockedAt());
        assertFalse(store.compareAndSwapLock("missing", null, NOW));
    }

    @Test
    void deleteManyShouldReturnTheNumberRemoved() {
        store.insert(JobRecord.builder("a").build());
        store.insert(JobRecord.builder("a").build());
        store.insert(JobRecord.builder("b").build());

        assertEquals(2, store.deleteMany(JobQuery.byName("a")));
        assertEquals(0, store.deleteMany(JobQuery.byName("a")));
        assertEquals(1, store.count(JobQuery.all()));
    }
}
