package io.cronhive.store;

import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Reference {@link JobStore} holding records in process memory.
 *
 * <p>Every operation runs under one monitor, which makes each of them atomic with respect to the
 * others. Several schedulers in one JVM can share an instance to behave like processes sharing
 * a database. Nothing survives a restart.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, JobRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized String insert(JobRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        if (record.id() != null) {
            throw new IllegalArgumentException("record to insert must not have an id: " + record.id());
        }
        requireName(record);

        String id = UUID.randomUUID().toString();
        records.put(id, record.toBuilder().id(id).build());
        return id;
    }

    @Override
    public synchronized List<JobRecord> findMany(JobQuery query, JobSort sort, int skip, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(sort, "sort must not be null");
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }

        List<JobRecord> matched = new ArrayList<>();
        for (JobRecord r : records.values()) {
            if (query.matches(r)) {
                matched.add(r);
            }
        }
        if (!sort.isUnsorted()) {
            matched.sort(sort.comparator());
        }

        int from = Math.min(skip, matched.size());
        int to = limit <= 0 ? matched.size() : (int) Math.min((long) from + limit, matched.size());
        return new ArrayList<>(matched.subList(from, to));
    }

    @Override
    public synchronized Optional<JobRecord> findOne(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        for (JobRecord r : records.values()) {
            if (query.matches(r)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<JobRecord> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Optional<JobRecord> updateOne(String id, JobPatch patch) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(patch, "patch must not be null");

        JobRecord current = records.get(id);
        if (current == null || !patch.preconditionHolds(current)) {
            return Optional.empty();
        }
        JobRecord updated = patch.applyTo(current);
        requireName(updated);
        records.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized boolean compareAndSwapLock(String id, Instant expectedLockedAt, Instant newLockedAt) {
        Objects.requireNonNull(id, "id must not be null");

        JobRecord current = records.get(id);
        if (current == null || !Objects.equals(current.lockedAt(), expectedLockedAt)) {
            return false;
        }
        records.put(id, current.toBuilder().lockedAt(newLockedAt).build());
        return true;
    }

    @Override
    public synchronized long deleteMany(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        long deleted = 0;
        Iterator<JobRecord> it = records.values().iterator();
        while (it.hasNext()) {
            if (query.matches(it.next())) {
                it.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized long count(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        long n = 0;
        for (JobRecord r : records.values()) {
            if (query.matches(r)) {
                n++;
            }
        }
        return n;
    }

    private static void requireName(JobRecord record) {
        if (record.name() == null || record.name().isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
    }
}
