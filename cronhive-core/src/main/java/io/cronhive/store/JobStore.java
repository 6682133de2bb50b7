package io.cronhive.store;

import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence abstraction over job records.
 *
 * <p>Every operation must be safe to call concurrently from several scheduler processes sharing
 * one backing store. The store, not the caller, guarantees atomicity of
 * {@link #updateOne(String, JobPatch)} and {@link #compareAndSwapLock(String, Instant, Instant)};
 * the latter is the only mutual-exclusion primitive the scheduler relies on.
 */
public interface JobStore {

    /**
     * Insert a new record. The record must not carry an id; the store assigns one.
     *
     * @return the assigned id
     */
    String insert(JobRecord record);

    /**
     * @param skip  number of matching records to skip (after sorting)
     * @param limit max records returned; {@code <= 0} means no limit
     */
    List<JobRecord> findMany(JobQuery query, JobSort sort, int skip, int limit);

    default List<JobRecord> findMany(JobQuery query) {
        return findMany(query, JobSort.UNSORTED, 0, 0);
    }

    Optional<JobRecord> findOne(JobQuery query);

    default Optional<JobRecord> findById(String id) {
        return findOne(JobQuery.byId(id));
    }

    /**
     * Atomically apply {@code patch} to one record.
     *
     * @return the record after the patch; empty when the id does not exist or the patch's lock
     * precondition no longer holds
     */
    Optional<JobRecord> updateOne(String id, JobPatch patch);

    /**
     * Set {@code lockedAt} to {@code newLockedAt} (null clears it) only if the stored value still equals
     * {@code expectedLockedAt} (null meaning "no lock").
     *
     * @return true when this call changed the lock
     */
    boolean compareAndSwapLock(String id, Instant expectedLockedAt, Instant newLockedAt);

    long deleteMany(JobQuery query);

    long count(JobQuery query);
}
