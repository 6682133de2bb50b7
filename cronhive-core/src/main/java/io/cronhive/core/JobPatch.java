package io.cronhive.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Atomic partial update of a {@link JobRecord}.
 *
 * <p>A field mapped to {@code null} is unset. {@link JobField#LOCKED_AT} is never patchable:
 * locks move only through {@code JobStore#compareAndSwapLock}.
 *
 * <p>A patch may carry a lock precondition ({@link Builder#whenLockedAt(Instant)}): the store
 * applies it only while the stored {@code lockedAt} still equals the expected claim, so a worker
 * whose lock was recovered by another process cannot write back stale results.
 */
public final class JobPatch {

    private final Map<JobField, Object> changes;
    private final int failCountIncrement;
    private final boolean lockGuarded;
    private final Instant expectedLockedAt;

    private JobPatch(Builder b) {
        this.changes = Collections.unmodifiableMap(new LinkedHashMap<>(b.changes));
        this.failCountIncrement = b.failCountIncrement;
        this.lockGuarded = b.lockGuarded;
        this.expectedLockedAt = b.expectedLockedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<JobField, Object> changes() {
        return changes;
    }

    public int failCountIncrement() {
        return failCountIncrement;
    }

    public boolean isLockGuarded() {
        return lockGuarded;
    }

    public Instant expectedLockedAt() {
        return expectedLockedAt;
    }

    public boolean isEmpty() {
        return changes.isEmpty() && failCountIncrement == 0;
    }

    public boolean preconditionHolds(JobRecord current) {
        return !lockGuarded || Objects.equals(current.lockedAt(), expectedLockedAt);
    }

    @SuppressWarnings("unchecked")
    public JobRecord applyTo(JobRecord current) {
        JobRecord.Builder b = current.toBuilder();
        for (Map.Entry<JobField, Object> e : changes.entrySet()) {
            Object v = e.getValue();
            switch (e.getKey()) {
                case NAME -> b.name((String) v);
                case DATA -> b.data((Map<String, Object>) v);
                case PRIORITY -> b.priority((Integer) v);
                case TYPE -> b.type((JobType) v);
                case NEXT_RUN_AT -> b.nextRunAt((Instant) v);
                case REPEAT -> b.repeat((JobRecord.Repeat) v);
                case DISABLED -> b.disabled((Boolean) v);
                case LAST_RUN_AT -> b.lastRunAt((Instant) v);
                case LAST_FINISHED_AT -> b.lastFinishedAt((Instant) v);
                case FAILED_AT -> b.failedAt((Instant) v);
                case FAIL_REASON -> b.failReason((String) v);
                case FAIL_COUNT -> b.failCount((Integer) v);
                default -> throw new IllegalStateException("Field is not patchable: " + e.getKey());
            }
        }
        if (failCountIncrement != 0) {
            b.failCount(current.failCount() + failCountIncrement);
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "JobPatch{changes=" + changes.keySet()
                + ", failCountIncrement=" + failCountIncrement
                + (lockGuarded ? ", whenLockedAt=" + expectedLockedAt : "")
                + "}";
    }

    public static final class Builder {
        private final Map<JobField, Object> changes = new LinkedHashMap<>();
        private int failCountIncrement;
        private boolean lockGuarded;
        private Instant expectedLockedAt;

        private Builder() {
        }

        private Builder put(JobField field, Object value) {
            if (!field.isPatchable()) {
                throw new IllegalArgumentException("Field is not patchable: " + field.fieldName());
            }
            changes.put(field, value);
            return this;
        }

        public Builder name(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            return put(JobField.NAME, name);
        }

        public Builder data(Map<String, Object> data) {
            return put(JobField.DATA, data == null ? null : new LinkedHashMap<>(data));
        }

        public Builder priority(int priority) {
            return put(JobField.PRIORITY, priority);
        }

        public Builder type(JobType type) {
            Objects.requireNonNull(type, "type must not be null");
            return put(JobField.TYPE, type);
        }

        public Builder nextRunAt(Instant nextRunAt) {
            return put(JobField.NEXT_RUN_AT, nextRunAt);
        }

        public Builder repeat(JobRecord.Repeat repeat) {
            return put(JobField.REPEAT, repeat);
        }

        public Builder disabled(boolean disabled) {
            return put(JobField.DISABLED, disabled);
        }

        public Builder lastRunAt(Instant lastRunAt) {
            return put(JobField.LAST_RUN_AT, lastRunAt);
        }

        public Builder lastFinishedAt(Instant lastFinishedAt) {
            return put(JobField.LAST_FINISHED_AT, lastFinishedAt);
        }

        public Builder failedAt(Instant failedAt) {
            return put(JobField.FAILED_AT, failedAt);
        }

        public Builder failReason(String failReason) {
            return put(JobField.FAIL_REASON, failReason);
        }

        public Builder failCount(int failCount) {
            if (failCount < 0) {
                throw new IllegalArgumentException("failCount must not be negative");
            }
            return put(JobField.FAIL_COUNT, failCount);
        }

        public Builder incrementFailCount() {
            this.failCountIncrement++;
            return this;
        }

        /**
         * Apply only while the stored lock still equals {@code lockedAt}.
         */
        public Builder whenLockedAt(Instant lockedAt) {
            this.lockGuarded = true;
            this.expectedLockedAt = lockedAt;
            return this;
        }

        public JobPatch build() {
            if (failCountIncrement != 0 && changes.containsKey(JobField.FAIL_COUNT)) {
                throw new IllegalStateException("failCount cannot be both set and incremented");
            }
            return new JobPatch(this);
        }
    }
}
