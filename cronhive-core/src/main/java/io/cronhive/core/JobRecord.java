package io.cronhive.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted unit of schedulable work.
 *
 * <p>A record is a snapshot: stores hand out new instances on every read and every update,
 * so holding one never observes later changes.
 *
 * <ul>
 *   <li>{@code nextRunAt == null}: not scheduled to run again</li>
 *   <li>{@code lockedAt != null}: claimed by a worker (or abandoned, once older than the lock lifetime)</li>
 *   <li>{@code repeat != null}: recurring; the next run is recomputed after every execution</li>
 * </ul>
 */
public record JobRecord(
        String id,
        String name,
        Map<String, Object> data,
        int priority,
        JobType type,

        // scheduling
        Instant nextRunAt,
        Repeat repeat,
        boolean disabled,

        // execution bookkeeping
        Instant lastRunAt,
        Instant lastFinishedAt,
        Instant failedAt,
        String failReason,
        int failCount,
        Instant lockedAt
) {

    public JobRecord {
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        if (type == null) {
            type = JobType.forRepeat(repeat);
        }
    }

    /**
     * Repeat settings of a recurring job.
     *
     * @param interval cron expression or human interval ("5 seconds", "0 9 * * 1")
     * @param timezone IANA zone id; null means system default
     */
    public record Repeat(String interval, String timezone) {
        public Repeat {
            if (interval == null || interval.isBlank()) {
                throw new IllegalArgumentException("repeat interval must not be blank");
            }
        }
    }

    /**
     * Due and enabled, regardless of lock state.
     */
    public boolean isDue(Instant now) {
        return !disabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public boolean isLocked() {
        return lockedAt != null;
    }

    public boolean isFailed() {
        return failedAt != null;
    }

    public boolean isRecurring() {
        return type.shouldReschedule() && repeat != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public static final class Builder {
        private String id;
        private String name;
        private Map<String, Object> data;
        private int priority = Priority.NORMAL.value();
        private JobType type;
        private Instant nextRunAt;
        private Repeat repeat;
        private boolean disabled;
        private Instant lastRunAt;
        private Instant lastFinishedAt;
        private Instant failedAt;
        private String failReason;
        private int failCount;
        private Instant lockedAt;

        private Builder() {
        }

        private Builder(JobRecord r) {
            this.id = r.id;
            this.name = r.name;
            this.data = r.data;
            this.priority = r.priority;
            this.type = r.type;
            this.nextRunAt = r.nextRunAt;
            this.repeat = r.repeat;
            this.disabled = r.disabled;
            this.lastRunAt = r.lastRunAt;
            this.lastFinishedAt = r.lastFinishedAt;
            this.failedAt = r.failedAt;
            this.failReason = r.failReason;
            this.failCount = r.failCount;
            this.lockedAt = r.lockedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder repeat(Repeat repeat) {
            this.repeat = repeat;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder lastFinishedAt(Instant lastFinishedAt) {
            this.lastFinishedAt = lastFinishedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder failReason(String failReason) {
            this.failReason = failReason;
            return this;
        }

        public Builder failCount(int failCount) {
            this.failCount = failCount;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(
                    id,
                    name,
                    data,
                    priority,
                    type,
                    nextRunAt,
                    repeat,
                    disabled,
                    lastRunAt,
                    lastFinishedAt,
                    failedAt,
                    failReason,
                    failCount,
                    lockedAt
            );
        }
    }
}
