package io.cronhive.core;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * JobQuery describes which job records to match.
 *
 * <p>This is an API-layer object (NOT a database query). Each store translates it: the in-memory
 * store evaluates {@link #matches(JobRecord)}, the Mongo store builds an equivalent criteria.
 * All conditions are AND-ed; an unset condition matches everything.
 */
public final class JobQuery {

    private static final JobQuery ALL = builder().build();

    private final Set<String> ids;
    private final String name;
    private final Set<String> names;
    private final Set<String> excludedNames;
    private final JobType type;
    private final Boolean disabled;
    private final Instant dueBy;
    private final Instant scheduledAfter;
    private final Boolean hasNextRun;
    private final Instant lockAvailableAsOf;
    private final Boolean locked;
    private final Boolean failed;
    private final Boolean finished;
    private final Instant finishedBefore;
    private final Boolean started;

    private JobQuery(Builder b) {
        this.ids = b.ids == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(b.ids));
        this.name = (b.name == null || b.name.isBlank()) ? null : b.name;
        this.names = b.names == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(b.names));
        this.excludedNames = b.excludedNames == null ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedNames));
        this.type = b.type;
        this.disabled = b.disabled;
        this.dueBy = b.dueBy;
        this.scheduledAfter = b.scheduledAfter;
        this.hasNextRun = b.hasNextRun;
        this.lockAvailableAsOf = b.lockAvailableAsOf;
        this.locked = b.locked;
        this.failed = b.failed;
        this.finished = b.finished;
        this.finishedBefore = b.finishedBefore;
        this.started = b.started;
    }

    public static JobQuery all() {
        return ALL;
    }

    public static JobQuery byId(String id) {
        return builder().ids(Set.of(id)).build();
    }

    public static JobQuery byName(String name) {
        return builder().name(name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Id whitelist; null means any id, empty matches nothing.
     */
    public Set<String> ids() {
        return ids;
    }

    public String name() {
        return name;
    }

    /**
     * Name whitelist; null means any name, empty matches nothing.
     */
    public Set<String> names() {
        return names;
    }

    /**
     * Names to leave out; null or empty excludes nothing.
     */
    public Set<String> excludedNames() {
        return excludedNames;
    }

    public JobType type() {
        return type;
    }

    public Boolean disabled() {
        return disabled;
    }

    /**
     * {@code nextRunAt} present and {@code <= dueBy}.
     */
    public Instant dueBy() {
        return dueBy;
    }

    /**
     * {@code nextRunAt} present and {@code > scheduledAfter}.
     */
    public Instant scheduledAfter() {
        return scheduledAfter;
    }

    public Boolean hasNextRun() {
        return hasNextRun;
    }

    /**
     * {@code lockedAt} absent or {@code <= lockAvailableAsOf} (a stale lock).
     */
    public Instant lockAvailableAsOf() {
        return lockAvailableAsOf;
    }

    public Boolean locked() {
        return locked;
    }

    public Boolean failed() {
        return failed;
    }

    public Boolean finished() {
        return finished;
    }

    /**
     * {@code lastFinishedAt} present and {@code < finishedBefore}.
     */
    public Instant finishedBefore() {
        return finishedBefore;
    }

    public Boolean started() {
        return started;
    }

    public boolean isEmpty() {
        return ids == null
                && name == null
                && names == null
                && (excludedNames == null || excludedNames.isEmpty())
                && type == null
                && disabled == null
                && dueBy == null
                && scheduledAfter == null
                && hasNextRun == null
                && lockAvailableAsOf == null
                && locked == null
                && failed == null
                && finished == null
                && finishedBefore == null
                && started == null;
    }

    public boolean matches(JobRecord r) {
        if (ids != null && !ids.contains(r.id())) {
            return false;
        }
        if (name != null && !name.equals(r.name())) {
            return false;
        }
        if (names != null && !names.contains(r.name())) {
            return false;
        }
        if (excludedNames != null && excludedNames.contains(r.name())) {
            return false;
        }
        if (type != null && type != r.type()) {
            return false;
        }
        if (disabled != null && disabled != r.disabled()) {
            return false;
        }
        if (dueBy != null && (r.nextRunAt() == null || r.nextRunAt().isAfter(dueBy))) {
            return false;
        }
        if (scheduledAfter != null && (r.nextRunAt() == null || !r.nextRunAt().isAfter(scheduledAfter))) {
            return false;
        }
        if (hasNextRun != null && hasNextRun != (r.nextRunAt() != null)) {
            return false;
        }
        if (lockAvailableAsOf != null && r.lockedAt() != null && r.lockedAt().isAfter(lockAvailableAsOf)) {
            return false;
        }
        if (locked != null && locked != (r.lockedAt() != null)) {
            return false;
        }
        if (failed != null && failed != (r.failedAt() != null)) {
            return false;
        }
        if (finished != null && finished != (r.lastFinishedAt() != null)) {
            return false;
        }
        if (finishedBefore != null && (r.lastFinishedAt() == null || !r.lastFinishedAt().isBefore(finishedBefore))) {
            return false;
        }
        return started == null || started == (r.lastRunAt() != null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("JobQuery{");
        append(sb, "ids", ids);
        append(sb, "name", name);
        append(sb, "names", names);
        append(sb, "excludedNames", excludedNames);
        append(sb, "type", type);
        append(sb, "disabled", disabled);
        append(sb, "dueBy", dueBy);
        append(sb, "scheduledAfter", scheduledAfter);
        append(sb, "hasNextRun", hasNextRun);
        append(sb, "lockAvailableAsOf", lockAvailableAsOf);
        append(sb, "locked", locked);
        append(sb, "failed", failed);
        append(sb, "finished", finished);
        append(sb, "finishedBefore", finishedBefore);
        append(sb, "started", started);
        return sb.append('}').toString();
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (value == null) {
            return;
        }
        if (sb.charAt(sb.length() - 1) != '{') {
            sb.append(", ");
        }
        sb.append(key).append('=').append(value);
    }

    public static final class Builder {
        private Set<String> ids;
        private String name;
        private Set<String> names;
        private Set<String> excludedNames;
        private JobType type;
        private Boolean disabled;
        private Instant dueBy;
        private Instant scheduledAfter;
        private Boolean hasNextRun;
        private Instant lockAvailableAsOf;
        private Boolean locked;
        private Boolean failed;
        private Boolean finished;
        private Instant finishedBefore;
        private Boolean started;

        private Builder() {
        }

        public Builder ids(Collection<String> ids) {
            Objects.requireNonNull(ids, "ids must not be null");
            for (String id : ids) {
                if (id == null || id.isBlank()) {
                    throw new IllegalArgumentException("ids must not contain blank values");
                }
            }
            this.ids = new LinkedHashSet<>(ids);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder names(Collection<String> names) {
            this.names = new LinkedHashSet<>(Objects.requireNonNull(names, "names must not be null"));
            return this;
        }

        public Builder excludedNames(Collection<String> excludedNames) {
            this.excludedNames = new LinkedHashSet<>(
                    Objects.requireNonNull(excludedNames, "excludedNames must not be null"));
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder disabled(Boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder dueBy(Instant dueBy) {
            this.dueBy = dueBy;
            return this;
        }

        public Builder scheduledAfter(Instant scheduledAfter) {
            this.scheduledAfter = scheduledAfter;
            return this;
        }

        public Builder hasNextRun(Boolean hasNextRun) {
            this.hasNextRun = hasNextRun;
            return this;
        }

        public Builder lockAvailableAsOf(Instant cutoff) {
            this.lockAvailableAsOf = cutoff;
            return this;
        }

        public Builder locked(Boolean locked) {
            this.locked = locked;
            return this;
        }

        public Builder failed(Boolean failed) {
            this.failed = failed;
            return this;
        }

        public Builder finished(Boolean finished) {
            this.finished = finished;
            return this;
        }

        public Builder finishedBefore(Instant finishedBefore) {
            this.finishedBefore = finishedBefore;
            return this;
        }

        public Builder started(Boolean started) {
            this.started = started;
            return this;
        }

        public JobQuery build() {
            return new JobQuery(this);
        }
    }
}
