package io.cronhive;

import io.cronhive.core.JobSpec;
import io.cronhive.core.PersistResult;
import io.cronhive.core.Priority;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + write to the job store</li>
 * </ul>
 * A job with neither an explicit schedule nor a repeat runs as soon as it is saved.
 */
public interface JobBuilder<T> {

    /**
     * Options for repeat scheduling.
     * <ul>
     *   <li>skipImmediate: if true, do not run immediately; schedule from the next computed run time</li>
     *   <li>timezone: IANA time zone id (e.g. "Asia/Taipei"); null means system default</li>
     * </ul>
     */
    record RepeatOptions(boolean skipImmediate, String timezone) {
        public static RepeatOptions defaults() {
            return new RepeatOptions(false, null);
        }
    }

    /**
     * Set job priority.
     */
    JobBuilder<T> priority(Priority priority);

    /**
     * Set job priority raw value.
     */
    JobBuilder<T> priority(int priority);

    /**
     * Set timezone used by schedule strings and cron repeats. Null means system default.
     */
    JobBuilder<T> timezone(String timezone);

    /**
     * Schedule a one-time run at the specified absolute time.
     */
    JobBuilder<T> schedule(Instant time);

    /**
     * Schedule by string: "now", an ISO-8601 date-time, "in 10 minutes" or "10 minutes".
     */
    JobBuilder<T> schedule(String when);

    /**
     * Sets a job to repeat at a specific time
     * Like cron, but only runs once per day at the specified time.
     */
    JobBuilder<T> repeatAt(String time);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours") or cron expressions.
     */
    JobBuilder<T> repeatEvery(String interval);

    /**
     * Repeat by a string spec with options (skipImmediate/timezone).
     */
    JobBuilder<T> repeatEvery(String interval, RepeatOptions options);

    /**
     * Repeat every {@code seconds} seconds.
     */
    JobBuilder<T> repeatEvery(Number seconds);

    JobBuilder<T> repeatEvery(Number seconds, RepeatOptions options);

    /**
     * Store the job disabled; the poller ignores it until it is enabled.
     */
    JobBuilder<T> disable();

    /**
     * Mark this job as the only recurring job of its name: if one exists, update it instead of inserting.
     * <p>Used by Cronhive.every(...)
     */
    JobBuilder<T> single();

    /**
     * Build an immutable job spec (not persisted).
     */
    JobSpec<T> build();

    /**
     * Build + persist.
     */
    PersistResult save();

    PersistResult save(JobSpec<T> spec);
}
