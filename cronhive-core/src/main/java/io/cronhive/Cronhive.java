package io.cronhive;

import io.cronhive.core.DefinitionOptions;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.PersistResult;

import java.time.Instant;
import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>Absolute time scheduling (single run at a specific {@link Instant})</li>
 *   <li>Interval-based scheduling (human duration, cron string, or numeric seconds)</li>
 * </ul>
 *
 * <p>Any number of schedulers may share one job store; each due run executes on at most one of them.
 */
public interface Cronhive {
    void start();

    void stop();

    /**
     * Register a handler under its own name with its own (or the default) options.
     */
    <T> JobDefinition<T> define(JobHandler<T> handler);

    <T> JobDefinition<T> define(String name, DefinitionOptions options, JobHandler<T> handler);

    <T> JobBuilder<T> create(String name, T data);

    JobBuilder<Void> create(String name);

    /**
     * Schedule a one-time job at an absolute time.
     */
    <T> JobBuilder<T> schedule(String name, Instant time, T data);

    JobBuilder<Void> schedule(String name, Instant time);

    /**
     * Create or update the recurring job of this name.
     * Supported values include human duration text or cron expressions.
     */
    <T> PersistResult every(String name, String interval, T data, JobBuilder.RepeatOptions options);

    PersistResult every(String name, String interval, JobBuilder.RepeatOptions options);

    <T> PersistResult every(String name, Number interval, T data, JobBuilder.RepeatOptions options);

    PersistResult every(String name, Number interval, JobBuilder.RepeatOptions options);

    <T> PersistResult now(String name, T data);

    PersistResult now(String name);

    List<JobRecord> jobs(JobQuery query);

    /**
     * @return number of jobs that changed from enabled to disabled
     */
    long disable(JobQuery query);

    long enable(JobQuery query);

    void addListener(CronhiveListener listener);

    void removeListener(CronhiveListener listener);
}
