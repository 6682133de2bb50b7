package io.cronhive;

import io.cronhive.core.JobRecord;

/**
 * Scheduler notifications. All methods default to no-ops; implement the ones you need.
 *
 * <p>Callbacks run on scheduler threads (poller, worker or timeout thread) and must return quickly.
 * An exception thrown by a listener is logged and does not affect the scheduler.
 */
public interface CronhiveListener {

    default void onReady() {
    }

    default void onStopped() {
    }

    default void onJobStarted(JobRecord job) {
    }

    default void onJobSucceeded(JobRecord job) {
    }

    /**
     * @param error the handler's exception, or a {@link io.cronhive.core.HandlerTimeoutException}
     */
    default void onJobFailed(JobRecord job, Throwable error) {
    }

    /**
     * A due job whose name has no registered handler was skipped.
     */
    default void onUnknownJob(JobRecord job) {
    }

    default void onPollError(Exception error) {
    }
}
