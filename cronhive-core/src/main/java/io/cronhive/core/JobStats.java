package io.cronhive.core;

/**
 * Counts by state at one observation instant.
 *
 * <ul>
 *   <li>scheduled : nextRunAt in the future and not disabled</li>
 *   <li>queued    : lockedAt present (claimed, not yet released)</li>
 *   <li>completed : lastFinishedAt present and failedAt absent</li>
 *   <li>failed    : failedAt present</li>
 *   <li>successRate : completed / total in percent; 100 when there are no jobs</li>
 * </ul>
 */
public record JobStats(
        long total,
        long scheduled,
        long queued,
        long completed,
        long failed,
        double successRate
) {

    public static JobStats of(long total, long scheduled, long queued, long completed, long failed) {
        double rate = total > 0 ? (completed * 100.0) / total : 100.0;
        return new JobStats(total, scheduled, queued, completed, failed, rate);
    }
}
