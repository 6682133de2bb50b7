package io.cronhive.config;

import io.cronhive.core.DefinitionOptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration for scheduler behavior.
 */
public class CronhiveProperties {
    private int maxConcurrency = 20; // global
    private int defaultConcurrency = 1; // per job name
    private int batchSize = 50; // candidates scanned per tick
    private int maxRetryCount = 0; // one-shot retries, 0 = none
    private Duration defaultLockLifetime = Duration.ofMinutes(10);
    private Duration processEvery = Duration.ofSeconds(30);
    private boolean cleanupFinishedJobs = false;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private boolean autoStart = true; // false: admin and programmatic API only, no polling
    private Map<String, RecurringJob> recurring = new LinkedHashMap<>();

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        this.maxRetryCount = maxRetryCount;
    }

    public Duration getDefaultLockLifetime() {
        return defaultLockLifetime;
    }

    public void setDefaultLockLifetime(Duration defaultLockLifetime) {
        this.defaultLockLifetime = defaultLockLifetime;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    /**
     * Options applied to handlers that do not declare their own.
     */
    public DefinitionOptions definitionDefaults() {
        return new DefinitionOptions(defaultConcurrency, defaultLockLifetime, null);
    }

    /**
     * Recurring jobs created at startup when no recurring job of that name exists yet.
     * Keyed by job name.
     */
    public Map<String, RecurringJob> getRecurring() {
        return recurring;
    }

    public void setRecurring(Map<String, RecurringJob> recurring) {
        this.recurring = recurring;
    }

    public static class RecurringJob {
        private String interval;
        private String timezone;
        private boolean skipImmediate = false;
        private Map<String, Object> data = new LinkedHashMap<>();

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isSkipImmediate() {
            return skipImmediate;
        }

        public void setSkipImmediate(boolean skipImmediate) {
            this.skipImmediate = skipImmediate;
        }

        public Map<String, Object> getData() {
            return data;
        }

        public void setData(Map<String, Object> data) {
            this.data = data;
        }
    }
}
