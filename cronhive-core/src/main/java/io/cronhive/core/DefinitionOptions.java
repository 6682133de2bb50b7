package io.cronhive.core;

import java.time.Duration;

/**
 * Per-name execution options.
 *
 * @param concurrency  max simultaneous executions of this name in one worker pool
 * @param lockLifetime how long a claim is honored; null means the configured default
 * @param priority     default priority for jobs created under this name; null means {@link Priority#NORMAL}
 */
public record DefinitionOptions(int concurrency, Duration lockLifetime, Integer priority) {

    public DefinitionOptions {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be a positive number");
        }
        if (lockLifetime != null && (lockLifetime.isZero() || lockLifetime.isNegative())) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
    }

    public static DefinitionOptions defaults() {
        return new DefinitionOptions(1, null, null);
    }

    public DefinitionOptions withConcurrency(int concurrency) {
        return new DefinitionOptions(concurrency, lockLifetime, priority);
    }

    public DefinitionOptions withLockLifetime(Duration lockLifetime) {
        return new DefinitionOptions(concurrency, lockLifetime, priority);
    }

    public DefinitionOptions withPriority(Integer priority) {
        return new DefinitionOptions(concurrency, lockLifetime, priority);
    }
}
