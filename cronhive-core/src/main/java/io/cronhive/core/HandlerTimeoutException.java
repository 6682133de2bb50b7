package io.cronhive.core;

import java.time.Duration;

/**
 * A handler ran past its lock lifetime and was abandoned.
 */
public class HandlerTimeoutException extends RuntimeException {

    private final Duration lockLifetime;

    public HandlerTimeoutException(String jobName, Duration lockLifetime) {
        super("Job '" + jobName + "' exceeded its lock lifetime of " + lockLifetime);
        this.lockLifetime = lockLifetime;
    }

    public Duration lockLifetime() {
        return lockLifetime;
    }
}
