package io.cronhive.core;

/**
 * A cron expression, interval, run-at string or timezone that cannot be parsed.
 *
 * <p>Raised when a job is defined, created or updated, so bad schedules never reach the poller.
 */
public class InvalidScheduleSpecException extends IllegalArgumentException {

    private final String spec;

    public InvalidScheduleSpecException(String spec, String message) {
        super(message);
        this.spec = spec;
    }

    public InvalidScheduleSpecException(String spec, String message, Throwable cause) {
        super(message, cause);
        this.spec = spec;
    }

    public String spec() {
        return spec;
    }
}
