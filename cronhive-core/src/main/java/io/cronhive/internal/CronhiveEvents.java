package io.cronhive.internal;

import io.cronhive.CronhiveListener;
import io.cronhive.core.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans scheduler notifications out to registered listeners.
 * A failing listener is logged and skipped.
 */
public class CronhiveEvents {
    private static final Logger log = LoggerFactory.getLogger(CronhiveEvents.class);

    private final List<CronhiveListener> listeners = new CopyOnWriteArrayList<>();

    public void add(CronhiveListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void remove(CronhiveListener listener) {
        listeners.remove(listener);
    }

    public void ready() {
        fire("ready", CronhiveListener::onReady);
    }

    public void stopped() {
        fire("stopped", CronhiveListener::onStopped);
    }

    public void jobStarted(JobRecord job) {
        fire("start", l -> l.onJobStarted(job));
    }

    public void jobSucceeded(JobRecord job) {
        fire("success", l -> l.onJobSucceeded(job));
    }

    public void jobFailed(JobRecord job, Throwable error) {
        fire("fail", l -> l.onJobFailed(job, error));
    }

    public void unknownJob(JobRecord job) {
        fire("unknown", l -> l.onUnknownJob(job));
    }

    public void pollError(Exception error) {
        fire("pollError", l -> l.onPollError(error));
    }

    private void fire(String event, Consumer<CronhiveListener> call) {
        for (CronhiveListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("cronhive listener failed event={} listener={} msg={}",
                        event, listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
