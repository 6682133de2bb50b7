package io.cronhive.config;

import io.cronhive.Cronhive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts polling once the context is refreshed and drains running jobs when it closes.
 *
 * <p>Runs in the last phase, so handlers and their dependencies are up before the first poll and
 * still up while in-flight jobs drain on shutdown. With {@code cronhive.auto-start=false} the
 * context only offers the admin and programmatic API; {@link #start()} can still be called by hand.
 */
public class CronhiveLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CronhiveLifecycle.class);

    private final Cronhive cronhive;
    private final boolean autoStartup;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CronhiveLifecycle(Cronhive cronhive, boolean autoStartup) {
        this.cronhive = Objects.requireNonNull(cronhive, "cronhive must not be null");
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            cronhive.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("cronhive stopping with the application context");
            cronhive.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
