package io.cronhive.core;

import java.util.concurrent.Semaphore;

/**
 * Per-name execution permits whose limit can change while permits are held.
 *
 * <p>Lowering the limit below the number of held permits drives the available count negative;
 * nothing is acquired again until enough holders release.
 */
public final class ExecutionSlots extends Semaphore {

    private int limit;

    ExecutionSlots(int limit) {
        super(limit);
        this.limit = limit;
    }

    synchronized void resize(int newLimit) {
        if (newLimit <= 0) {
            throw new IllegalArgumentException("concurrency must be a positive number");
        }
        int delta = newLimit - limit;
        if (delta > 0) {
            release(delta);
        } else if (delta < 0) {
            reducePermits(-delta);
        }
        limit = newLimit;
    }

    public synchronized int limit() {
        return limit;
    }

    @Override
    public String toString() {
        return "ExecutionSlots{limit=" + limit() + ", available=" + availablePermits() + "}";
    }
}
