package io.cronhive;

import io.cronhive.core.DefinitionOptions;

import java.util.Objects;

/**
 * Code that runs when a job of {@link #name()} comes due.
 *
 * <p>The stored job data is converted to {@link #dataClass()} before {@link #execute(Object)}.
 * Changes the handler makes to a mutable data object (e.g. a run counter) are written back to
 * the job after a successful run. Throwing marks the run as failed.
 */
public interface JobHandler<T> {
    String name();

    Class<T> dataClass();

    void execute(T data) throws Exception;

    /**
     * Execution options for this name; null uses the registry defaults.
     */
    default DefinitionOptions options() {
        return null;
    }

    /**
     * Body of a handler built with {@link #of(String, Class, Body)}.
     */
    @FunctionalInterface
    interface Body<T> {
        void execute(T data) throws Exception;
    }

    static <T> JobHandler<T> of(String name, Class<T> dataClass, Body<T> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return new JobHandler<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Class<T> dataClass() {
                return dataClass;
            }

            @Override
            public void execute(T data) throws Exception {
                body.execute(data);
            }
        };
    }

    static JobHandler<Void> of(String name, Body<Void> body) {
        return of(name, Void.class, body);
    }
}
