package io.cronhive.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.JobHandler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A registered handler with its resolved options.
 *
 * <p>{@link #slots()} are the name's execution slots, shared with every earlier definition of the
 * same name and limited to {@code concurrency}. The definition also builds the handler's typed view of the stored data map.
 */
public final class JobDefinition<T> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final JobHandler<T> handler;
    private final int concurrency;
    private final Duration lockLifetime;
    private final Integer priority;
    private final ExecutionSlots slots;
    private final ObjectMapper objectMapper;

    JobDefinition(String name, DefinitionOptions options, JobHandler<T> handler, Duration defaultLockLifetime,
                  ExecutionSlots slots, ObjectMapper objectMapper) {
        this.name = name;
        this.handler = handler;
        this.concurrency = options.concurrency();
        this.lockLifetime = options.lockLifetime() != null ? options.lockLifetime() : defaultLockLifetime;
        this.priority = options.priority();
        this.slots = slots;
        this.objectMapper = objectMapper;
    }

    public String name() {
        return name;
    }

    public JobHandler<T> handler() {
        return handler;
    }

    public int concurrency() {
        return concurrency;
    }

    public Duration lockLifetime() {
        return lockLifetime;
    }

    public Integer priority() {
        return priority;
    }

    public ExecutionSlots slots() {
        return slots;
    }

    /**
     * Runs the handler against a copy of {@code data} and returns the data as the handler left it.
     */
    public Map<String, Object> invoke(Map<String, Object> data) throws Exception {
        Class<T> dataClass = handler.dataClass();
        if (dataClass == null || dataClass == Void.class) {
            handler.execute(null);
            return data;
        }

        T typed = data == null ? null : objectMapper.convertValue(new LinkedHashMap<>(data), dataClass);
        handler.execute(typed);
        if (typed == null) {
            return data;
        }
        return objectMapper.convertValue(typed, MAP_TYPE);
    }

    @Override
    public String toString() {
        return "JobDefinition{name=" + name + ", concurrency=" + concurrency + ", lockLifetime=" + lockLifetime + "}";
    }

    static <T> JobDefinition<T> of(String name, DefinitionOptions options, JobHandler<T> handler,
                                   Duration defaultLockLifetime, ExecutionSlots slots, ObjectMapper objectMapper) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(slots, "slots must not be null");
        return new JobDefinition<>(name, options, handler, defaultLockLifetime, slots, objectMapper);
    }
}
