package io.cronhive.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local mapping from job name to handler and execution options.
 *
 * <p>{@link #define} is idempotent by name: the last definition wins. Execution slots are kept per
 * name across redefinitions, so runs started under a replaced definition still count against the
 * new concurrency.
 */
public class DefinitionRegistry {
    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final Map<String, JobDefinition<?>> definitionsByName = new ConcurrentHashMap<>();
    private final Map<String, ExecutionSlots> slotsByName = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final DefinitionOptions defaults;

    /**
     * @param defaults options for handlers that bring none; its lock lifetime also fills in
     *                 options that leave the lock lifetime unset
     */
    public DefinitionRegistry(ObjectMapper objectMapper, DefinitionOptions defaults) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        if (defaults.lockLifetime() == null) {
            throw new IllegalArgumentException("default options must carry a lock lifetime");
        }
    }

    /**
     * Registers every handler under its own name. Two handlers with one name is a wiring error.
     */
    public DefinitionRegistry(List<JobHandler<?>> handlers, ObjectMapper objectMapper, DefinitionOptions defaults) {
        this(objectMapper, defaults);
        Set<String> seen = new HashSet<>();
        for (JobHandler<?> handler : handlers) {
            if (!seen.add(handler.name())) {
                throw new IllegalStateException("Duplicate JobHandler name: " + handler.name());
            }
            define(handler);
        }
    }

    public <T> JobDefinition<T> define(JobHandler<T> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        return define(handler.name(), handler.options(), handler);
    }

    public <T> JobDefinition<T> define(String name, DefinitionOptions options, JobHandler<T> handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        Objects.requireNonNull(handler, "handler must not be null");
        DefinitionOptions resolved = options == null ? defaults : options;
        ExecutionSlots slots = slotsByName.compute(name, (n, existing) -> {
            if (existing == null) {
                return new ExecutionSlots(resolved.concurrency());
            }
            existing.resize(resolved.concurrency());
            return existing;
        });
        JobDefinition<T> definition = JobDefinition.of(name, resolved, handler,
                defaults.lockLifetime(), slots, objectMapper);
        JobDefinition<?> previous = definitionsByName.put(name, definition);
        if (previous != null) {
            log.info("cronhive definition replaced name={} concurrency={} lockLifetime={}",
                    name, definition.concurrency(), definition.lockLifetime());
        } else {
            log.debug("cronhive definition registered name={} concurrency={} lockLifetime={}",
                    name, definition.concurrency(), definition.lockLifetime());
        }
        return definition;
    }

    public Optional<JobDefinition<?>> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitionsByName.get(name));
    }

    public JobDefinition<?> getRequired(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException("No JobHandler registered for name: " + name));
    }

    public boolean undefine(String name) {
        return definitionsByName.remove(name) != null;
    }

    public Set<String> names() {
        return Set.copyOf(definitionsByName.keySet());
    }

    public boolean isEmpty() {
        return definitionsByName.isEmpty();
    }

    public DefinitionOptions defaults() {
        return defaults;
    }

    /**
     * Shortest lock lifetime in use; any lock older than this may be stale for some name.
     */
    public Duration shortestLockLifetime() {
        Duration shortest = defaults.lockLifetime();
        for (JobDefinition<?> d : definitionsByName.values()) {
            if (d.lockLifetime().compareTo(shortest) < 0) {
                shortest = d.lockLifetime();
            }
        }
        return shortest;
    }
}
