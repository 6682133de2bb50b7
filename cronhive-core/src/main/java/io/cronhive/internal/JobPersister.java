package io.cronhive.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.core.JobDefinition;
import io.cronhive.core.JobNotFoundException;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSpec;
import io.cronhive.core.JobType;
import io.cronhive.core.PersistResult;
import io.cronhive.core.Priority;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes {@link JobSpec}s to the store.
 *
 * <p>Semantics:
 * <ul>
 *   <li>single: one recurring job per name (update the existing one, else insert)</li>
 *   <li>otherwise: always insert a new record</li>
 * </ul>
 */
public class JobPersister {
    private static final Logger log = LoggerFactory.getLogger(JobPersister.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final JobStore jobStore;
    private final DefinitionRegistry registry;
    private final ObjectMapper objectMapper;

    public JobPersister(JobStore jobStore, DefinitionRegistry registry, ObjectMapper objectMapper) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public <T> PersistResult save(JobSpec<T> spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        Map<String, Object> dataMap = toDataMap(spec.data());
        int priority = resolvePriority(spec);

        if (spec.single()) {
            Optional<JobRecord> existing = jobStore.findOne(JobQuery.builder()
                    .name(spec.name())
                    .type(JobType.RECURRING)
                    .build());
            if (existing.isPresent()) {
                return PersistResult.updatedResult(updateSingle(existing.get(), spec, dataMap, priority));
            }
        }

        JobRecord record = JobRecord.builder(spec.name())
                .data(dataMap)
                .priority(priority)
                .type(spec.type())
                .nextRunAt(spec.nextRunAt())
                .repeat(spec.repeat())
                .disabled(spec.disabled())
                .build();

        String id = jobStore.insert(record);
        log.debug("cronhive job created name={} id={} nextRunAt={} repeat={}",
                spec.name(), id, spec.nextRunAt(), spec.repeat());
        return PersistResult.createdResult(record.toBuilder().id(id).build());
    }

    private <T> JobRecord updateSingle(JobRecord current, JobSpec<T> spec, Map<String, Object> dataMap, int priority) {
        JobPatch.Builder patch = JobPatch.builder()
                .repeat(spec.repeat())
                .type(spec.type())
                .priority(priority)
                .data(dataMap)
                .disabled(spec.disabled());

        boolean repeatChanged = !Objects.equals(current.repeat(), spec.repeat());
        if (repeatChanged || (current.nextRunAt() == null && !spec.disabled())) {
            patch.nextRunAt(spec.nextRunAt());
        }

        JobRecord updated = jobStore.updateOne(current.id(), patch.build())
                .orElseThrow(() -> new JobNotFoundException(current.id(),
                        "Recurring job was deleted while updating: " + spec.name()));
        log.debug("cronhive job updated name={} id={} nextRunAt={} repeat={}",
                spec.name(), updated.id(), updated.nextRunAt(), updated.repeat());
        return updated;
    }

    private <T> int resolvePriority(JobSpec<T> spec) {
        if (spec.priority() != null) {
            return spec.priority();
        }
        return registry.find(spec.name())
                .map(JobDefinition::priority)
                .filter(Objects::nonNull)
                .orElse(Priority.NORMAL.value());
    }

    /**
     * Converts handler data into the stored map form. Data must serialize to a JSON object.
     */
    public Map<String, Object> toDataMap(Object data) {
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(data, MAP_TYPE);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("job data must serialize to an object: " + data.getClass().getName(), ex);
        }
    }
}
