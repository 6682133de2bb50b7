package io.cronhive.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.cronhive.core.JobField;
import io.cronhive.core.JobPatch;
import io.cronhive.core.JobQuery;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSort;
import io.cronhive.core.JobType;
import io.cronhive.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB {@link JobStore}.
 *
 * <p>Every mutation is a single-document atomic operation, which is what makes the store safe to
 * share between scheduler processes:
 * <ul>
 *   <li>{@link #updateOne}: {@code findAndModify} on {@code _id} (plus {@code lockedAt} when the patch is guarded)</li>
 *   <li>{@link #compareAndSwapLock}: {@code updateFirst} on {@code _id} and the expected {@code lockedAt}</li>
 * </ul>
 * Instants are written with millisecond precision, the precision Mongo dates keep.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String ID = "_id";
    private static final String REPEAT_INTERVAL = "repeatInterval";
    private static final String REPEAT_TIMEZONE = "repeatTimezone";

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String insert(JobRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        if (record.id() != null) {
            throw new IllegalArgumentException("record must not carry an id; the store assigns it");
        }
        if (record.name() == null || record.name().isBlank()) {
            throw new IllegalArgumentException("record name must not be blank");
        }

        JobDocument doc = toDocument(record);
        mongoTemplate.insert(doc);
        log.debug("cronhive mongo inserted name={} id={}", doc.getName(), doc.getId());
        return doc.getId();
    }

    @Override
    public List<JobRecord> findMany(JobQuery query, JobSort sort, int skip, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(sort, "sort must not be null");

        Query q = toQuery(query);
        if (!sort.isUnsorted()) {
            q.with(toSort(sort));
        }
        if (skip > 0) {
            q.skip(skip);
        }
        if (limit > 0) {
            q.limit(limit);
        }

        List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class);
        List<JobRecord> records = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            records.add(toRecord(d));
        }
        return records;
    }

    @Override
    public Optional<JobRecord> findOne(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return Optional.ofNullable(mongoTemplate.findOne(toQuery(query), JobDocument.class)).map(this::toRecord);
    }

    @Override
    public Optional<JobRecord> updateOne(String id, JobPatch patch) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(patch, "patch must not be null");

        Criteria c = Criteria.where(ID).is(id);
        if (patch.isLockGuarded()) {
            // Prevent stale write-back if the lock moved since the patch was built.
            c = c.and("lockedAt").is(millis(patch.expectedLockedAt()));
        }
        Query q = new Query(c);

        if (patch.isEmpty()) {
            return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class)).map(this::toRecord);
        }

        JobDocument updated = mongoTemplate.findAndModify(q, toUpdate(patch),
                FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        return Optional.ofNullable(updated).map(this::toRecord);
    }

    @Override
    public boolean compareAndSwapLock(String id, Instant expectedLockedAt, Instant newLockedAt) {
        Objects.requireNonNull(id, "id must not be null");

        Query q = new Query(Criteria.where(ID).is(id).and("lockedAt").is(millis(expectedLockedAt)));
        Update u = new Update();
        if (newLockedAt != null) {
            u.set("lockedAt", millis(newLockedAt));
        } else {
            u.unset("lockedAt");
        }

        UpdateResult result = mongoTemplate.updateFirst(q, u, JobDocument.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public long deleteMany(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return mongoTemplate.remove(toQuery(query), JobDocument.class).getDeletedCount();
    }

    @Override
    public long count(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return mongoTemplate.count(toQuery(query), JobDocument.class);
    }

    /**
     * Translate the API-layer query into Mongo criteria. All parts are AND-ed.
     */
    static Query toQuery(JobQuery query) {
        List<Criteria> parts = new ArrayList<>(8);

        if (query.ids() != null) {
            parts.add(Criteria.where(ID).in(query.ids()));
        }
        if (query.name() != null) {
            parts.add(Criteria.where("name").is(query.name()));
        }
        if (query.names() != null) {
            parts.add(Criteria.where("name").in(query.names()));
        }
        if (query.excludedNames() != null && !query.excludedNames().isEmpty()) {
            parts.add(Criteria.where("name").nin(query.excludedNames()));
        }
        if (query.type() != null) {
            parts.add(Criteria.where("type").is(query.type()));
        }
        if (query.disabled() != null) {
            // documents written without the flag count as enabled
            parts.add(query.disabled()
                    ? Criteria.where("disabled").is(true)
                    : Criteria.where("disabled").ne(true));
        }
        if (query.dueBy() != null) {
            parts.add(Criteria.where("nextRunAt").ne(null).lte(query.dueBy()));
        }
        if (query.scheduledAfter() != null) {
            parts.add(Criteria.where("nextRunAt").ne(null).gt(query.scheduledAfter()));
        }
        if (query.hasNextRun() != null) {
            parts.add(present("nextRunAt", query.hasNextRun()));
        }
        if (query.lockAvailableAsOf() != null) {
            parts.add(new Criteria().orOperator(
                    Criteria.where("lockedAt").is(null),
                    Criteria.where("lockedAt").lte(query.lockAvailableAsOf())
            ));
        }
        if (query.locked() != null) {
            parts.add(present("lockedAt", query.locked()));
        }
        if (query.failed() != null) {
            parts.add(present("failedAt", query.failed()));
        }
        if (query.finished() != null) {
            parts.add(present("lastFinishedAt", query.finished()));
        }
        if (query.finishedBefore() != null) {
            parts.add(Criteria.where("lastFinishedAt").ne(null).lt(query.finishedBefore()));
        }
        if (query.started() != null) {
            parts.add(present("lastRunAt", query.started()));
        }

        Query q = new Query();
        if (parts.size() == 1) {
            q.addCriteria(parts.get(0));
        } else if (parts.size() > 1) {
            q.addCriteria(new Criteria().andOperator(parts.toArray(new Criteria[0])));
        }
        return q;
    }

    static Sort toSort(JobSort sort) {
        List<Sort.Order> orders = new ArrayList<>(sort.orders().size());
        for (JobSort.Order o : sort.orders()) {
            String field = mongoField(o.field());
            orders.add(o.ascending() ? Sort.Order.asc(field) : Sort.Order.desc(field));
        }
        return Sort.by(orders);
    }

    Update toUpdate(JobPatch patch) {
        Update u = new Update();
        for (Map.Entry<JobField, Object> e : patch.changes().entrySet()) {
            JobField field = e.getKey();
            Object value = e.getValue();

            if (field == JobField.REPEAT) {
                JobRecord.Repeat repeat = (JobRecord.Repeat) value;
                if (repeat == null) {
                    u.unset(REPEAT_INTERVAL).unset(REPEAT_TIMEZONE);
                } else {
                    u.set(REPEAT_INTERVAL, repeat.interval());
                    if (repeat.timezone() != null) {
                        u.set(REPEAT_TIMEZONE, repeat.timezone());
                    } else {
                        u.unset(REPEAT_TIMEZONE);
                    }
                }
                continue;
            }

            String name = mongoField(field);
            if (value == null) {
                u.unset(name);
            } else if (value instanceof Instant instant) {
                u.set(name, millis(instant));
            } else if (field == JobField.DATA) {
                @SuppressWarnings("unchecked")
                Map<String, Object> data = (Map<String, Object>) value;
                u.set(name, toStoredData(data));
            } else {
                u.set(name, value);
            }
        }
        if (patch.failCountIncrement() != 0) {
            u.inc("failCount", patch.failCountIncrement());
        }
        return u;
    }

    private JobDocument toDocument(JobRecord r) {
        JobDocument doc = new JobDocument();
        doc.setName(r.name());
        doc.setData(toStoredData(r.data()));
        doc.setPriority(r.priority());
        doc.setType(r.type());
        doc.setNextRunAt(millis(r.nextRunAt()));
        if (r.repeat() != null) {
            doc.setRepeatInterval(r.repeat().interval());
            doc.setRepeatTimezone(r.repeat().timezone());
        }
        doc.setDisabled(r.disabled());
        doc.setLastRunAt(millis(r.lastRunAt()));
        doc.setLastFinishedAt(millis(r.lastFinishedAt()));
        doc.setFailedAt(millis(r.failedAt()));
        doc.setFailReason(r.failReason());
        doc.setFailCount(r.failCount());
        doc.setLockedAt(millis(r.lockedAt()));
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobRecord)}.
     */
    JobRecord toRecord(JobDocument doc) {
        JobRecord.Repeat repeat = isBlank(doc.getRepeatInterval())
                ? null
                : new JobRecord.Repeat(doc.getRepeatInterval(), doc.getRepeatTimezone());
        JobType type = doc.getType() != null ? doc.getType() : JobType.forRepeat(repeat);

        return JobRecord.builder(doc.getName())
                .id(doc.getId())
                .data(doc.getData())
                .priority(doc.getPriority())
                .type(type)
                .nextRunAt(doc.getNextRunAt())
                .repeat(repeat)
                .disabled(doc.isDisabled())
                .lastRunAt(doc.getLastRunAt())
                .lastFinishedAt(doc.getLastFinishedAt())
                .failedAt(doc.getFailedAt())
                .failReason(doc.getFailReason())
                .failCount(doc.getFailCount())
                .lockedAt(doc.getLockedAt())
                .build();
    }

    // Stored as its JSON form so any value the handler data holds can be encoded.
    private Map<String, Object> toStoredData(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        return objectMapper.convertValue(data, MAP_TYPE);
    }

    private static Criteria present(String field, boolean present) {
        return present ? Criteria.where(field).ne(null) : Criteria.where(field).is(null);
    }

    private static String mongoField(JobField field) {
        return field == JobField.ID ? ID : field.fieldName();
    }

    private static Instant millis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
