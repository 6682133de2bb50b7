package io.cronhive.config;

import io.cronhive.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;
import java.util.Objects;

/**
 * MongoDB index definitions for the cronhive job collection.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code cronhive.ensure-indexes-on-startup=true}. In production they are usually managed by
 * DB migrations / ops scripts.
 *
 * <h3>Indexes (collection: {@code scheduled_jobs})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { nextRunAt: 1, lockedAt: 1, priority: -1 }
 *       <br/>Used by the poller: due, claimable jobs in priority order.</li>
 *   <li><b>idx_name_type</b>: { name: 1, type: 1 }
 *       <br/>Used by recurring-job upsert and name filters.</li>
 *   <li><b>idx_last_finished</b>: { lastFinishedAt: 1 }
 *       <br/>Used by purge and the completed/failed stats.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ nextRunAt: 1, lockedAt: 1, priority: -1 }, { name: "idx_due_claim" });
 * db.scheduled_jobs.createIndex({ name: 1, type: 1 }, { name: "idx_name_type" });
 * db.scheduled_jobs.createIndex({ lastFinishedAt: 1 }, { name: "idx_last_finished" });
 * </pre>
 */
public class CronhiveMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_NAME_TYPE = "idx_name_type";
    public static final String IDX_LAST_FINISHED = "idx_last_finished";

    private final MongoTemplate mongoTemplate;

    public CronhiveMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes above. Existing indexes with the same definition are left as they are.
     */
    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        for (Index index : indexes()) {
            ops.ensureIndex(index);
        }
    }

    public static List<Index> indexes() {
        return List.of(dueClaimIndex(), nameTypeIndex(), lastFinishedIndex());
    }

    /**
     * Keys: nextRunAt ASC, lockedAt ASC, priority DESC
     */
    public static Index dueClaimIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockedAt", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .named(IDX_DUE_CLAIM);
    }

    /**
     * Keys: name ASC, type ASC
     */
    public static Index nameTypeIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .on("type", Sort.Direction.ASC)
                .named(IDX_NAME_TYPE);
    }

    public static Index lastFinishedIndex() {
        return new Index()
                .on("lastFinishedAt", Sort.Direction.ASC)
                .named(IDX_LAST_FINISHED);
    }
}
