package io.cronhive.core;

import java.util.function.Function;

/**
 * Persisted fields of a {@link JobRecord}, addressable by sorts and patches.
 *
 * <p>{@link #fieldName()} is the stored field name; stores translate it as-is.
 */
public enum JobField {
    ID("id", JobRecord::id, false),
    NAME("name", JobRecord::name, true),
    DATA("data", null, true),
    PRIORITY("priority", JobRecord::priority, true),
    TYPE("type", JobRecord::type, true),
    NEXT_RUN_AT("nextRunAt", JobRecord::nextRunAt, true),
    REPEAT("repeat", null, true),
    DISABLED("disabled", JobRecord::disabled, true),
    LAST_RUN_AT("lastRunAt", JobRecord::lastRunAt, true),
    LAST_FINISHED_AT("lastFinishedAt", JobRecord::lastFinishedAt, true),
    FAILED_AT("failedAt", JobRecord::failedAt, true),
    FAIL_REASON("failReason", JobRecord::failReason, true),
    FAIL_COUNT("failCount", JobRecord::failCount, true),
    LOCKED_AT("lockedAt", JobRecord::lockedAt, false);

    private final String fieldName;
    private final Function<JobRecord, ? extends Comparable<?>> sortKey;
    private final boolean patchable;

    JobField(String fieldName, Function<JobRecord, ? extends Comparable<?>> sortKey, boolean patchable) {
        this.fieldName = fieldName;
        this.sortKey = sortKey;
        this.patchable = patchable;
    }

    public String fieldName() {
        return fieldName;
    }

    public boolean isSortable() {
        return sortKey != null;
    }

    /**
     * Whether {@link JobPatch} may write this field. The id is immutable and the lock only moves
     * through {@code JobStore#compareAndSwapLock}.
     */
    public boolean isPatchable() {
        return patchable;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public Comparable<Object> sortKey(JobRecord record) {
        if (sortKey == null) {
            throw new IllegalArgumentException("Field is not sortable: " + fieldName);
        }
        return (Comparable) sortKey.apply(record);
    }

    public static JobField fromFieldName(String fieldName) {
        for (JobField f : values()) {
            if (f.fieldName.equals(fieldName)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown job field: " + fieldName);
    }
}
