package io.cronhive.core;

public record PersistResult(
        JobRecord job,
        boolean created
) {
    public static PersistResult createdResult(JobRecord job) {
        return new PersistResult(job, true);
    }

    public static PersistResult updatedResult(JobRecord job) {
        return new PersistResult(job, false);
    }

    public boolean updated() {
        return !created;
    }
}
