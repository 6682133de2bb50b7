package io.cronhive.core;

import java.time.Instant;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec<T>(

        // identity
        String name,
        JobType type,

        // scheduling
        Instant nextRunAt,
        JobRecord.Repeat repeat,
        boolean disabled,

        // execution metadata
        Integer priority,

        // payload
        T data,

        // one recurring job per name (upsert instead of insert)
        boolean single
) {
}
