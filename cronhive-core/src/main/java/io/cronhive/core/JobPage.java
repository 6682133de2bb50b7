package io.cronhive.core;

import java.util.List;

/**
 * One page of a job listing.
 *
 * @param page  1-based page number
 * @param total number of records matching the query, across all pages
 */
public record JobPage(
        List<JobRecord> data,
        long total,
        int page,
        int limit,
        long totalPages
) {
    public JobPage {
        data = List.copyOf(data);
    }

    public static JobPage of(List<JobRecord> data, long total, int page, int limit) {
        long totalPages = (total + limit - 1) / limit;
        return new JobPage(data, total, page, limit, totalPages);
    }
}
