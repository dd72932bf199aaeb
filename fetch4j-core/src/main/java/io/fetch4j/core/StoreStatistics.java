package io.fetch4j.core;

import java.util.Map;

/**
 * Aggregate counters over the persisted results and jobs.
 */
public record StoreStatistics(
        long totalRecords,
        Map<String, Long> statusCounts,
        Map<String, Long> strategyCounts,
        long activeJobs
) {
    public StoreStatistics {
        statusCounts = statusCounts == null ? Map.of() : Map.copyOf(statusCounts);
        strategyCounts = strategyCounts == null ? Map.of() : Map.copyOf(strategyCounts);
    }
}
