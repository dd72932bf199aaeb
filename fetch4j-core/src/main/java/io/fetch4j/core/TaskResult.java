package io.fetch4j.core;

import java.util.List;

/**
 * Per-target records of a task plus success/failure counts.
 */
public record TaskResult(
        List<ResultRecord> records,
        int successful,
        int failed
) {
    public TaskResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static TaskResult empty() {
        return new TaskResult(List.of(), 0, 0);
    }

    public static TaskResult of(List<ResultRecord> records) {
        int ok = 0;
        for (ResultRecord r : records) {
            if (r.isSuccess()) {
                ok++;
            }
        }
        return new TaskResult(records, ok, records.size() - ok);
    }

    public int total() {
        return successful + failed;
    }
}
