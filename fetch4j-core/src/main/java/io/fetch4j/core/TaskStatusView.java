package io.fetch4j.core;

import java.util.Locale;

/**
 * Read-only answer to a task status poll.
 *
 * <p>{@code result} is only present once {@code ready} is true. {@code statusText} is {@code "success"} or starts
 * with {@code "error: "} for finished tasks, and the lower-case status name otherwise.
 */
public record TaskStatusView(
        String taskId,
        TaskStatus status,
        boolean ready,
        TaskResult result,
        String statusText
) {

    public static TaskStatusView of(Task task) {
        TaskStatus status = task.status();
        if (!status.isTerminal()) {
            return new TaskStatusView(task.id(), status, false, null, status.name().toLowerCase(Locale.ROOT));
        }
        TaskResult result = task.result();
        return new TaskStatusView(task.id(), status, true, result, statusText(task, result));
    }

    public static TaskStatusView unknown(String taskId) {
        return new TaskStatusView(taskId, TaskStatus.FAILED, true, TaskResult.empty(),
                ResultRecord.ERROR_PREFIX + "unknown task " + taskId);
    }

    private static String statusText(Task task, TaskResult result) {
        if (task.status() == TaskStatus.SUCCEEDED) {
            return ResultRecord.STATUS_SUCCESS;
        }
        if (task.error() != null) {
            return ResultRecord.ERROR_PREFIX + task.error();
        }
        for (ResultRecord r : result.records()) {
            if (!r.isSuccess()) {
                return r.statusText();
            }
        }
        return ResultRecord.ERROR_PREFIX + "failed";
    }
}
