package io.meshbroker.dispatch;

import io.meshbroker.model.TaskState;

/**
 * What happened to a {@code task_result} frame. {@code accepted} is false for unknown,
 * expired or foreign task ids, in which case {@code state} is null.
 */
public record ResultOutcome(
        String taskId,
        boolean accepted,
        TaskState state,
        String error
) {
}
