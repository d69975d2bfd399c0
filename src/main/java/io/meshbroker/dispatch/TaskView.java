package io.meshbroker.dispatch;

import io.meshbroker.model.TaskState;

public record TaskView(
        String taskId,
        String capability,
        String priority,
        String requester,
        String assignedTo,
        TaskState state,
        long dispatchedAtMs,
        long timeoutMs
) {
}
