package io.meshbroker.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of a {@code task_result} frame sent by the assigned node. A non-blank
 * {@code error} marks the task failed.
 */
public record TaskResult(
        String taskId,
        JsonNode result,
        String error
) {
    public boolean failed() {
        return error != null && !error.isBlank();
    }
}
