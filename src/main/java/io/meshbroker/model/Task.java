package io.meshbroker.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Assignment sent to the selected node in a {@code task_assigned} frame.
 */
public record Task(
        String taskId,
        String capability,
        JsonNode payload,
        String priority,
        long timeoutMs,
        String from,
        String timestamp
) {
}
