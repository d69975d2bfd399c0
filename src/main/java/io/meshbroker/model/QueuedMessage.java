package io.meshbroker.model;

public record QueuedMessage(
        String nodeId,
        Message message,
        long queuedAtMs
) {
}
