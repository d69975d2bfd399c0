package io.meshbroker.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Write-once envelope. The broker forwards or queues it, never mutates it.
 */
public record Message(
        String id,
        String from,
        String to,
        String type,
        JsonNode payload,
        String timestamp
) {
}
