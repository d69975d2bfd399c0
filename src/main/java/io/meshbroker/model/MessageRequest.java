package io.meshbroker.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of an inbound {@code message} frame.
 */
public record MessageRequest(
        String to,
        String type,
        JsonNode payload,
        String messageId
) {
}
