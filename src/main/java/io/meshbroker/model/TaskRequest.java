package io.meshbroker.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskRequest(
        String capability,
        JsonNode payload,
        String priority,
        Long timeoutMs
) {
}
