package io.meshbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;

public record InboundFrame(String event, JsonNode data) {
}
