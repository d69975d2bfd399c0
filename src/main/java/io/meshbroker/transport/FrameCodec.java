package io.meshbroker.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshbroker.model.FrameType;
import io.meshbroker.util.Jsons;

/**
 * Wire format: one JSON object per text frame, {@code {"event": "<name>", "data": <any>}}.
 */
public final class FrameCodec {
    private FrameCodec() {
    }

    public static String encode(FrameType type, Object data) {
        ObjectNode frame = JsonNodeFactory.instance.objectNode();
        frame.put("event", type.wireName());
        frame.set("data", data == null ? NullNode.getInstance() : Jsons.valueToTree(data));
        return Jsons.toCompactJson(frame);
    }

    public static InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            throw new FrameFormatException("empty frame");
        }
        JsonNode root;
        try {
            root = Jsons.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameFormatException("frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameFormatException("frame must be a JSON object");
        }
        JsonNode event = root.get("event");
        if (event == null || !event.isTextual() || event.asText().isBlank()) {
            throw new FrameFormatException("frame is missing a textual 'event'");
        }
        JsonNode data = root.get("data");
        return new InboundFrame(event.asText(), data == null ? NullNode.getInstance() : data);
    }
}
