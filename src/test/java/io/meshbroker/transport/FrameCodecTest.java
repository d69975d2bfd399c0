package io.meshbroker.transport;

import io.meshbroker.model.FrameType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class FrameCodecTest {

    @Test
    void encodesEventNameAndData() {
        String text = FrameCodec.encode(FrameType.MESSAGE_QUEUED, Map.of("messageId", "m-1"));
        InboundFrame frame = FrameCodec.decode(text);

        Assertions.assertEquals("message_queued", frame.event());
        Assertions.assertEquals("m-1", frame.data().path("messageId").asText());
    }

    @Test
    void missingDataDecodesAsJsonNull() {
        InboundFrame frame = FrameCodec.decode("{\"event\":\"register\"}");
        Assertions.assertEquals("register", frame.event());
        Assertions.assertTrue(frame.data().isNull());
    }

    @Test
    void rejectsFramesWithoutTextualEvent() {
        Assertions.assertThrows(FrameFormatException.class, () -> FrameCodec.decode("not json"));
        Assertions.assertThrows(FrameFormatException.class, () -> FrameCodec.decode("[1,2]"));
        Assertions.assertThrows(FrameFormatException.class, () -> FrameCodec.decode("{\"event\":42}"));
        Assertions.assertThrows(FrameFormatException.class, () -> FrameCodec.decode("  "));
    }
}
