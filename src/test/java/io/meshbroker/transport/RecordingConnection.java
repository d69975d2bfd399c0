package io.meshbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.model.FrameType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory {@link NodeConnection} that decodes and keeps every frame written to it.
 */
public final class RecordingConnection implements NodeConnection {
    private final String id;
    private final List<InboundFrame> frames = new ArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failWrites = false;

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void send(String text) throws IOException {
        if (failWrites) {
            throw new IOException("simulated write failure");
        }
        frames.add(FrameCodec.decode(text));
        notifyAll();
    }

    @Override
    public void close(int code, String reason) {
        open = false;
    }

    /**
     * Marks the socket closed without telling the broker, as a dropped peer would.
     */
    public void drop() {
        open = false;
    }

    public void failWrites() {
        failWrites = true;
    }

    public synchronized List<InboundFrame> frames() {
        return List.copyOf(frames);
    }

    public synchronized List<JsonNode> dataOf(FrameType type) {
        List<JsonNode> out = new ArrayList<>();
        for (InboundFrame frame : frames) {
            if (frame.event().equals(type.wireName())) {
                out.add(frame.data());
            }
        }
        return out;
    }

    public int count(FrameType type) {
        return dataOf(type).size();
    }

    public Optional<JsonNode> last(FrameType type) {
        List<JsonNode> all = dataOf(type);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public synchronized void clear() {
        frames.clear();
    }

    /**
     * Blocks until a frame of {@code type} arrives or the timeout passes.
     */
    public synchronized Optional<JsonNode> await(FrameType type, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            for (InboundFrame frame : frames) {
                if (frame.event().equals(type.wireName())) {
                    return Optional.of(frame.data());
                }
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0L) {
                return Optional.empty();
            }
            wait(remaining);
        }
    }
}
