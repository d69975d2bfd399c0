package io.meshbroker.transport;

import io.meshbroker.model.FrameType;
import io.meshbroker.observability.BrokerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes frames to connections. Failures are logged and counted, never thrown:
 * one unreachable peer must not stall routing for the others.
 */
public final class FrameSender {
    private static final Logger log = LoggerFactory.getLogger(FrameSender.class);

    private final BrokerStats stats;

    public FrameSender(BrokerStats stats) {
        this.stats = stats;
    }

    public boolean send(NodeConnection connection, FrameType type, Object data) {
        if (connection == null) {
            return false;
        }
        if (!connection.isOpen()) {
            log.debug("Dropping {} frame for closed connection {}", type.wireName(), connection.id());
            stats.sendFailure();
            return false;
        }
        try {
            connection.send(FrameCodec.encode(type, data));
            return true;
        } catch (Exception e) {
            stats.sendFailure();
            log.warn("Failed to send {} frame to {}: {}", type.wireName(), connection.id(), e.getMessage());
            return false;
        }
    }
}
