package io.meshbroker.transport;

import java.io.IOException;

/**
 * One live transport connection. Implementations must not block the caller on a slow peer.
 */
public interface NodeConnection {
    String id();

    boolean isOpen();

    void send(String text) throws IOException;

    void close(int code, String reason);
}
