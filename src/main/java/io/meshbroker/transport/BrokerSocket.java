package io.meshbroker.transport;

import io.meshbroker.runtime.MeshBroker;
import io.meshbroker.util.Ids;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketConnect;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One instance per node connection. The connection id is generated here, at the transport.
 */
@WebSocket
public final class BrokerSocket {
    private static final Logger log = LoggerFactory.getLogger(BrokerSocket.class);

    private final MeshBroker broker;
    private final String connectionId;

    public BrokerSocket(MeshBroker broker) {
        this.broker = broker;
        this.connectionId = Ids.connectionId();
    }

    @OnWebSocketConnect
    public void onConnect(Session session) {
        log.info("Node connected: {} from {}", connectionId, session.getRemoteAddress());
        broker.onOpen(new JettyNodeConnection(connectionId, session));
    }

    @OnWebSocketMessage
    public void onMessage(Session session, String text) {
        broker.onFrame(connectionId, text);
    }

    @OnWebSocketClose
    public void onClose(Session session, int statusCode, String reason) {
        log.debug("Connection {} closed: {} {}", connectionId, statusCode, reason);
        broker.onClose(connectionId);
    }

    @OnWebSocketError
    public void onError(Session session, Throwable error) {
        log.warn("WebSocket error on {}: {}", connectionId, error.getMessage());
    }

    String connectionId() {
        return connectionId;
    }
}
