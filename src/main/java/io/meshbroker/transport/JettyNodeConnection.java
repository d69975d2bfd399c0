package io.meshbroker.transport;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WriteCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JettyNodeConnection implements NodeConnection {
    private static final Logger log = LoggerFactory.getLogger(JettyNodeConnection.class);

    private final String id;
    private final Session session;

    JettyNodeConnection(String id, Session session) {
        this.id = id;
        this.session = session;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Queues the write on Jetty's async path; the outcome is only logged.
     */
    @Override
    public void send(String text) {
        session.getRemote().sendString(text, new WriteCallback() {
            @Override
            public void writeFailed(Throwable x) {
                log.warn("Async write to {} failed: {}", id, x.getMessage());
            }

            @Override
            public void writeSuccess() {
            }
        });
    }

    @Override
    public void close(int code, String reason) {
        if (session.isOpen()) {
            session.close(code, reason);
        }
    }
}
