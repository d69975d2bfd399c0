package io.meshbroker.transport;

import io.meshbroker.runtime.MeshBroker;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.websocket.server.config.JettyWebSocketServletContainerInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Embedded Jetty server exposing the node endpoint at {@code ws://host:port<path>}.
 */
public final class WebSocketTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final MeshBroker broker;
    private final int port;
    private final String path;
    private final int maxFrameBytes;
    private Server server;
    private ServerConnector connector;

    public WebSocketTransport(MeshBroker broker, int port, String path, int maxFrameBytes) {
        this.broker = broker;
        this.port = port;
        this.path = path;
        this.maxFrameBytes = maxFrameBytes;
    }

    public synchronized void start() throws Exception {
        if (server != null && server.isRunning()) {
            return;
        }
        server = new Server();
        connector = new ServerConnector(server);
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        JettyWebSocketServletContainerInitializer.configure(context, (servletContext, container) -> {
            container.setMaxTextMessageSize(maxFrameBytes);
            container.setIdleTimeout(Duration.ofMinutes(10));
            container.addMapping(path, (request, response) -> new BrokerSocket(broker));
        });
        server.setHandler(context);
        server.start();
        log.info("WebSocket endpoint: ws://0.0.0.0:{}{}", localPort(), path);
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int localPort() {
        return connector == null ? port : connector.getLocalPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        try {
            server.stop();
        } catch (Exception e) {
            log.warn("Failed to stop WebSocket server cleanly: {}", e.getMessage());
        } finally {
            server = null;
        }
    }
}
