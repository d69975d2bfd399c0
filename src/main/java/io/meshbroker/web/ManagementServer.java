package io.meshbroker.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.meshbroker.runtime.MeshBroker;
import io.meshbroker.store.StoreException;
import io.meshbroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * REST projections over the broker registries and stores.
 *
 * <ul>
 *   <li>{@code GET /health}</li>
 *   <li>{@code GET /api/nodes}</li>
 *   <li>{@code GET /api/capabilities}</li>
 *   <li>{@code GET /api/tasks}</li>
 *   <li>{@code POST /api/broadcast}</li>
 *   <li>{@code GET /api/messages/{nodeId}[?drain=true]}</li>
 *   <li>{@code GET /api/audit[?limit=N]}</li>
 *   <li>{@code GET /metrics}</li>
 * </ul>
 */
public final class ManagementServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ManagementServer.class);
    private static final String MESSAGES_PREFIX = "/api/messages/";
    private static final int DEFAULT_AUDIT_LIMIT = 100;
    static final int MAX_BODY_BYTES = 1024 * 1024;

    private final MeshBroker broker;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    public ManagementServer(MeshBroker broker, int port) {
        this.broker = broker;
        this.port = port;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", exchange -> handle(exchange, "GET", () -> json(exchange, 200, broker.health())));
        server.createContext("/api/nodes", exchange -> handle(exchange, "GET", () -> json(exchange, 200, broker.nodes())));
        server.createContext("/api/capabilities", exchange -> handle(exchange, "GET", () -> json(exchange, 200, broker.capabilities())));
        server.createContext("/api/tasks", exchange -> handle(exchange, "GET", () -> json(exchange, 200, broker.tasks())));
        server.createContext("/api/broadcast", exchange -> handle(exchange, "POST", () -> broadcast(exchange)));
        server.createContext(MESSAGES_PREFIX, exchange -> handle(exchange, "GET", () -> queuedMessages(exchange)));
        server.createContext("/api/audit", exchange -> handle(exchange, "GET", () -> audit(exchange)));
        server.createContext("/metrics", exchange -> handle(exchange, "GET", () -> metrics(exchange)));
        server.createContext("/", exchange -> handle(exchange, null, () -> error(exchange, 404, "not found")));
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "meshbroker-http-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);
        server.start();
        log.info("Management API: http://0.0.0.0:{}/api", localPort());
    }

    public int localPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
    }

    private void broadcast(HttpExchange exchange) throws IOException {
        String raw = readBody(exchange);
        if (raw == null) {
            error(exchange, 413, "request body too large");
            return;
        }
        JsonNode body;
        try {
            body = Jsons.readTree(raw);
        } catch (JsonProcessingException e) {
            error(exchange, 400, "invalid JSON body: " + e.getOriginalMessage());
            return;
        }
        if (body == null || body.isMissingNode()) {
            error(exchange, 400, "broadcast body is required");
            return;
        }
        int delivered = broker.broadcast(body);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "broadcast_sent");
        out.put("delivered", delivered);
        out.put("timestamp", Instant.now().toString());
        json(exchange, 200, out);
    }

    private void queuedMessages(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String nodeId = URLDecoder.decode(path.substring(MESSAGES_PREFIX.length()), StandardCharsets.UTF_8);
        if (nodeId.isBlank() || nodeId.contains("/")) {
            error(exchange, 404, "not found");
            return;
        }
        boolean drain = "true".equalsIgnoreCase(queryParam(exchange, "drain"));
        json(exchange, 200, broker.queuedMessages(nodeId, drain));
    }

    private void audit(HttpExchange exchange) throws IOException {
        String raw = queryParam(exchange, "limit");
        int limit = DEFAULT_AUDIT_LIMIT;
        if (raw != null) {
            try {
                limit = Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                error(exchange, 400, "limit must be an integer");
                return;
            }
        }
        json(exchange, 200, broker.auditRecent(limit));
    }

    private void metrics(HttpExchange exchange) throws IOException {
        byte[] bytes = broker.metricsText().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void handle(HttpExchange exchange, String method, ExchangeAction action) throws IOException {
        try {
            if (method != null && !method.equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", method);
                error(exchange, 405, "method not allowed");
                return;
            }
            action.run();
        } catch (StoreException e) {
            log.warn("Store failure serving {}: {}", exchange.getRequestURI(), e.getMessage());
            error(exchange, 500, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled failure serving {}", exchange.getRequestURI(), e);
            error(exchange, 500, "internal error");
        } finally {
            exchange.close();
        }
    }

    private static void json(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void error(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        json(exchange, status, body);
    }

    /**
     * The request body as UTF-8, or {@code null} when it exceeds {@link #MAX_BODY_BYTES}.
     */
    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
            if (bytes.length > MAX_BODY_BYTES) {
                return null;
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface ExchangeAction {
        void run() throws IOException;
    }
}
