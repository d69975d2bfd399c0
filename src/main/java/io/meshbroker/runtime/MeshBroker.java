package io.meshbroker.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.config.BrokerConfig;
import io.meshbroker.config.BrokerSettings;
import io.meshbroker.config.CapabilityFramePolicy;
import io.meshbroker.dispatch.DispatchOutcome;
import io.meshbroker.dispatch.NodeSelector;
import io.meshbroker.dispatch.RandomNodeSelector;
import io.meshbroker.dispatch.ResultOutcome;
import io.meshbroker.dispatch.TaskDispatcher;
import io.meshbroker.dispatch.TaskView;
import io.meshbroker.model.FrameType;
import io.meshbroker.model.MessageRequest;
import io.meshbroker.model.Node;
import io.meshbroker.model.QueuedMessage;
import io.meshbroker.model.RegistrationInfo;
import io.meshbroker.model.TaskRequest;
import io.meshbroker.model.TaskResult;
import io.meshbroker.observability.AuditTrail;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.observability.PrometheusFormatter;
import io.meshbroker.queue.OfflineQueue;
import io.meshbroker.registry.CapabilityIndex;
import io.meshbroker.registry.ConnectionRegistry;
import io.meshbroker.registry.DuplicateRegistrationException;
import io.meshbroker.registry.NetworkStatus;
import io.meshbroker.registry.Registration;
import io.meshbroker.registry.UnknownConnectionException;
import io.meshbroker.routing.MessageRouter;
import io.meshbroker.routing.RouteOutcome;
import io.meshbroker.store.BrokerStore;
import io.meshbroker.store.InMemoryBrokerStore;
import io.meshbroker.store.RetryingBrokerStore;
import io.meshbroker.store.SqliteBrokerStore;
import io.meshbroker.store.StoreLane;
import io.meshbroker.transport.FrameCodec;
import io.meshbroker.transport.FrameFormatException;
import io.meshbroker.transport.FrameSender;
import io.meshbroker.transport.InboundFrame;
import io.meshbroker.transport.NodeConnection;
import io.meshbroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the registries, router, dispatcher and offline queue, and turns inbound
 * transport frames into calls on them. Transports call {@link #onOpen},
 * {@link #onFrame} and {@link #onClose}; the management API reads the projections.
 */
public final class MeshBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MeshBroker.class);

    private final BrokerSettings settings;
    private final BrokerStore store;
    private final StoreLane storeLane;
    private final Clock clock;
    private final BrokerStats stats;
    private final CapabilityIndex capabilityIndex;
    private final ConnectionRegistry registry;
    private final OfflineQueue offlineQueue;
    private final AuditTrail auditTrail;
    private final MessageRouter router;
    private final TaskDispatcher dispatcher;
    private final ScheduledExecutorService timers;
    private final long startedAtMs;

    public MeshBroker(BrokerSettings settings, BrokerStore store, NodeSelector selector, Clock clock) {
        this.settings = settings;
        this.store = store;
        this.clock = clock;
        this.stats = new BrokerStats();
        this.capabilityIndex = new CapabilityIndex();
        this.registry = new ConnectionRegistry(
                capabilityIndex,
                new FrameSender(stats),
                stats,
                clock,
                settings.registrationPolicy()
        );
        this.storeLane = new StoreLane(store);
        this.offlineQueue = new OfflineQueue(storeLane, stats, clock);
        this.auditTrail = new AuditTrail(storeLane, stats, clock, settings.auditMaxEntries());
        this.router = new MessageRouter(registry, capabilityIndex, offlineQueue, auditTrail, stats, clock);
        this.timers = Executors.newSingleThreadScheduledExecutor(timerThreads());
        this.dispatcher = new TaskDispatcher(
                registry,
                capabilityIndex,
                selector,
                timers,
                stats,
                clock,
                settings.defaultTaskTimeoutMs()
        );
        this.startedAtMs = clock.millis();
    }

    /**
     * Broker on the SQLite store under {@code config}, with retries and random selection.
     */
    public static MeshBroker open(BrokerConfig config, BrokerSettings settings) {
        BrokerStore store = new RetryingBrokerStore(
                new SqliteBrokerStore(config),
                settings.storeMaxAttempts(),
                settings.storeRetryDelayMs()
        );
        return new MeshBroker(settings, store, new RandomNodeSelector(), Clock.systemUTC());
    }

    /**
     * Broker that keeps its queue and audit trail in memory only; nothing survives a restart.
     */
    public static MeshBroker ephemeral(BrokerSettings settings) {
        return new MeshBroker(settings, new InMemoryBrokerStore(), new RandomNodeSelector(), Clock.systemUTC());
    }

    public void init() {
        storeLane.call(s -> {
            s.init();
            return null;
        });
        log.info("Broker store ready (registration={}, capabilityFrames={}, defaultTaskTimeoutMs={})",
                settings.registrationPolicy(), settings.capabilityFramePolicy(), settings.defaultTaskTimeoutMs());
    }

    // ---- transport callbacks ----

    public void onOpen(NodeConnection connection) {
        registry.open(connection);
    }

    public void onClose(String connectionId) {
        registry.evict(connectionId);
    }

    public void onFrame(String connectionId, String text) {
        InboundFrame frame;
        try {
            frame = FrameCodec.decode(text);
        } catch (FrameFormatException e) {
            stats.malformedFrame();
            replyError(connectionId, null, "malformed_frame", e.getMessage());
            return;
        }
        handle(connectionId, frame);
    }

    void handle(String connectionId, InboundFrame frame) {
        Optional<FrameType> type = FrameType.fromWire(frame.event());
        if (type.isEmpty()) {
            stats.malformedFrame();
            replyError(connectionId, frame.event(), "unsupported_event", "Unsupported event: " + frame.event());
            return;
        }
        registry.touch(connectionId);
        try {
            switch (type.get()) {
                case REGISTER -> register(connectionId, frame.data());
                case CAPABILITIES -> updateCapabilities(connectionId, frame.data());
                case MESSAGE -> route(connectionId, frame.data());
                case TASK -> dispatch(connectionId, frame.data());
                case TASK_RESULT -> completeTask(connectionId, frame.data());
                default -> {
                    stats.malformedFrame();
                    replyError(connectionId, frame.event(), "unsupported_event",
                            "Event is broker-to-node only: " + frame.event());
                }
            }
        } catch (DuplicateRegistrationException e) {
            replyError(connectionId, frame.event(), "duplicate_registration", e.getMessage());
        } catch (UnknownConnectionException e) {
            log.debug("Frame {} from closed connection {}", frame.event(), connectionId);
        } catch (FrameFormatException | IllegalArgumentException e) {
            stats.malformedFrame();
            replyError(connectionId, frame.event(), "malformed_frame", e.getMessage());
        }
    }

    // ---- operations ----

    public Registration register(String connectionId, JsonNode data) {
        RegistrationInfo info = data == null || data.isNull()
                ? new RegistrationInfo(null, null, List.of())
                : Jsons.convert(data, RegistrationInfo.class);
        return registry.register(connectionId, info);
    }

    public boolean updateCapabilities(String connectionId, JsonNode data) {
        List<String> capabilities = capabilityList(data);
        boolean applied = registry.updateCapabilities(connectionId, capabilities);
        if (!applied) {
            if (settings.capabilityFramePolicy() == CapabilityFramePolicy.REJECT_UNREGISTERED) {
                replyError(connectionId, FrameType.CAPABILITIES.wireName(), "not_registered",
                        "Send register before capabilities");
            } else {
                log.debug("Ignoring capabilities from unregistered connection {}", connectionId);
            }
        }
        return applied;
    }

    public RouteOutcome route(String connectionId, JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new FrameFormatException("message frame data must be an object");
        }
        MessageRequest request = new MessageRequest(
                textOrNull(data, "to"),
                textOrNull(data, "type"),
                data.get("payload"),
                textOrNull(data, "messageId")
        );
        return router.route(connectionId, request);
    }

    public DispatchOutcome dispatch(String connectionId, JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new FrameFormatException("task frame data must be an object");
        }
        JsonNode timeout = data.has("timeoutMs") ? data.get("timeoutMs") : data.get("timeout");
        TaskRequest request = new TaskRequest(
                textOrNull(data, "capability"),
                data.get("payload"),
                textOrNull(data, "priority"),
                timeout != null && timeout.canConvertToLong() ? timeout.asLong() : null
        );
        return dispatcher.dispatch(connectionId, request);
    }

    public ResultOutcome completeTask(String connectionId, JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new FrameFormatException("task_result frame data must be an object");
        }
        TaskResult result = new TaskResult(textOrNull(data, "taskId"), data.get("result"), textOrNull(data, "error"));
        ResultOutcome outcome = dispatcher.complete(connectionId, result);
        if (!outcome.accepted()) {
            replyError(connectionId, FrameType.TASK_RESULT.wireName(), "task_not_in_flight", outcome.error());
        }
        return outcome;
    }

    // ---- management projections ----

    public NetworkStatus nodes() {
        return registry.networkStatus();
    }

    public Map<String, Object> capabilities() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Node node : registry.nodes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("node", node.name());
            entry.put("capabilities", capabilityIndex.capabilitiesOf(node.nodeId()));
            out.put(node.nodeId(), entry);
        }
        return out;
    }

    public int broadcast(JsonNode body) {
        return router.broadcastSystem(body);
    }

    public List<QueuedMessage> queuedMessages(String nodeId, boolean drain) {
        return offlineQueue.read(nodeId, drain);
    }

    public List<JsonNode> auditRecent(int limit) {
        return auditTrail.recent(limit);
    }

    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "healthy");
        out.put("nodes", registry.nodeCount());
        out.put("uptimeMs", clock.millis() - startedAtMs);
        out.put("timestamp", Instant.now(clock).toString());
        return out;
    }

    public List<TaskView> tasks() {
        return dispatcher.inFlightTasks();
    }

    public BrokerStats.Snapshot stats() {
        return stats.snapshot(
                registry.nodeCount(),
                registry.pendingCount(),
                dispatcher.inFlightCount(),
                capabilityIndex.capabilityCount()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public CapabilityIndex capabilityIndex() {
        return capabilityIndex;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public OfflineQueue offlineQueue() {
        return offlineQueue;
    }

    public BrokerSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        timers.shutdownNow();
        for (NodeConnection connection : registry.openConnections()) {
            connection.close(1001, "broker shutting down");
        }
        storeLane.close();
        store.close();
        log.info("Broker stopped");
    }

    private void replyError(String connectionId, String event, String code, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event);
        body.put("code", code);
        body.put("error", error);
        registry.reply(connectionId, FrameType.ERROR, body);
    }

    private static List<String> capabilityList(JsonNode data) {
        JsonNode array = data != null && data.isObject() ? data.get("capabilities") : data;
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new FrameFormatException("capabilities must be an array of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new FrameFormatException("capabilities must be an array of strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode value = data.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static ThreadFactory timerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "meshbroker-task-timer-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
