package io.meshbroker.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.model.FrameType;
import io.meshbroker.model.Message;
import io.meshbroker.model.MessageRequest;
import io.meshbroker.observability.AuditTrail;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.queue.OfflineQueue;
import io.meshbroker.registry.CapabilityIndex;
import io.meshbroker.registry.ConnectionRegistry;
import io.meshbroker.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves message destinations and delivers fire-and-forget. Unconnected direct
 * targets, known or not, go to the offline queue. Every routed message is audited,
 * whatever happened to delivery. Queue and audit writes are handed off, so routing
 * never waits on the store.
 */
public final class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final ConnectionRegistry registry;
    private final CapabilityIndex capabilityIndex;
    private final OfflineQueue offlineQueue;
    private final AuditTrail auditTrail;
    private final BrokerStats stats;
    private final Clock clock;

    public MessageRouter(
            ConnectionRegistry registry,
            CapabilityIndex capabilityIndex,
            OfflineQueue offlineQueue,
            AuditTrail auditTrail,
            BrokerStats stats,
            Clock clock
    ) {
        this.registry = registry;
        this.capabilityIndex = capabilityIndex;
        this.offlineQueue = offlineQueue;
        this.auditTrail = auditTrail;
        this.stats = stats;
        this.clock = clock;
    }

    public RouteOutcome route(String fromConnectionId, MessageRequest request) {
        String messageId = request.messageId() == null || request.messageId().isBlank()
                ? Ids.messageId()
                : request.messageId();
        Message message = new Message(
                messageId,
                fromConnectionId,
                request.to(),
                request.type(),
                request.payload(),
                Instant.now(clock).toString()
        );
        Destination destination = Destination.parse(request.to());
        log.debug("Routing message {}: {} -> {}", messageId, fromConnectionId,
                destination.kind() == Destination.Kind.BROADCAST ? "broadcast" : request.to());

        RouteOutcome outcome = new RouteOutcome(message, destination, 0, false);
        try {
            outcome = switch (destination.kind()) {
                case BROADCAST -> routeBroadcast(message, destination);
                case CAPABILITY -> routeToCapability(message, destination);
                case DIRECT -> routeDirect(message, destination);
            };
            return outcome;
        } finally {
            audit(outcome);
        }
    }

    /**
     * Management-originated broadcast: a {@code broadcast} frame to every connected node.
     */
    public int broadcastSystem(JsonNode body) {
        int delivered = registry.broadcast(FrameType.BROADCAST, body, null);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("delivered", delivered);
        details.put("body", body);
        auditTrail.record(AuditTrail.AuditEvent.of("message.broadcast", "management", "broadcast", "sent", details));
        log.info("Management broadcast delivered to {} node(s)", delivered);
        return delivered;
    }

    private RouteOutcome routeBroadcast(Message message, Destination destination) {
        int delivered = registry.broadcast(FrameType.MESSAGE, message, message.from());
        stats.broadcastRouted();
        return new RouteOutcome(message, destination, delivered, false);
    }

    private RouteOutcome routeToCapability(Message message, Destination destination) {
        String capability = destination.target();
        int routedCount = 0;
        for (String nodeId : capabilityIndex.nodesWith(capability)) {
            if (nodeId.equals(message.from())) {
                continue;
            }
            // index snapshot may be stale; sendTo re-checks the registry
            if (registry.sendTo(nodeId, FrameType.MESSAGE, message)) {
                routedCount++;
            }
        }
        stats.capabilityRouted();
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("messageId", message.id());
        ack.put("capability", capability);
        ack.put("routedCount", routedCount);
        registry.reply(message.from(), FrameType.MESSAGE_ROUTED, ack);
        return new RouteOutcome(message, destination, routedCount, false);
    }

    private RouteOutcome routeDirect(Message message, Destination destination) {
        String target = destination.target();
        if (registry.isConnected(target)) {
            boolean sent = registry.sendTo(target, FrameType.MESSAGE, message);
            stats.directRouted();
            return new RouteOutcome(message, destination, sent ? 1 : 0, false);
        }
        // acked from the store lane once the write settles
        offlineQueue.enqueue(target, message).thenAccept(durable -> {
            Map<String, Object> ack = new LinkedHashMap<>();
            ack.put("messageId", message.id());
            ack.put("to", target);
            ack.put("durable", durable);
            registry.reply(message.from(), FrameType.MESSAGE_QUEUED, ack);
        });
        return new RouteOutcome(message, destination, 0, true);
    }

    private void audit(RouteOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", outcome.message());
        details.put("route", outcome.destination().kind().name().toLowerCase(Locale.ROOT));
        details.put("delivered", outcome.delivered());
        details.put("queued", outcome.queued());
        String resource = outcome.message().to() == null ? "broadcast" : outcome.message().to();
        String result = outcome.queued() ? "queued" : "routed";
        auditTrail.record(AuditTrail.AuditEvent.of("message.route", outcome.message().from(), resource, result, details));
    }
}
