package io.meshbroker.registry;

import io.meshbroker.config.RegistrationPolicy;
import io.meshbroker.model.FrameType;
import io.meshbroker.model.Node;
import io.meshbroker.model.RegistrationInfo;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.transport.FrameSender;
import io.meshbroker.transport.NodeConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns live connections and the nodes registered on them.
 *
 * <p>Node and capability mutations are serialized on one lock. A node is put into the
 * node table before it is indexed and unindexed before it leaves the table, so every id
 * the {@link CapabilityIndex} returns belongs to a registered node at that instant.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final CapabilityIndex capabilityIndex;
    private final FrameSender sender;
    private final BrokerStats stats;
    private final Clock clock;
    private final RegistrationPolicy registrationPolicy;
    private final Map<String, NodeConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private final Object mutationLock = new Object();

    public ConnectionRegistry(
            CapabilityIndex capabilityIndex,
            FrameSender sender,
            BrokerStats stats,
            Clock clock,
            RegistrationPolicy registrationPolicy
    ) {
        this.capabilityIndex = capabilityIndex;
        this.sender = sender;
        this.stats = stats;
        this.clock = clock;
        this.registrationPolicy = registrationPolicy == null ? RegistrationPolicy.REPLACE : registrationPolicy;
    }

    /**
     * Tracks a freshly opened connection as pending until it sends {@code register}.
     */
    public void open(NodeConnection connection) {
        connections.put(connection.id(), connection);
        log.debug("Connection opened: {}", connection.id());
    }

    public Registration register(String connectionId, RegistrationInfo info) {
        Node node;
        Node previous;
        NodeConnection connection;
        synchronized (mutationLock) {
            connection = connections.get(connectionId);
            if (connection == null) {
                throw new UnknownConnectionException(connectionId);
            }
            previous = nodes.get(connectionId);
            if (previous != null && registrationPolicy == RegistrationPolicy.REJECT) {
                throw new DuplicateRegistrationException(connectionId);
            }
            Node fresh = Node.fromRegistration(connectionId, info, now());
            node = previous == null
                    ? fresh
                    : new Node(connectionId, fresh.type(), fresh.name(), fresh.capabilities(),
                    previous.connectedAt(), fresh.lastSeen());
            nodes.put(connectionId, node);
            capabilityIndex.advertise(connectionId, node.capabilities());
        }
        stats.registration();
        log.info("Node {}: {} ({}) type={} capabilities={}",
                previous == null ? "registered" : "re-registered",
                node.name(), node.nodeId(), node.type(), node.capabilities());

        broadcast(FrameType.NODE_JOINED, node, connectionId);
        sender.send(connection, FrameType.NETWORK_STATUS, networkStatus());
        return new Registration(node, previous != null);
    }

    /**
     * Replaces the capability set of a registered node. Returns {@code false} and
     * changes nothing when the connection has not registered yet.
     */
    public boolean updateCapabilities(String connectionId, Collection<String> capabilities) {
        Node updated;
        synchronized (mutationLock) {
            Node current = nodes.get(connectionId);
            if (current == null) {
                return false;
            }
            Set<String> next = capabilities == null ? Set.of() : new LinkedHashSet<>(capabilities);
            updated = current.withCapabilities(next, now());
            nodes.put(connectionId, updated);
            capabilityIndex.advertise(connectionId, updated.capabilities());
        }
        log.info("Node {} capabilities: {}", connectionId, updated.capabilities());
        return true;
    }

    public Optional<Node> lookup(String connectionId) {
        return Optional.ofNullable(nodes.get(connectionId));
    }

    /**
     * Drops the connection and, if it had registered, its node. Announces {@code node_left}
     * for registered nodes only. Safe to call for unknown or already evicted ids.
     */
    public Optional<Node> evict(String connectionId) {
        Node removed;
        synchronized (mutationLock) {
            connections.remove(connectionId);
            capabilityIndex.remove(connectionId);
            removed = nodes.remove(connectionId);
        }
        if (removed == null) {
            log.debug("Connection closed before registering: {}", connectionId);
            return Optional.empty();
        }
        stats.eviction();
        log.info("Node disconnected: {} ({})", removed.name(), connectionId);
        broadcast(FrameType.NODE_LEFT, removed, connectionId);
        return Optional.of(removed);
    }

    public void touch(String connectionId) {
        nodes.computeIfPresent(connectionId, (id, node) -> node.touch(now()));
    }

    public boolean isConnected(String nodeId) {
        if (nodeId == null || !nodes.containsKey(nodeId)) {
            return false;
        }
        NodeConnection connection = connections.get(nodeId);
        return connection != null && connection.isOpen();
    }

    public Optional<NodeConnection> connectionOf(String nodeId) {
        if (!isConnected(nodeId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(nodeId));
    }

    /**
     * Sends to a registered, connected node.
     */
    public boolean sendTo(String nodeId, FrameType type, Object data) {
        return connectionOf(nodeId)
                .map(connection -> sender.send(connection, type, data))
                .orElse(false);
    }

    /**
     * Sends to any open connection, registered or not. Used for replies to the frame's sender.
     */
    public boolean reply(String connectionId, FrameType type, Object data) {
        NodeConnection connection = connections.get(connectionId);
        if (connection == null) {
            log.debug("Dropping {} reply for closed connection {}", type.wireName(), connectionId);
            return false;
        }
        return sender.send(connection, type, data);
    }

    /**
     * Sends to every connected node except {@code excludeNodeId}; returns how many writes were accepted.
     */
    public int broadcast(FrameType type, Object data, String excludeNodeId) {
        int delivered = 0;
        for (String nodeId : nodes.keySet()) {
            if (nodeId.equals(excludeNodeId)) {
                continue;
            }
            if (sendTo(nodeId, type, data)) {
                delivered++;
            }
        }
        return delivered;
    }

    public List<Node> nodes() {
        List<Node> out = new ArrayList<>(nodes.values());
        out.sort(Comparator.comparing(Node::connectedAt).thenComparing(Node::nodeId));
        return out;
    }

    public NetworkStatus networkStatus() {
        List<Node> snapshot = nodes();
        return new NetworkStatus(snapshot.size(), snapshot);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int pendingCount() {
        int pending = 0;
        for (String connectionId : connections.keySet()) {
            if (!nodes.containsKey(connectionId)) {
                pending++;
            }
        }
        return pending;
    }

    public List<NodeConnection> openConnections() {
        return List.copyOf(connections.values());
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
