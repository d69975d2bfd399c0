package io.meshbroker.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A registered participant. {@code nodeId} is the transport connection id.
 * Instances are immutable; the connection registry swaps in updated copies.
 */
public record Node(
        String nodeId,
        String type,
        String name,
        Set<String> capabilities,
        String connectedAt,
        String lastSeen
) {
    public static final String UNKNOWN_TYPE = "unknown";

    public Node {
        capabilities = capabilities == null ? Set.of() : copyOf(capabilities);
    }

    public static Node fromRegistration(String nodeId, RegistrationInfo info, String now) {
        String type = info.type() == null || info.type().isBlank() ? UNKNOWN_TYPE : info.type().trim();
        String name = info.name() == null || info.name().isBlank() ? defaultName(nodeId) : info.name().trim();
        return new Node(nodeId, type, name, info.capabilitySet(), now, now);
    }

    public static String defaultName(String nodeId) {
        String prefix = nodeId.length() <= 8 ? nodeId : nodeId.substring(0, 8);
        return "node-" + prefix;
    }

    public Node withCapabilities(Set<String> next, String now) {
        return new Node(nodeId, type, name, next, connectedAt, now);
    }

    public Node touch(String now) {
        return new Node(nodeId, type, name, capabilities, connectedAt, now);
    }

    private static Set<String> copyOf(Set<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String capability : raw) {
            if (capability != null && !capability.isBlank()) {
                out.add(capability.trim());
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
