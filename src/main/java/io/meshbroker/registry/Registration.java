package io.meshbroker.registry;

import io.meshbroker.model.Node;

/**
 * Result of a register call; {@code replaced} is set when an earlier registration was overwritten.
 */
public record Registration(Node node, boolean replaced) {
}
