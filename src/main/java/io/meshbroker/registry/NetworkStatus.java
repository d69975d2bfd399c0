package io.meshbroker.registry;

import io.meshbroker.model.Node;

import java.util.List;

public record NetworkStatus(int totalNodes, List<Node> nodes) {
}
