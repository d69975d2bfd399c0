package io.meshbroker.dispatch;

import java.util.List;

/**
 * Picks one node id from a non-empty candidate list.
 */
@FunctionalInterface
public interface NodeSelector {
    String select(List<String> candidates);
}
