package io.meshbroker.registry;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Capability name to advertising node ids. A node's whole capability set is swapped
 * under the write lock, so readers see either the previous or the next set, never a mix.
 */
public final class CapabilityIndex {
    private final Map<String, Set<String>> nodesByCapability = new HashMap<>();
    private final Map<String, Set<String>> capabilitiesByNode = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void advertise(String nodeId, Set<String> capabilities) {
        Set<String> next = Set.copyOf(capabilities);
        lock.writeLock().lock();
        try {
            unindex(nodeId);
            capabilitiesByNode.put(nodeId, next);
            for (String capability : next) {
                nodesByCapability.computeIfAbsent(capability, c -> new HashSet<>()).add(nodeId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point-in-time copy; callers re-check liveness before using an id.
     */
    public Set<String> nodesWith(String capability) {
        lock.readLock().lock();
        try {
            Set<String> ids = nodesByCapability.get(capability);
            return ids == null ? Set.of() : Set.copyOf(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> capabilitiesOf(String nodeId) {
        lock.readLock().lock();
        try {
            return capabilitiesByNode.getOrDefault(nodeId, Set.of());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Idempotent.
     */
    public boolean remove(String nodeId) {
        lock.writeLock().lock();
        try {
            return unindex(nodeId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Set<String>> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Set<String>> out = new LinkedHashMap<>();
            new TreeMap<>(nodesByCapability).forEach((capability, ids) -> out.put(capability, Set.copyOf(ids)));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capabilityCount() {
        lock.readLock().lock();
        try {
            return nodesByCapability.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean unindex(String nodeId) {
        Set<String> previous = capabilitiesByNode.remove(nodeId);
        if (previous == null) {
            return false;
        }
        for (String capability : previous) {
            Set<String> ids = nodesByCapability.get(capability);
            if (ids != null) {
                ids.remove(nodeId);
                if (ids.isEmpty()) {
                    nodesByCapability.remove(capability);
                }
            }
        }
        return true;
    }
}
