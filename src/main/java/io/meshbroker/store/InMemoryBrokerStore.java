package io.meshbroker.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public final class InMemoryBrokerStore implements BrokerStore {
    private final Map<String, Deque<String>> lists = new HashMap<>();

    @Override
    public void init() {
    }

    @Override
    public synchronized void append(String key, String value) {
        lists.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(value);
    }

    @Override
    public synchronized void pushFront(String key, String value, int maxLength) {
        Deque<String> list = lists.computeIfAbsent(key, k -> new ArrayDeque<>());
        list.addFirst(value);
        if (maxLength > 0) {
            while (list.size() > maxLength) {
                list.removeLast();
            }
        }
    }

    @Override
    public synchronized List<String> range(String key, int limit) {
        Deque<String> list = lists.get(key);
        if (list == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : list) {
            if (limit > 0 && out.size() >= limit) {
                break;
            }
            out.add(value);
        }
        return out;
    }

    @Override
    public synchronized List<String> readAll(String key, boolean clear) {
        Deque<String> list = clear ? lists.remove(key) : lists.get(key);
        return list == null ? List.of() : new ArrayList<>(list);
    }

    @Override
    public synchronized long size(String key) {
        Deque<String> list = lists.get(key);
        return list == null ? 0L : list.size();
    }

    @Override
    public synchronized Set<String> keys(String prefix) {
        Set<String> out = new TreeSet<>();
        for (Map.Entry<String, Deque<String>> entry : lists.entrySet()) {
            if (entry.getKey().startsWith(prefix) && !entry.getValue().isEmpty()) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    @Override
    public void close() {
    }
}
