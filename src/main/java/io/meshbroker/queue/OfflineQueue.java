package io.meshbroker.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.meshbroker.model.Message;
import io.meshbroker.model.QueuedMessage;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.store.StoreLane;
import io.meshbroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * Per-node FIFO of messages addressed to nodes that are not connected.
 * Entries stay until read with {@code drain} or purged. All store access goes
 * through the {@link StoreLane}, so reads see every enqueue submitted before them.
 */
public final class OfflineQueue {
    private static final Logger log = LoggerFactory.getLogger(OfflineQueue.class);
    static final String KEY_PREFIX = "queue:";

    private final StoreLane lane;
    private final BrokerStats stats;
    private final Clock clock;

    public OfflineQueue(StoreLane lane, BrokerStats stats, Clock clock) {
        this.lane = lane;
        this.stats = stats;
        this.clock = clock;
    }

    /**
     * Queues the write and returns at once. The future completes with {@code false}
     * when the store rejected it; the failure is logged, not thrown.
     */
    public CompletableFuture<Boolean> enqueue(String nodeId, Message message) {
        QueuedMessage entry = new QueuedMessage(nodeId, message, clock.millis());
        String row = Jsons.toCompactJson(entry);
        return lane.submit(store -> {
            store.append(key(nodeId), row);
            stats.queued();
            log.debug("Queued message {} for offline node {}", message.id(), nodeId);
            return true;
        }).exceptionally(error -> {
            stats.storeFailure();
            log.warn("Failed to queue message {} for {}: {}", message.id(), nodeId, StoreLane.unwrap(error).getMessage());
            return false;
        });
    }

    /**
     * Queued entries for {@code nodeId}, oldest first. With {@code drain} the queue is
     * emptied in the same store operation.
     */
    public List<QueuedMessage> read(String nodeId, boolean drain) {
        List<String> rows = lane.call(store -> store.readAll(key(nodeId), drain));
        List<QueuedMessage> out = new ArrayList<>(rows.size());
        for (String row : rows) {
            try {
                out.add(Jsons.read(row, QueuedMessage.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable queue entry for {}: {}", nodeId, e.getOriginalMessage());
            }
        }
        return out;
    }

    public List<QueuedMessage> purge(String nodeId) {
        List<QueuedMessage> purged = read(nodeId, true);
        log.info("Purged {} queued message(s) for {}", purged.size(), nodeId);
        return purged;
    }

    public long depth(String nodeId) {
        return lane.call(store -> store.size(key(nodeId)));
    }

    public Set<String> queuedNodeIds() {
        Set<String> out = new TreeSet<>();
        for (String key : lane.call(store -> store.keys(KEY_PREFIX))) {
            out.add(key.substring(KEY_PREFIX.length()));
        }
        return out;
    }

    static String key(String nodeId) {
        return KEY_PREFIX + nodeId;
    }
}
