package io.meshbroker.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.store.BrokerStore;
import io.meshbroker.store.StoreException;
import io.meshbroker.store.StoreLane;
import io.meshbroker.util.Hashing;
import io.meshbroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bounded, most-recent-first audit log kept in the broker store. Each row carries the
 * hash of the row before it. Rows are written on the {@link StoreLane}, so callers never
 * wait on the store; write failures are logged and counted, never rethrown.
 */
public final class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
    public static final String KEY = "audit:messages";

    private final StoreLane lane;
    private final BrokerStats stats;
    private final Clock clock;
    private final int maxEntries;
    // lane thread only
    private String previousHash;

    public AuditTrail(StoreLane lane, BrokerStats stats, Clock clock, int maxEntries) {
        this.lane = lane;
        this.stats = stats;
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.previousHash = null;
    }

    /**
     * Queues the row and returns at once. The future completes with {@code false}
     * when the store rejected the write.
     */
    public CompletableFuture<Boolean> record(AuditEvent event) {
        String timestamp = Instant.now(clock).toString();
        return lane.submit(store -> write(store, timestamp, event))
                .exceptionally(error -> {
                    stats.storeFailure();
                    log.warn("Failed to write audit row {} for {}: {}",
                            event.action(), event.resource(), StoreLane.unwrap(error).getMessage());
                    return false;
                });
    }

    public List<JsonNode> recent(int limit) {
        List<JsonNode> out = new ArrayList<>();
        for (String line : lane.call(store -> store.range(KEY, Math.max(1, limit)))) {
            try {
                out.add(Jsons.readTree(line));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable audit row: {}", e.getOriginalMessage());
            }
        }
        return out;
    }

    private boolean write(BrokerStore store, String timestamp, AuditEvent event) {
        if (previousHash == null) {
            previousHash = loadHeadHash(store);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        store.pushFront(KEY, Jsons.toCompactJson(row), maxEntries);
        previousHash = rowHash;
        return true;
    }

    private static String loadHeadHash(BrokerStore store) {
        try {
            List<String> head = store.range(KEY, 1);
            if (head.isEmpty()) {
                return "";
            }
            return Jsons.readTree(head.get(0)).path("hash").asText("");
        } catch (StoreException | JsonProcessingException e) {
            log.warn("Could not read audit head, starting a new hash chain: {}", e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
