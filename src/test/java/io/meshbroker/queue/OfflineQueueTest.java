package io.meshbroker.queue;

import io.meshbroker.config.BrokerConfig;
import io.meshbroker.model.Message;
import io.meshbroker.model.QueuedMessage;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.store.FlakyBrokerStore;
import io.meshbroker.store.SqliteBrokerStore;
import io.meshbroker.store.StoreLane;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class OfflineQueueTest {

    @Test
    void readReturnsOldestFirstAndDrainEmpties() throws Exception {
        Path root = Files.createTempDirectory("meshbroker-queue-test");
        try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()));
             StoreLane lane = new StoreLane(store)) {
            store.init();
            OfflineQueue queue = new OfflineQueue(lane, new BrokerStats(), Clock.systemUTC());

            Assertions.assertTrue(queue.enqueue("Z", message("m1")).join());
            Assertions.assertTrue(queue.enqueue("Z", message("m2")).join());
            Assertions.assertTrue(queue.enqueue("Y", message("m3")).join());

            Assertions.assertEquals(2L, queue.depth("Z"));
            Assertions.assertEquals(Set.of("Y", "Z"), queue.queuedNodeIds());
            Assertions.assertEquals(List.of("m1", "m2"), ids(queue.read("Z", false)));
            Assertions.assertEquals(List.of("m1", "m2"), ids(queue.read("Z", true)));
            Assertions.assertTrue(queue.read("Z", false).isEmpty());
            Assertions.assertEquals(Set.of("Y"), queue.queuedNodeIds());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queuedEntriesCarryNodeAndTimestamp() throws Exception {
        Path root = Files.createTempDirectory("meshbroker-queue-test");
        try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()));
             StoreLane lane = new StoreLane(store)) {
            store.init();
            OfflineQueue queue = new OfflineQueue(lane, new BrokerStats(), Clock.systemUTC());
            long before = System.currentTimeMillis();
            queue.enqueue("Z", message("m1"));

            QueuedMessage entry = queue.purge("Z").get(0);

            Assertions.assertEquals("Z", entry.nodeId());
            Assertions.assertEquals("A", entry.message().from());
            Assertions.assertTrue(entry.queuedAtMs() >= before);
            Assertions.assertEquals(0L, queue.depth("Z"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedWriteCompletesFalseAndIsCounted() {
        FlakyBrokerStore store = new FlakyBrokerStore();
        BrokerStats stats = new BrokerStats();
        try (StoreLane lane = new StoreLane(store)) {
            OfflineQueue queue = new OfflineQueue(lane, stats, Clock.systemUTC());
            store.failNext(1);

            Assertions.assertFalse(queue.enqueue("Z", message("m1")).join());
            Assertions.assertTrue(queue.enqueue("Z", message("m2")).join());

            Assertions.assertEquals(List.of("m2"), ids(queue.read("Z", false)));
            Assertions.assertEquals(1L, stats.snapshot(0, 0, 0, 0).storeFailures());
        }
    }

    private static Message message(String id) {
        return new Message(id, "A", "Z", "chat", null, "2026-01-01T00:00:00Z");
    }

    private static List<String> ids(List<QueuedMessage> entries) {
        return entries.stream().map(entry -> entry.message().id()).toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
