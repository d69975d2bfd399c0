package io.meshbroker.store;

import io.meshbroker.config.BrokerConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class SqliteBrokerStoreTest {

    @Test
    void appendKeepsInsertionOrderAndDrainClears() throws Exception {
        Path root = Files.createTempDirectory("meshbroker-store-test");
        try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()))) {
            store.init();
            store.append("queue:n1", "m1");
            store.append("queue:n1", "m2");
            store.append("queue:n2", "x");

            Assertions.assertEquals(List.of("m1", "m2"), store.readAll("queue:n1", false));
            Assertions.assertEquals(2L, store.size("queue:n1"));
            Assertions.assertEquals(Set.of("queue:n1", "queue:n2"), store.keys("queue:"));

            Assertions.assertEquals(List.of("m1", "m2"), store.readAll("queue:n1", true));
            Assertions.assertEquals(0L, store.size("queue:n1"));
            Assertions.assertEquals(List.of("x"), store.readAll("queue:n2", false));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pushFrontReadsNewestFirstAndTrims() throws Exception {
        Path root = Files.createTempDirectory("meshbroker-store-test");
        try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()))) {
            store.init();
            for (int i = 1; i <= 5; i++) {
                store.pushFront("audit:messages", "a" + i, 3);
            }

            Assertions.assertEquals(List.of("a5", "a4", "a3"), store.range("audit:messages", 10));
            Assertions.assertEquals(List.of("a5"), store.range("audit:messages", 1));
            Assertions.assertEquals(3L, store.size("audit:messages"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void entriesSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("meshbroker-store-test");
        try {
            try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()))) {
                store.init();
                store.append("queue:n1", "m1");
            }
            try (SqliteBrokerStore store = new SqliteBrokerStore(BrokerConfig.fromRoot(root.toString()))) {
                store.init();
                Assertions.assertEquals(List.of("m1"), store.readAll("queue:n1", false));
            }
        } finally {
            deleteRecursively(root);
        }
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
