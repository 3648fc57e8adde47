package io.liveguard.storage;

import io.liveguard.config.LiveGuardConfig;
import io.liveguard.model.Heartbeat;
import io.liveguard.testing.TestHeartbeats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static io.liveguard.testing.TestHeartbeats.NOW;

final class SqliteHeartbeatStoreTest {
    @Test
    void secondInsertOfSameHeartbeatIsReplay() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-heartbeats-replay-");
        try {
            SqliteHeartbeatStore store = new SqliteHeartbeatStore(newDatabase(root));
            Heartbeat hb = TestHeartbeats.stored("hb-1", NOW);

            Assertions.assertEquals(HeartbeatStore.InsertOutcome.INSERTED, store.insert(hb));
            Assertions.assertEquals(HeartbeatStore.InsertOutcome.REPLAY, store.insert(hb));
            Assertions.assertEquals(1L, store.count());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reusedHeartbeatIdFromAnotherServerIsIntegrityViolation() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-heartbeats-integrity-");
        try {
            SqliteHeartbeatStore store = new SqliteHeartbeatStore(newDatabase(root));
            store.insert(TestHeartbeats.stored("srv-1", "hb-shared", NOW, 1, 10));

            HeartbeatIntegrityException error = Assertions.assertThrows(HeartbeatIntegrityException.class,
                    () -> store.insert(TestHeartbeats.stored("srv-2", "hb-shared", NOW, 1, 10)));

            Assertions.assertEquals("hb-shared", error.heartbeatId());
            Assertions.assertEquals("srv-2", error.serverId());
            Assertions.assertEquals("srv-1", error.existingServerId());
            Assertions.assertEquals(1L, store.count());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentDuplicatesStoreExactlyOneRow() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-heartbeats-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SqliteHeartbeatStore store = new SqliteHeartbeatStore(newDatabase(root));
            Heartbeat hb = TestHeartbeats.stored("hb-race", NOW);
            List<Callable<HeartbeatStore.InsertOutcome>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> store.insert(hb));
            }

            int inserted = 0;
            for (Future<HeartbeatStore.InsertOutcome> f : pool.invokeAll(calls)) {
                if (f.get() == HeartbeatStore.InsertOutcome.INSERTED) {
                    inserted++;
                }
            }

            Assertions.assertEquals(1, inserted);
            Assertions.assertEquals(1L, store.count());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void recentReturnsNewestFirstWithinLimit() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-heartbeats-recent-");
        try {
            SqliteHeartbeatStore store = new SqliteHeartbeatStore(newDatabase(root));
            store.insert(TestHeartbeats.stored("hb-old", NOW.minusSeconds(600)));
            store.insert(TestHeartbeats.stored("hb-new", NOW));
            store.insert(TestHeartbeats.stored("hb-mid", NOW.minusSeconds(300)));
            store.insert(TestHeartbeats.stored("srv-2", "hb-other", NOW, 3, null));

            List<Heartbeat> recent = store.recent("srv-1", 2);

            Assertions.assertEquals(List.of("hb-new", "hb-mid"), recent.stream().map(Heartbeat::heartbeatId).toList());
            Heartbeat newest = recent.get(0);
            Assertions.assertEquals(NOW, newest.receivedAt());
            Assertions.assertEquals(10, newest.playersCurrent());
            Assertions.assertEquals(64, newest.playersCapacity());
            Assertions.assertNull(store.recent("srv-2", 5).get(0).playersCapacity());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database database = new Database(new LiveGuardConfig(root));
        database.init();
        return database;
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
