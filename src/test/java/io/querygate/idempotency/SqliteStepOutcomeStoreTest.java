package io.querygate.idempotency;

import io.querygate.config.QueryGateConfig;
import io.querygate.model.IdempotencyKey;
import io.querygate.model.StepOutcome;
import io.querygate.model.StepStatus;
import io.querygate.model.Tool;
import io.querygate.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SqliteStepOutcomeStoreTest {

    @Test
    void storedOutcomeIsReadBackAndFirstWriteWins() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-steps-");
        try {
            Database database = new Database(QueryGateConfig.fromRoot(root.toString()));
            database.init();
            SqliteStepOutcomeStore store = new SqliteStepOutcomeStore(database);
            Instant started = Instant.parse("2026-03-01T10:00:00Z");
            StepOutcome outcome = new StepOutcome("step_1", Tool.EXECUTE_QUERY, StepStatus.SUCCESS,
                    Map.of("rows", List.of(Map.of("dau", 12000)), "bytes_scanned", 1048576),
                    "abc123", started, started.plusSeconds(2), 1, null);
            IdempotencyKey key = new IdempotencyKey("key-1");

            Assertions.assertTrue(store.saveIfAbsent(key, outcome, started));
            Assertions.assertFalse(store.saveIfAbsent(key, outcome, started.plusSeconds(5)));

            StepOutcome loaded = store.find(key).orElseThrow();
            Assertions.assertEquals("step_1", loaded.stepName());
            Assertions.assertEquals(Tool.EXECUTE_QUERY, loaded.tool());
            Assertions.assertEquals(StepStatus.SUCCESS, loaded.status());
            Assertions.assertEquals("abc123", loaded.outputHash());
            Assertions.assertEquals(1, loaded.retryCount());
            Assertions.assertEquals(started.plusSeconds(2), loaded.finishedAt());
            Assertions.assertEquals(1_048_576L, loaded.bytesScanned());
            Assertions.assertTrue(store.find(new IdempotencyKey("missing")).isEmpty());

            Assertions.assertEquals(1L, store.count());
            Assertions.assertEquals(0, store.purgeStoredBefore(started));
            Assertions.assertEquals(1, store.purgeStoredBefore(started.plusSeconds(1)));
            Assertions.assertEquals(0L, store.count());
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
