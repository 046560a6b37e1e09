package io.querygate.storage;

import io.querygate.config.QueryGateConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class CounterStoreTest {

    @Test
    void countersAccumulateAcrossStoreInstances() throws Exception {
        Path root = Files.createTempDirectory("querygate-test-counters-");
        try {
            Database database = new Database(QueryGateConfig.fromRoot(root.toString()));
            database.init();
            CounterStore first = new CounterStore(database);
            first.increment("bytes_recorded", 1024L);
            first.increment("runs", "query_result", 1L);
            first.increment("runs", "blocked", 1L);
            first.increment("bytes_recorded", 0L);

            CounterStore second = new CounterStore(database);
            second.increment("bytes_recorded", 2048L);
            second.increment("runs", "query_result", 1L);

            Assertions.assertEquals(3072L, second.value("bytes_recorded"));
            Assertions.assertEquals(2L, first.value("runs", "query_result"));
            Assertions.assertEquals(Map.of("blocked", 1L, "query_result", 2L), first.byLabel("runs"));
            Assertions.assertEquals(Map.of(), first.byLabel("bytes_recorded"));
            Assertions.assertEquals(0L, first.value("never_touched"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> first.increment("runs", "blocked", -1L));
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
