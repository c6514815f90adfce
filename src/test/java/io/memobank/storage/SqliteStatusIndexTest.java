package io.memobank.storage;

import io.memobank.model.ResourceStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class SqliteStatusIndexTest {

    @Test
    void putIsLastWriteWins() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-put-");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve(".status-index").resolve("status.db"), 2_000L)) {
            Assertions.assertEquals(Optional.empty(), index.get("a"));
            index.put("a", ResourceStatus.PENDING);
            index.put("a", ResourceStatus.COMPLETE);
            Assertions.assertEquals(Optional.of(ResourceStatus.COMPLETE), index.get("a"));
            Assertions.assertEquals(1, index.scan().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void scanReturnsEntriesInIdentifierOrder() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-scan-");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve("status.db"), 2_000L)) {
            index.put("b", ResourceStatus.ERROR);
            index.put("a", ResourceStatus.COMPLETE);
            index.put("c", ResourceStatus.PENDING);
            List<StatusIndex.Entry> entries = index.scan();
            Assertions.assertEquals(List.of("a", "b", "c"), entries.stream().map(StatusIndex.Entry::identifier).toList());
            Assertions.assertEquals(ResourceStatus.ERROR, entries.get(1).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removeDropsEntry() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-remove-");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve("status.db"), 2_000L)) {
            index.put("a", ResourceStatus.COMPLETE);
            index.remove("a");
            index.remove("missing");
            Assertions.assertEquals(Optional.empty(), index.get("a"));
            Assertions.assertTrue(index.scan().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownIsNeverStored() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-unknown-");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve("status.db"), 2_000L)) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> index.put("a", ResourceStatus.UNKNOWN));
            Assertions.assertThrows(IllegalArgumentException.class, () -> index.put("a", null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void foreignTokenReadsAsUnknown() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-foreign-");
        Path db = root.resolve("status.db");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(db, 2_000L)) {
            try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
                 PreparedStatement ps = conn.prepareStatement(
                         "INSERT INTO status_index(resource_id, status, updated_at_ms) VALUES (?, ?, ?)")) {
                ps.setString(1, "x");
                ps.setString(2, "half-written");
                ps.setLong(3, 1L);
                ps.executeUpdate();
            }
            Assertions.assertEquals(Optional.of(ResourceStatus.UNKNOWN), index.get("x"));
            Assertions.assertEquals(ResourceStatus.UNKNOWN, index.scan().get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void entriesSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-reopen-");
        Path db = root.resolve("status.db");
        try {
            try (SqliteStatusIndex index = SqliteStatusIndex.open(db, 2_000L)) {
                index.put("a", ResourceStatus.COMPLETE);
            }
            try (SqliteStatusIndex index = SqliteStatusIndex.open(db, 2_000L)) {
                Assertions.assertEquals(Optional.of(ResourceStatus.COMPLETE), index.get("a"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void connectionPragmasApplyToEveryConnection() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-pragma-");
        try (SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve("status.db"), 2_000L)) {
            index.put("a", ResourceStatus.COMPLETE);
            Assertions.assertEquals("1", index.pragma("synchronous"));
            Assertions.assertEquals("2000", index.pragma("busy_timeout"));
            Assertions.assertEquals("wal", index.pragma("journal_mode"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closedIndexRejectsCalls() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-index-closed-");
        try {
            SqliteStatusIndex index = SqliteStatusIndex.open(root.resolve("status.db"), 2_000L);
            index.close();
            Assertions.assertTrue(index.isClosed());
            Assertions.assertThrows(IllegalStateException.class, () -> index.get("a"));
            Assertions.assertThrows(IllegalStateException.class, () -> index.put("a", ResourceStatus.COMPLETE));
            Assertions.assertThrows(IllegalStateException.class, index::scan);
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
