package io.memobank.compute;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Stream;

final class RunLogTest {

    @Test
    void appendsFormattedLinesWithLevelAndTimestamp() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-runlog-");
        try {
            Path file = root.resolve("run.log");
            RunLog runLog = new RunLog("things", "r1", file, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
            runLog.info("Processing {} with {}", "r1", 42);
            runLog.warn("Careful");

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            Assertions.assertTrue(lines.get(0).matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} INFO {4}Processing r1 with 42"),
                    lines.get(0));
            Assertions.assertTrue(lines.get(1).endsWith("WARN    Careful"), lines.get(1));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void trailingThrowableIsWrittenAsStackTrace() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-runlog-trace-");
        try {
            Path file = root.resolve("run.log");
            RunLog runLog = new RunLog("things", "r1", file, DateTimeFormatter.ofPattern("HH:mm:ss"));
            runLog.error("Step {} failed", 3, new IllegalStateException("boom"));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertTrue(content.contains("ERROR   Step 3 failed"), content);
            Assertions.assertTrue(content.contains("java.lang.IllegalStateException: boom"), content);
            Assertions.assertTrue(content.contains("at io.memobank.compute.RunLogTest"), content);
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
