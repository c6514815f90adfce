package io.memobank.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memobank.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class MemoBankCommandTest {

    @Test
    void scriptCollectionCanBeFetchedAndQueried() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "requires /bin/sh");
        Path root = Files.createTempDirectory("memobank-test-cli-fetch-");
        try {
            Files.writeString(root.resolve("collections.json"), """
                    {
                      "collections": [
                        {
                          "name": "echo",
                          "command": ["/bin/sh", "-c", "cat > /dev/null; echo '{\\"ok\\": true}'"],
                          "timeoutMs": 10000
                        }
                      ]
                    }
                    """, StandardCharsets.UTF_8);

            Run fetched = run("--root", root.toString(), "fetch", "--collection", "echo", "--id", "r1",
                    "--args", "{\"k\": 1}");
            Assertions.assertEquals(0, fetched.exitCode());
            JsonNode view = Jsons.mapper().readTree(fetched.stdout());
            Assertions.assertEquals("complete", view.get("status").asText());
            Assertions.assertEquals("computed", view.get("source").asText());
            Assertions.assertTrue(view.get("result").get("ok").asBoolean());

            Run again = run("--root", root.toString(), "fetch", "--collection", "echo", "--id", "r1");
            Assertions.assertEquals("cache", Jsons.mapper().readTree(again.stdout()).get("source").asText());

            Run counts = run("--root", root.toString(), "status", "--collection", "echo");
            Assertions.assertEquals(0, counts.exitCode());
            JsonNode countsJson = Jsons.mapper().readTree(counts.stdout());
            Assertions.assertEquals(1, countsJson.get("counts").get("complete").asInt());

            Run found = run("--root", root.toString(), "find", "--collection", "echo");
            Assertions.assertEquals("r1", Jsons.mapper().readTree(found.stdout()).get(0).asText());

            Run error = run("--root", root.toString(), "error", "--collection", "echo", "--id", "r1");
            Assertions.assertEquals(0, error.exitCode());
            Assertions.assertEquals("", error.stdout());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownCollectionIsReportedAsMisuse() throws Exception {
        Path root = Files.createTempDirectory("memobank-test-cli-unknown-");
        try {
            Run listed = run("--root", root.toString(), "collections");
            Assertions.assertEquals(0, listed.exitCode());
            Assertions.assertEquals(0, Jsons.mapper().readTree(listed.stdout()).size());

            Run missing = run("--root", root.toString(), "status", "--collection", "nope");
            Assertions.assertEquals(1, missing.exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new MemoBankCommand()).execute(args);
            capture.flush();
            return new Run(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Run(int exitCode, String stdout) {
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
