package io.memobank.compute;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.memobank.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per computation. The request {@code {"id", "args", "workDir"}} is
 * written to stdin, stdout is parsed as the JSON result and stderr is appended to the run log.
 */
public final class ScriptComputeFunction implements ComputeFunction {
    private static final int MAX_OUTPUT_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptComputeFunction(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    public List<String> command() {
        return command;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public Object compute(String identifier, Map<String, Object> args, ComputeContext context) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.directory(context.workDir().toFile());
        pb.redirectError(ProcessBuilder.Redirect.appendTo(context.logFile().toFile()));
        Path stdoutFile = Files.createTempFile("memobank-script-", ".out");
        pb.redirectOutput(stdoutFile.toFile());
        context.logger().debug("Running script {}", command);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            Files.deleteIfExists(stdoutFile);
            throw new IllegalStateException("script spawn failed: " + e.getMessage(), e);
        }

        try {
            ObjectNode request = Jsons.mapper().createObjectNode();
            request.put("id", identifier);
            request.set("args", Jsons.toTree(args));
            request.put("workDir", context.workDir().toString());
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(stdout));
            }
            if (stdout.isBlank()) {
                return null;
            }
            JsonNode result = Jsons.mapper().readTree(stdout);
            context.logger().debug("Script finished with {} bytes of output", stdout.length());
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(stdoutFile);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_OUTPUT_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_OUTPUT_CHARS) + "...";
    }
}
