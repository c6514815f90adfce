package io.memobank.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.memobank.config.MemoBankConfig;
import io.memobank.config.MemoBankConfig.ResourcePaths;
import io.memobank.model.ResourceStatus;
import io.memobank.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Plain-file layout of every resource in one collection. Each facet of a resource lives in
 * its own file so it can be inspected without this library. Writes are single-file and not
 * atomic; readers treat torn or empty markers as unset.
 */
public final class ResourceStore {
    private static final Logger log = LoggerFactory.getLogger(ResourceStore.class);

    private final MemoBankConfig config;
    private final String collection;
    private final boolean prettyResults;

    public ResourceStore(MemoBankConfig config, String collection, boolean prettyResults) {
        this.config = config;
        this.collection = collection;
        this.prettyResults = prettyResults;
    }

    public String collection() {
        return collection;
    }

    public Path collectionDir() {
        return config.collectionDir(collection);
    }

    /** Names of the resource directories present on disk, in name order. */
    public List<String> listIdentifiers() {
        Path dir = collectionDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list resource directories: " + dir, e);
        }
    }

    public ResourcePaths paths(String identifier) {
        return config.resourcePaths(collection, identifier);
    }

    public boolean exists(String identifier) {
        return Files.isDirectory(paths(identifier).baseDir());
    }

    public ResourcePaths initialize(String identifier) {
        ResourcePaths paths = paths(identifier);
        try {
            Files.createDirectories(paths.baseDir());
            Files.createDirectories(paths.storage());
            if (!Files.exists(paths.status())) {
                try {
                    Files.createFile(paths.status());
                } catch (FileAlreadyExistsException ignored) {
                    // Created by a concurrent initializer.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize resource directory: " + paths.baseDir(), e);
        }
        return paths;
    }

    public ResourceStatus readStatus(String identifier) {
        return ResourceStatus.fromStored(readOptional(paths(identifier).status()));
    }

    public StoredState readState(String identifier) {
        ResourcePaths paths = paths(identifier);
        ResourceStatus status = ResourceStatus.fromStored(readOptional(paths.status()));
        Long start = readTime(paths.startTime());
        Long end = readTime(paths.endTime());
        JsonNode result = status == ResourceStatus.COMPLETE ? readResult(paths.result()) : null;
        return new StoredState(status, start, end, result);
    }

    public void begin(String identifier, long nowMs) {
        ResourcePaths paths = paths(identifier);
        write(paths.result(), "");
        write(paths.error(), "");
        write(paths.log(), "");
        write(paths.status(), ResourceStatus.PENDING.token());
        write(paths.startTime(), Long.toString(nowMs));
        write(paths.endTime(), "");
    }

    public void finishComplete(String identifier, JsonNode result, long nowMs) {
        ResourcePaths paths = paths(identifier);
        write(paths.result(), serialize(result));
        write(paths.endTime(), Long.toString(nowMs));
        write(paths.status(), ResourceStatus.COMPLETE.token());
    }

    public void finishError(String identifier, long nowMs) {
        ResourcePaths paths = paths(identifier);
        write(paths.result(), "");
        write(paths.endTime(), Long.toString(nowMs));
        write(paths.status(), ResourceStatus.ERROR.token());
    }

    public void appendError(String identifier, String text) {
        append(paths(identifier).error(), text);
    }

    public String readError(String identifier) {
        String raw = readOptional(paths(identifier).error());
        return raw == null ? "" : raw;
    }

    public String readLog(String identifier) {
        String raw = readOptional(paths(identifier).log());
        return raw == null ? "" : raw;
    }

    private String serialize(JsonNode result) {
        return prettyResults ? Jsons.toJson(result) : Jsons.toCompactJson(result);
    }

    private JsonNode readResult(Path path) {
        String raw = readOptional(path);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readTree(raw);
        } catch (IOException e) {
            log.warn("Unreadable result file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static Long readTime(Path path) {
        String raw = readOptional(path);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String readOptional(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read resource file: " + path, e);
        }
    }

    private static void write(Path path, String content) {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write resource file: " + path, e);
        }
    }

    private static void append(Path path, String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append resource file: " + path, e);
        }
    }

    public record StoredState(
            ResourceStatus status,
            Long startTime,
            Long endTime,
            JsonNode result
    ) {
    }
}
