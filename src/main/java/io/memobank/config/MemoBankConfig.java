package io.memobank.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MemoBankConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILENAME = "memobank-settings.json";
    public static final String COLLECTIONS_FILENAME = "collections.json";
    public static final String INDEX_DIRNAME = ".status-index";
    public static final String INDEX_DB_FILENAME = "status.db";

    public static final String STATUS_FILENAME = "status";
    public static final String START_FILENAME = "start_time";
    public static final String END_FILENAME = "end_time";
    public static final String RESULT_FILENAME = "result.json";
    public static final String ERROR_FILENAME = "error.log";
    public static final String LOG_FILENAME = "run.log";
    public static final String STORAGE_DIRNAME = "storage";

    private final Path rootDir;

    public MemoBankConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MemoBankConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new MemoBankConfig(resolved.toAbsolutePath().normalize());
    }

    public static MemoBankConfig fromRoot(Path root) {
        return new MemoBankConfig(root.toAbsolutePath().normalize());
    }

    /**
     * Collection names and resource identifiers both become directory names, so they share
     * one rule: no path separators, no dot-prefixed names (reserved for the index directory).
     */
    public static String requireSafeName(String kind, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(kind + " cannot be empty");
        }
        if (raw.startsWith(".")) {
            throw new IllegalArgumentException(kind + " cannot start with '.': " + raw);
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '/' || ch == '\\' || ch == '\0') {
                throw new IllegalArgumentException(kind + " contains an illegal character: " + raw);
            }
        }
        return raw;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILENAME);
    }

    public Path collectionsFile() {
        return rootDir.resolve(COLLECTIONS_FILENAME);
    }

    public Path collectionDir(String collection) {
        return rootDir.resolve(collection);
    }

    public Path indexDir(String collection) {
        return collectionDir(collection).resolve(INDEX_DIRNAME);
    }

    public Path indexDbFile(String collection) {
        return indexDir(collection).resolve(INDEX_DB_FILENAME);
    }

    public ResourcePaths resourcePaths(String collection, String identifier) {
        return ResourcePaths.of(collectionDir(collection).resolve(identifier));
    }

    public record ResourcePaths(
            Path baseDir,
            Path status,
            Path startTime,
            Path endTime,
            Path result,
            Path error,
            Path log,
            Path storage
    ) {
        public static ResourcePaths of(Path baseDir) {
            return new ResourcePaths(
                    baseDir,
                    baseDir.resolve(STATUS_FILENAME),
                    baseDir.resolve(START_FILENAME),
                    baseDir.resolve(END_FILENAME),
                    baseDir.resolve(RESULT_FILENAME),
                    baseDir.resolve(ERROR_FILENAME),
                    baseDir.resolve(LOG_FILENAME),
                    baseDir.resolve(STORAGE_DIRNAME)
            );
        }
    }
}
