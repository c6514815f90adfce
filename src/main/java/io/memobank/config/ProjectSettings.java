package io.memobank.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.memobank.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

public record ProjectSettings(
        long indexBusyTimeoutMs,
        String runLogTimestampPattern,
        boolean prettyResults
) {
    public static final long DEFAULT_INDEX_BUSY_TIMEOUT_MS = 5_000L;
    public static final String DEFAULT_RUN_LOG_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    public static ProjectSettings defaults() {
        return new ProjectSettings(DEFAULT_INDEX_BUSY_TIMEOUT_MS, DEFAULT_RUN_LOG_TIMESTAMP_PATTERN, true);
    }

    public static ProjectSettings load(MemoBankConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings: " + file, e);
        }
    }

    static ProjectSettings fromFile(SettingsFile file, ProjectSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long busyTimeout = file.indexBusyTimeoutMs() == null || file.indexBusyTimeoutMs() <= 0L
                ? defaults.indexBusyTimeoutMs()
                : file.indexBusyTimeoutMs();
        String pattern = defaults.runLogTimestampPattern();
        if (file.runLogTimestampPattern() != null && !file.runLogTimestampPattern().isBlank()) {
            pattern = file.runLogTimestampPattern().trim();
            try {
                DateTimeFormatter.ofPattern(pattern);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid runLogTimestampPattern: " + pattern, e);
            }
        }
        boolean pretty = file.prettyResults() == null ? defaults.prettyResults() : file.prettyResults();
        return new ProjectSettings(busyTimeout, pattern, pretty);
    }

    public DateTimeFormatter runLogTimestampFormatter() {
        return DateTimeFormatter.ofPattern(runLogTimestampPattern);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long indexBusyTimeoutMs,
            String runLogTimestampPattern,
            Boolean prettyResults
    ) {
    }
}
