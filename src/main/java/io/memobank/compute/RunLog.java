package io.memobank.compute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Logging sink handed to compute functions. Every line lands in the resource's run log and is
 * mirrored to the SLF4J logger {@code memobank.collection.<collection>}.
 */
public final class RunLog {
    public static final String LOGGER_PREFIX = "memobank.collection.";

    private final Logger mirror;
    private final String identifier;
    private final Path logFile;
    private final DateTimeFormatter timestamps;

    public RunLog(String collection, String identifier, Path logFile, DateTimeFormatter timestamps) {
        this.mirror = LoggerFactory.getLogger(LOGGER_PREFIX + collection);
        this.identifier = identifier;
        this.logFile = logFile;
        this.timestamps = timestamps;
    }

    public Path logFile() {
        return logFile;
    }

    public void debug(String format, Object... args) {
        write(Level.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        write(Level.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        write(Level.WARN, format, args);
    }

    public void error(String format, Object... args) {
        write(Level.ERROR, format, args);
    }

    private synchronized void write(Level level, String format, Object[] args) {
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        String message = tuple.getMessage();
        Throwable cause = tuple.getThrowable();

        StringBuilder line = new StringBuilder()
                .append(LocalDateTime.now().format(timestamps))
                .append(' ')
                .append(String.format("%-8s", level.name()))
                .append(message)
                .append(System.lineSeparator());
        if (cause != null) {
            StringWriter trace = new StringWriter();
            cause.printStackTrace(new PrintWriter(trace));
            line.append(trace);
        }
        try {
            Files.writeString(logFile, line.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append run log: " + logFile, e);
        }
        mirror(level, message, cause);
    }

    private void mirror(Level level, String message, Throwable cause) {
        switch (level) {
            case ERROR -> mirror.error("[{}] {}", identifier, message, cause);
            case WARN -> mirror.warn("[{}] {}", identifier, message, cause);
            case INFO -> mirror.info("[{}] {}", identifier, message, cause);
            default -> mirror.debug("[{}] {}", identifier, message, cause);
        }
    }
}
