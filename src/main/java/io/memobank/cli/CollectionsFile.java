package io.memobank.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.memobank.compute.ScriptComputeFunction;
import io.memobank.runtime.MemoProject;
import io.memobank.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record CollectionsFile(List<ScriptCollectionSpec> collections) {
    static final long DEFAULT_TIMEOUT_MS = 60_000L;

    static CollectionsFile read(Path file) {
        if (!Files.exists(file)) {
            return new CollectionsFile(List.of());
        }
        try {
            CollectionsFile parsed = Jsons.mapper().readValue(file.toFile(), CollectionsFile.class);
            return parsed.collections() == null ? new CollectionsFile(List.of()) : parsed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read collections file: " + file, e);
        }
    }

    void registerAll(MemoProject project) {
        for (ScriptCollectionSpec spec : collections) {
            long timeout = spec.timeoutMs() == null ? DEFAULT_TIMEOUT_MS : spec.timeoutMs();
            project.register(spec.name(), new ScriptComputeFunction(spec.command(), timeout));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScriptCollectionSpec(String name, List<String> command, Long timeoutMs) {
    }
}
