package io.memobank.compute;

import java.nio.file.Path;

public record ComputeContext(
        String collection,
        String identifier,
        Path workDir,
        Path logFile,
        RunLog logger
) {
}
