package io.memobank.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.memobank.config.MemoBankConfig.ResourcePaths;
import io.memobank.model.ResourceStatus;
import io.memobank.model.ResourceView;

import java.util.concurrent.CompletableFuture;

/**
 * What {@code fetch} hands back: the snapshot observed when the call returned, how it was
 * obtained, and a future for the terminal snapshot. For cache hits and blocking fetches the
 * future is already complete. Each handle gets its own copy of the future, so cancelling or
 * completing it leaves the computation and other callers untouched.
 */
public record ResourceHandle(
        ResourceView view,
        Source source,
        ResourcePaths paths,
        CompletableFuture<ResourceView> completion
) {
    public enum Source {
        CACHE,
        COMPUTED,
        IN_FLIGHT
    }

    public String identifier() {
        return view.identifier();
    }

    public ResourceStatus status() {
        return view.status();
    }

    public JsonNode result() {
        return view.result();
    }

    public Long startTime() {
        return view.startTime();
    }

    public Long endTime() {
        return view.endTime();
    }

    public ResourceView awaitCompletion() {
        return completion.join();
    }
}
