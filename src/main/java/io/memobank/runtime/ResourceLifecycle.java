package io.memobank.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.memobank.model.ResourceStatus;
import io.memobank.model.ResourceView;
import io.memobank.storage.ResourceStore;
import io.memobank.storage.StatusIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Transitions of one collection's resources: unknown, then pending, then complete or error,
 * with forced recomputes re-entering pending. Every read reconciles the status index
 * against the status file; the file wins.
 */
final class ResourceLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ResourceLifecycle.class);

    private final String collection;
    private final ResourceStore store;
    private final StatusIndex index;

    ResourceLifecycle(String collection, ResourceStore store, StatusIndex index) {
        this.collection = collection;
        this.store = store;
        this.index = index;
    }

    /** Materializes the resource directory if needed, then reads it back. */
    ResourceView load(String identifier) {
        store.initialize(identifier);
        return read(identifier);
    }

    /** Reads an existing resource; never creates one. */
    ResourceView inspect(String identifier) {
        if (!store.exists(identifier)) {
            throw new UnknownResourceException(collection, identifier);
        }
        return read(identifier);
    }

    ResourceView begin(String identifier, long nowMs) {
        store.begin(identifier, nowMs);
        index.put(identifier, ResourceStatus.PENDING);
        return new ResourceView(collection, identifier, ResourceStatus.PENDING, nowMs, null, null);
    }

    ResourceView complete(String identifier, JsonNode result, long nowMs) {
        requirePending(identifier);
        store.finishComplete(identifier, result, nowMs);
        index.put(identifier, ResourceStatus.COMPLETE);
        return read(identifier);
    }

    ResourceView fail(String identifier, String errorText, long nowMs) {
        requirePending(identifier);
        store.appendError(identifier, errorText);
        store.finishError(identifier, nowMs);
        index.put(identifier, ResourceStatus.ERROR);
        return read(identifier);
    }

    private ResourceView read(String identifier) {
        ResourceStore.StoredState state = store.readState(identifier);
        ResourceStatus status = reconcile(identifier, state.status());
        return new ResourceView(collection, identifier, status, state.startTime(), state.endTime(), state.result());
    }

    private ResourceStatus reconcile(String identifier, ResourceStatus onDisk) {
        Optional<ResourceStatus> indexed = index.get(identifier);
        if (onDisk == ResourceStatus.UNKNOWN) {
            if (indexed.isPresent()) {
                log.info("Dropping index entry {} for {}/{}: status file is empty or unreadable",
                        indexed.get().token(), collection, identifier);
                index.remove(identifier);
            }
            return onDisk;
        }
        if (indexed.isEmpty()) {
            index.put(identifier, onDisk);
        } else if (indexed.get() != onDisk) {
            log.info("Correcting index for {}/{}: indexed={}, on disk={}",
                    collection, identifier, indexed.get().token(), onDisk.token());
            index.put(identifier, onDisk);
        }
        return onDisk;
    }

    private void requirePending(String identifier) {
        ResourceStatus current = store.readStatus(identifier);
        if (current != ResourceStatus.PENDING) {
            throw new IllegalStateException(
                    "Resource " + collection + "/" + identifier + " was not begun, status=" + current.token()
            );
        }
    }
}
