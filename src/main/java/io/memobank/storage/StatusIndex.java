package io.memobank.storage;

import io.memobank.model.ResourceStatus;

import java.util.List;
import java.util.Optional;

/**
 * Ordered identifier to status mapping for one collection. A denormalized copy of the status
 * files; the resource directories stay authoritative.
 */
public interface StatusIndex extends AutoCloseable {
    Optional<ResourceStatus> get(String identifier);

    void put(String identifier, ResourceStatus status);

    void remove(String identifier);

    /** Every entry in the store's native key order. */
    List<Entry> scan();

    @Override
    void close();

    record Entry(String identifier, String token) {
        public ResourceStatus status() {
            return ResourceStatus.fromStored(token);
        }
    }
}
