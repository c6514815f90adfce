package io.memobank.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Point-in-time snapshot of one resource.
 *
 * <p>{@code startTime} and {@code endTime} are epoch milliseconds, {@code null} when unset.
 * {@code result} is present only when {@code status} is {@link ResourceStatus#COMPLETE}.
 */
public record ResourceView(
        String collection,
        String identifier,
        ResourceStatus status,
        Long startTime,
        Long endTime,
        JsonNode result
) {
    public String statusToken() {
        return status.token();
    }
}
