package io.memobank.model;

public record CollectionStatus(
        String collection,
        StatusCounts counts
) {
}
