package io.memobank.runtime;

public final class UnknownCollectionException extends RuntimeException {
    private final String collection;

    public UnknownCollectionException(String collection) {
        super("Unknown collection: " + collection);
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }
}
