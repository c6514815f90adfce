package io.memobank.runtime;

public final class UnknownResourceException extends RuntimeException {
    private final String collection;
    private final String identifier;

    public UnknownResourceException(String collection, String identifier) {
        super("Resource '" + identifier + "' does not exist in collection '" + collection + "'");
        this.collection = collection;
        this.identifier = identifier;
    }

    public String collection() {
        return collection;
    }

    public String identifier() {
        return identifier;
    }
}
