package io.memobank.model;

import java.util.Optional;

public enum ResourceStatus {
    PENDING("pending"),
    COMPLETE("complete"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String token;

    ResourceStatus(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /**
     * Parses a stored token. Empty, torn or unrecognized content is {@link #UNKNOWN}; the
     * {@code unknown} token itself is never written to disk or to the index.
     */
    public static ResourceStatus fromStored(String raw) {
        return parse(raw).orElse(UNKNOWN);
    }

    public static Optional<ResourceStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.strip();
        for (ResourceStatus status : values()) {
            if (status != UNKNOWN && status.token.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public static ResourceStatus fromQuery(String raw) {
        if (raw == null || raw.isBlank()) {
            return COMPLETE;
        }
        for (ResourceStatus value : values()) {
            if (value.token.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw);
    }
}
