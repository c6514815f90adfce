package io.memobank.model;

public record StatusCounts(
        long total,
        long pending,
        long complete,
        long error,
        long unknown
) {
    public static StatusCounts empty() {
        return new StatusCounts(0L, 0L, 0L, 0L, 0L);
    }

    public StatusCounts plus(ResourceStatus status) {
        return switch (status) {
            case PENDING -> new StatusCounts(total + 1, pending + 1, complete, error, unknown);
            case COMPLETE -> new StatusCounts(total + 1, pending, complete + 1, error, unknown);
            case ERROR -> new StatusCounts(total + 1, pending, complete, error + 1, unknown);
            case UNKNOWN -> new StatusCounts(total + 1, pending, complete, error, unknown + 1);
        };
    }
}
