package io.hearthwarrio.pagelens.core;

/**
 * Error taxonomy reported in task results.
 */
public enum ErrorKind {

    RESOLUTION_FAILURE("ResolutionFailure", false),
    POOL_EXHAUSTED("PoolExhausted", true),
    NAVIGATION_ERROR("NavigationError", true),
    TIMEOUT("Timeout", true),
    INVALID_TASK("InvalidTask", false),
    UNSUPPORTED("Unsupported", false),
    INTERNAL("Internal", false);

    private final String wireName;
    private final boolean retryable;

    ErrorKind(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    /**
     * @return name used in the {@code error.kind} field of task results
     */
    public String wireName() {
        return wireName;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
