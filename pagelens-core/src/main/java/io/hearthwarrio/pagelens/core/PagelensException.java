package io.hearthwarrio.pagelens.core;

import java.util.Objects;

/**
 * Base class of all errors that map to a task-level {@link ErrorKind}.
 */
public class PagelensException extends RuntimeException {

    private final ErrorKind kind;

    public PagelensException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public PagelensException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
