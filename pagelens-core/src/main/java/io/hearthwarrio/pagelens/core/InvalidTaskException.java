package io.hearthwarrio.pagelens.core;

/**
 * Thrown when a task or one of its targets is malformed.
 */
public class InvalidTaskException extends PagelensException {
    public InvalidTaskException(String message) {
        super(ErrorKind.INVALID_TASK, message);
    }

    public InvalidTaskException(String message, Throwable cause) {
        super(ErrorKind.INVALID_TASK, message, cause);
    }
}
