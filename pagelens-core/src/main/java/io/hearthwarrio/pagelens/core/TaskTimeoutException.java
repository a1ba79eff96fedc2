package io.hearthwarrio.pagelens.core;

public class TaskTimeoutException extends PagelensException {
    public TaskTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }
}
