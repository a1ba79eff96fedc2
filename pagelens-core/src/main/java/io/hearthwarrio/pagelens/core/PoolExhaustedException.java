package io.hearthwarrio.pagelens.core;

/**
 * Thrown when no page becomes available within the acquire timeout. Retryable.
 */
public class PoolExhaustedException extends PagelensException {
    public PoolExhaustedException(String message) {
        super(ErrorKind.POOL_EXHAUSTED, message);
    }
}
