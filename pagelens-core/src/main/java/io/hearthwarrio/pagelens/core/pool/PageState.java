package io.hearthwarrio.pagelens.core.pool;

/**
 * Lifecycle of a pooled page: {@code IDLE -> ACTIVE -> IDLE}, {@code IDLE -> CLOSING -> removed}.
 */
public enum PageState {
    IDLE,
    ACTIVE,
    CLOSING
}
