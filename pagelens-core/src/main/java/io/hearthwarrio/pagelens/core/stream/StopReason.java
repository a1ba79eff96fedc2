package io.hearthwarrio.pagelens.core.stream;

import java.util.Locale;

/**
 * Why a chunk stream ended.
 */
public enum StopReason {

    /**
     * All text was emitted.
     */
    SOURCE_EXHAUSTED,

    /**
     * The next chunk would have exceeded {@code max_tokens * chars_per_token}.
     */
    BUDGET,

    /**
     * The configured chunk count limit was reached.
     */
    MAX_CHUNKS,

    /**
     * The consumer closed the stream early.
     */
    CLOSED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
