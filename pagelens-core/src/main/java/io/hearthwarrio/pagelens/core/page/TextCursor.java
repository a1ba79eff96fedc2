package io.hearthwarrio.pagelens.core.page;

/**
 * Forward-only reader over the normalized text of a page region.
 * <p>
 * Whitespace runs are collapsed to a single space and the text is trimmed at the start. Implementations must not
 * materialize the whole text when the underlying engine allows incremental reads.
 */
public interface TextCursor extends AutoCloseable {

    /**
     * Reads up to {@code maxChars} characters.
     *
     * @param maxChars maximum number of characters, positive
     * @return next slice; empty string when the cursor is exhausted
     */
    String read(int maxChars);

    @Override
    default void close() {
    }
}
