package io.hearthwarrio.pagelens.core.relevance;

import java.util.Objects;

/**
 * A candidate block of page content in document order.
 */
public final class ContentBlock {

    private final int index;
    private final String tagName;
    private final BlockKind kind;
    private final String text;
    private final String selector;

    public ContentBlock(int index, String tagName, BlockKind kind, String text, String selector) {
        this.index = index;
        this.tagName = Objects.requireNonNull(tagName, "tagName must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.selector = selector == null ? "" : selector;
    }

    public static ContentBlock of(int index, String tagName, String text) {
        return new ContentBlock(index, tagName, BlockKind.forTag(tagName), text, "");
    }

    /**
     * @return document position; lower comes first
     */
    public int getIndex() {
        return index;
    }

    public String getTagName() {
        return tagName;
    }

    public BlockKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getSelector() {
        return selector;
    }

    @Override
    public String toString() {
        return "ContentBlock{" + index + ", " + tagName + ", '" + (text.length() > 40 ? text.substring(0, 40) + "..." : text) + "'}";
    }
}
