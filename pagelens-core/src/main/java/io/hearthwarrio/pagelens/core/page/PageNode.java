package io.hearthwarrio.pagelens.core.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Lightweight, provider-neutral snapshot of a single DOM element.
 * <p>
 * Indices are pre-order positions inside {@code body} ({@code body} itself is 0). Nodes returned by
 * {@link PageProvider#snapshot(PageHandle, int)} and {@link PageProvider#evaluate(PageHandle, Locator)}
 * share the same index space as long as the DOM did not change in between.
 */
public final class PageNode {

    private final int index;
    private final int parentIndex;
    private final int depth;
    private final String tagName;
    private final Map<String, String> attributes;
    private final String ownText;
    private final String text;
    private final boolean visible;

    private PageNode(Builder b) {
        this.index = b.index;
        this.parentIndex = b.parentIndex;
        this.depth = b.depth;
        this.tagName = normalizeNull(b.tagName).toLowerCase(Locale.ROOT);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.ownText = normalizeNull(b.ownText);
        this.text = normalizeNull(b.text);
        this.visible = b.visible;
    }

    public static Builder builder(int index, String tagName) {
        return new Builder(index, tagName);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return index of the parent element, or -1 for {@code body}
     */
    public int getParentIndex() {
        return parentIndex;
    }

    public int getDepth() {
        return depth;
    }

    public String getTagName() {
        return tagName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * @param name attribute name, case-insensitive
     * @return trimmed attribute value or empty string
     */
    public String attribute(String name) {
        if (name == null) {
            return "";
        }
        String v = attributes.get(name.toLowerCase(Locale.ROOT));
        return v == null ? "" : v.trim();
    }

    public boolean hasAttribute(String name) {
        return name != null && attributes.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public String getId() {
        return attribute("id");
    }

    public String getCssClasses() {
        return attribute("class");
    }

    public List<String> classList() {
        String classes = getCssClasses();
        if (classes.isBlank()) {
            return List.of();
        }
        return List.of(classes.trim().split("\\s+"));
    }

    public String getName() {
        return attribute("name");
    }

    public String getRole() {
        return attribute("role").toLowerCase(Locale.ROOT);
    }

    public String getAriaLabel() {
        return attribute("aria-label");
    }

    /**
     * Text of the element's direct text children, whitespace-normalized.
     */
    public String getOwnText() {
        return ownText;
    }

    /**
     * Whitespace-normalized text content of the whole subtree (possibly truncated by the provider).
     */
    public String getText() {
        return text;
    }

    public boolean isVisible() {
        return visible;
    }

    @Override
    public String toString() {
        return "PageNode{" +
                "index=" + index +
                ", tag='" + tagName + '\'' +
                ", id='" + getId() + '\'' +
                ", class='" + getCssClasses() + '\'' +
                ", visible=" + visible +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageNode)) {
            return false;
        }
        PageNode that = (PageNode) o;
        return index == that.index
                && parentIndex == that.parentIndex
                && depth == that.depth
                && visible == that.visible
                && tagName.equals(that.tagName)
                && attributes.equals(that.attributes)
                && ownText.equals(that.ownText)
                && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, parentIndex, depth, tagName, attributes, ownText, text, visible);
    }

    public static final class Builder {
        private final int index;
        private final String tagName;
        private int parentIndex = -1;
        private int depth;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String ownText = "";
        private String text = "";
        private boolean visible = true;

        private Builder(int index, String tagName) {
            this.index = index;
            this.tagName = Objects.requireNonNull(tagName, "tagName must not be null");
        }

        public Builder parent(int parentIndex, int depth) {
            this.parentIndex = parentIndex;
            this.depth = depth;
            return this;
        }

        public Builder attribute(String name, String value) {
            if (name != null && !name.isBlank() && value != null) {
                attributes.put(name.toLowerCase(Locale.ROOT), value);
            }
            return this;
        }

        public Builder ownText(String ownText) {
            this.ownText = ownText;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public PageNode build() {
            return new PageNode(this);
        }
    }
}
