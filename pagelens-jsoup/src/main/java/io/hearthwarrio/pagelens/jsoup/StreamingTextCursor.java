package io.hearthwarrio.pagelens.jsoup;

import io.hearthwarrio.pagelens.core.page.TextCursor;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks the DOM lazily and produces whitespace-normalized text on demand.
 * <p>
 * Only as much of the tree is visited as needed to fill the requested slice. Block elements and {@code br} separate
 * words the way a rendered page does; hidden subtrees are skipped.
 */
final class StreamingTextCursor implements TextCursor {

    /**
     * Pushed before the children of a block element, popped after them.
     */
    private static final Object BLOCK_END = new Object();
    private static final char NBSP = 0xA0;

    private final Deque<Object> pending = new ArrayDeque<>();
    private final StringBuilder buffer = new StringBuilder();
    private boolean lastWasSpace = true;

    StreamingTextCursor(Element root) {
        if (root != null) {
            pending.push(root);
        }
    }

    static TextCursor empty() {
        return maxChars -> "";
    }

    @Override
    public String read(int maxChars) {
        if (maxChars <= 0) {
            return "";
        }
        while (buffer.length() < maxChars && !pending.isEmpty()) {
            step();
        }
        int n = Math.min(maxChars, buffer.length());
        String slice = buffer.substring(0, n);
        buffer.delete(0, n);
        return slice;
    }

    private void step() {
        Object next = pending.pop();
        if (next == BLOCK_END) {
            space();
            return;
        }
        if (next instanceof TextNode) {
            append(((TextNode) next).getWholeText());
            return;
        }
        if (!(next instanceof Element)) {
            return;
        }
        Element e = (Element) next;
        if (Visibility.hides(e)) {
            return;
        }
        if ("br".equals(e.normalName())) {
            space();
            return;
        }
        if (e.isBlock()) {
            space();
            pending.push(BLOCK_END);
        }
        List<Node> children = e.childNodes();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    private void append(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == NBSP) {
                space();
            } else {
                buffer.append(c);
                lastWasSpace = false;
            }
        }
    }

    private void space() {
        if (!lastWasSpace) {
            buffer.append(' ');
            lastWasSpace = true;
        }
    }
}
