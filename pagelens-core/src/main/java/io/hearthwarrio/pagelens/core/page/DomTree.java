package io.hearthwarrio.pagelens.core.page;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Navigable view over a page snapshot: parent/child links plus CSS and XPath paths.
 * <p>
 * Paths are derived from the snapshot only, so they work for any {@link PageProvider}.
 */
public final class DomTree {

    private static final Pattern SIMPLE_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final int MAX_CSS_SEGMENTS = 12;
    private static final int MAX_PATH_CLASSES = 2;

    private final List<PageNode> nodes;
    private final Map<Integer, PageNode> byIndex = new HashMap<>();
    private final Map<Integer, List<PageNode>> children = new HashMap<>();

    public DomTree(List<PageNode> nodes) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        for (PageNode n : this.nodes) {
            byIndex.put(n.getIndex(), n);
            if (n.getParentIndex() >= 0) {
                children.computeIfAbsent(n.getParentIndex(), k -> new ArrayList<>()).add(n);
            }
        }
    }

    /**
     * @return all nodes in document order
     */
    public List<PageNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public Optional<PageNode> node(int index) {
        return Optional.ofNullable(byIndex.get(index));
    }

    public Optional<PageNode> parent(PageNode node) {
        return node(node.getParentIndex());
    }

    public List<PageNode> children(PageNode node) {
        List<PageNode> c = children.get(node.getIndex());
        return c == null ? List.of() : Collections.unmodifiableList(c);
    }

    /**
     * All descendants of {@code node} in document order.
     */
    public List<PageNode> descendants(PageNode node) {
        List<PageNode> out = new ArrayList<>();
        collectDescendants(node, out);
        return out;
    }

    private void collectDescendants(PageNode node, List<PageNode> out) {
        for (PageNode child : children(node)) {
            out.add(child);
            collectDescendants(child, out);
        }
    }

    /**
     * Ancestors from the direct parent up to {@code body}.
     */
    public List<PageNode> ancestors(PageNode node) {
        List<PageNode> out = new ArrayList<>();
        Optional<PageNode> p = parent(node);
        while (p.isPresent()) {
            out.add(p.get());
            p = parent(p.get());
        }
        return out;
    }

    /**
     * Siblings following {@code node} under the same parent, in document order.
     */
    public List<PageNode> followingSiblings(PageNode node) {
        Optional<PageNode> p = parent(node);
        if (p.isEmpty()) {
            return List.of();
        }
        List<PageNode> siblings = children(p.get());
        List<PageNode> out = new ArrayList<>();
        boolean after = false;
        for (PageNode s : siblings) {
            if (after) {
                out.add(s);
            } else if (s.getIndex() == node.getIndex()) {
                after = true;
            }
        }
        return out;
    }

    /**
     * Builds a CSS selector that points at {@code node}.
     * <p>
     * The walk stops at the first ancestor with a usable id. {@code :nth-of-type} is added whenever a parent has more
     * than one child with the same tag, so the path stays unique even when classes repeat.
     */
    public String cssPath(PageNode node) {
        List<String> segments = new ArrayList<>();
        PageNode current = node;
        while (current != null && segments.size() < MAX_CSS_SEGMENTS) {
            String id = current.getId();
            if (!id.isEmpty() && isSimpleIdent(id)) {
                segments.add(0, "#" + id);
                break;
            }
            if (current.getParentIndex() < 0) {
                segments.add(0, current.getTagName());
                break;
            }
            StringBuilder seg = new StringBuilder(current.getTagName());
            int added = 0;
            for (String cls : current.classList()) {
                if (added == MAX_PATH_CLASSES) {
                    break;
                }
                if (isSimpleIdent(cls)) {
                    seg.append('.').append(cls);
                    added++;
                }
            }
            int position = sameTagPosition(current);
            if (position > 0) {
                seg.append(":nth-of-type(").append(position).append(')');
            }
            segments.add(0, seg.toString());
            current = parent(current).orElse(null);
        }
        return String.join(" > ", segments);
    }

    /**
     * Builds an absolute XPath ({@code /html/body/...}) for {@code node}.
     */
    public String xPath(PageNode node) {
        List<String> segments = new ArrayList<>();
        PageNode current = node;
        while (current != null) {
            if (current.getParentIndex() < 0) {
                segments.add(0, current.getTagName());
                break;
            }
            int position = sameTagPosition(current);
            segments.add(0, position > 0 ? current.getTagName() + "[" + position + "]" : current.getTagName());
            current = parent(current).orElse(null);
        }
        return "/html/" + String.join("/", segments);
    }

    /**
     * @return 1-based position among same-tag siblings, or 0 when the tag is unique under its parent
     */
    private int sameTagPosition(PageNode node) {
        Optional<PageNode> p = parent(node);
        if (p.isEmpty()) {
            return 0;
        }
        int position = 0;
        int total = 0;
        for (PageNode s : children(p.get())) {
            if (s.getTagName().equals(node.getTagName())) {
                total++;
                if (s.getIndex() == node.getIndex()) {
                    position = total;
                }
            }
        }
        return total > 1 ? position : 0;
    }

    static boolean isSimpleIdent(String s) {
        return SIMPLE_IDENT.matcher(s).matches();
    }
}
