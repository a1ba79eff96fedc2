package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link StructureReport} for a resolved element.
 */
public class StructureCapture {

    static final int MAX_ATTRIBUTES = 16;
    static final int TEXT_PREVIEW_CHARS = 200;
    private static final int MAX_SELECTOR_CLASSES = 3;
    private static final List<String> SELECTOR_ATTRIBUTES = List.of("name", "data-testid", "data-qa", "aria-label");

    /**
     * @param tree       snapshot taken after resolution; the resolved node is looked up by index
     * @param resolution result of the resolver
     */
    public StructureReport capture(DomTree tree, Resolution resolution) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(resolution, "resolution must not be null");

        PageNode node = tree.node(resolution.getNode().getIndex()).orElse(resolution.getNode());

        Map<String, String> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, String> a : node.getAttributes().entrySet()) {
            if (attributes.size() == MAX_ATTRIBUTES) {
                break;
            }
            attributes.put(a.getKey(), a.getValue());
        }

        Map<String, Object> parent = tree.parent(node).map(StructureCapture::describeParent).orElse(null);

        return new StructureReport(
                resolution.getCandidate().getStrategy().wireName(),
                resolution.isHealed(),
                resolution.getCandidate().getConfidence(),
                node.getTagName(),
                node.getId().isEmpty() ? null : node.getId(),
                node.classList(),
                attributes,
                Tokens.truncate(Tokens.normalizeWhitespace(node.getText()), TEXT_PREVIEW_CHARS),
                tree.cssPath(node),
                tree.xPath(node),
                parent,
                tree.children(node).size(),
                suggestedSelectors(node)
        );
    }

    static List<String> suggestedSelectors(PageNode node) {
        Set<String> out = new LinkedHashSet<>();
        String tag = node.getTagName();
        if (!node.getId().isEmpty()) {
            out.add("#" + cssEscape(node.getId()));
        }
        List<String> classes = node.classList();
        if (!classes.isEmpty()) {
            StringBuilder sb = new StringBuilder(tag);
            for (int i = 0; i < Math.min(MAX_SELECTOR_CLASSES, classes.size()); i++) {
                sb.append('.').append(cssEscape(classes.get(i)));
            }
            out.add(sb.toString());
        }
        for (String attr : SELECTOR_ATTRIBUTES) {
            String value = node.attribute(attr);
            if (!value.isEmpty()) {
                out.add(tag + "[" + attr + "=\"" + value.replace("\"", "\\\"") + "\"]");
            }
        }
        return new ArrayList<>(out);
    }

    private static Map<String, Object> describeParent(PageNode parent) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("tag", parent.getTagName());
        p.put("id", parent.getId().isEmpty() ? null : parent.getId());
        p.put("classes", parent.classList());
        return p;
    }

    /**
     * Escapes characters that are not valid in a bare CSS identifier.
     */
    static String cssEscape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean plain = Character.isLetterOrDigit(c) || c == '-' || c == '_';
            if (i == 0 && Character.isDigit(c)) {
                sb.append("\\3").append(c).append(' ');
            } else if (plain) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.toString();
    }
}
