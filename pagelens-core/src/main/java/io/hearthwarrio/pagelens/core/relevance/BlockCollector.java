package io.hearthwarrio.pagelens.core.relevance;

import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts {@link ContentBlock}s from a page snapshot, skipping navigation, footers, ads and other boilerplate.
 */
public class BlockCollector {

    public static final int DEFAULT_MAX_BLOCKS = 800;
    public static final int MIN_TEXT_LENGTH = 20;
    public static final int MAX_TEXT_LENGTH = 500;

    private static final Set<String> BOILERPLATE_TAGS = Set.of("nav", "footer", "aside", "script", "style", "noscript", "template");
    private static final List<String> BOILERPLATE_CLASSES = List.of("advert", "cookie", "newsletter", "banner-ad", "promo");
    private static final Set<String> ALWAYS_BLOCK_TAGS = Set.of("p", "li", "h1", "h2", "h3", "h4", "h5", "h6", "table", "blockquote", "pre", "dd");
    private static final Set<String> CONTAINER_TAGS = Set.of("main", "article", "section", "div");

    private final int maxBlocks;

    public BlockCollector() {
        this(DEFAULT_MAX_BLOCKS);
    }

    public BlockCollector(int maxBlocks) {
        this.maxBlocks = Math.max(1, maxBlocks);
    }

    public List<ContentBlock> collect(DomTree tree) {
        List<ContentBlock> out = new ArrayList<>();
        for (PageNode node : tree.nodes()) {
            if (out.size() == maxBlocks) {
                break;
            }
            if (!node.isVisible() || !isCandidate(node) || isBoilerplate(tree, node)) {
                continue;
            }
            String text = Tokens.normalizeWhitespace(node.getText());
            if (text.length() < MIN_TEXT_LENGTH && !isHeading(node)) {
                continue;
            }
            if (text.isEmpty()) {
                continue;
            }
            out.add(new ContentBlock(
                    node.getIndex(),
                    node.getTagName(),
                    BlockKind.forTag(node.getTagName()),
                    Tokens.truncate(text, MAX_TEXT_LENGTH),
                    tree.cssPath(node)
            ));
        }
        return out;
    }

    private boolean isCandidate(PageNode node) {
        String tag = node.getTagName();
        if (ALWAYS_BLOCK_TAGS.contains(tag)) {
            return true;
        }
        return CONTAINER_TAGS.contains(tag) && node.getOwnText().length() >= MIN_TEXT_LENGTH;
    }

    private boolean isHeading(PageNode node) {
        return BlockKind.forTag(node.getTagName()) == BlockKind.HEADING;
    }

    private boolean isBoilerplate(DomTree tree, PageNode node) {
        if (isBoilerplateNode(node)) {
            return true;
        }
        for (PageNode ancestor : tree.ancestors(node)) {
            if (isBoilerplateNode(ancestor)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBoilerplateNode(PageNode node) {
        if (BOILERPLATE_TAGS.contains(node.getTagName())) {
            return true;
        }
        String classes = node.getCssClasses().toLowerCase(Locale.ROOT);
        for (String c : BOILERPLATE_CLASSES) {
            if (classes.contains(c)) {
                return true;
            }
        }
        String role = node.getRole();
        return "navigation".equals(role) || "contentinfo".equals(role);
    }
}
