package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link PagePreview} from a snapshot.
 */
public class ContentPreviewer {

    public static final int DEFAULT_MAX_SECTIONS = 20;

    static final int MAX_H2 = 10;
    static final int MAX_PARAGRAPHS = 8;
    static final int SECTION_SCAN_LIMIT = 600;
    static final int MIN_SECTION_TEXT = 40;
    static final int SECTION_PREVIEW_CHARS = 180;

    private static final Set<String> SECTION_TAGS = Set.of("main", "article", "section", "div");

    public PagePreview preview(String title, DomTree tree, int maxSections) {
        int limit = maxSections <= 0 ? DEFAULT_MAX_SECTIONS : maxSections;

        String h1 = "";
        List<String> h2 = new ArrayList<>();
        List<String> paragraphs = new ArrayList<>();
        List<PagePreview.Section> sections = new ArrayList<>();
        int scanned = 0;

        for (PageNode node : tree.nodes()) {
            String tag = node.getTagName();
            String text = Tokens.normalizeWhitespace(node.getText());
            if ("h1".equals(tag) && h1.isEmpty()) {
                h1 = text;
            } else if ("h2".equals(tag) && h2.size() < MAX_H2) {
                h2.add(text);
            } else if ("p".equals(tag) && paragraphs.size() < MAX_PARAGRAPHS) {
                paragraphs.add(text);
            } else if (SECTION_TAGS.contains(tag) && scanned < SECTION_SCAN_LIMIT) {
                scanned++;
                if (sections.size() < limit && node.isVisible() && text.length() > MIN_SECTION_TEXT) {
                    sections.add(new PagePreview.Section(
                            sections.size(),
                            tag,
                            tree.cssPath(node),
                            Tokens.truncate(text, SECTION_PREVIEW_CHARS)
                    ));
                }
            }
        }
        return new PagePreview(title == null ? "" : title, h1, h2, paragraphs, sections);
    }
}
