package io.hearthwarrio.pagelens.jsoup;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Set;

/**
 * Static visibility rules for documents that are never rendered.
 * <p>
 * Only markup is considered: stylesheets and scripts are not evaluated, so an element hidden by a CSS class is
 * reported as visible.
 */
final class Visibility {

    static final Set<String> NEVER_RENDERED = Set.of(
            "script", "style", "noscript", "template", "head", "meta", "link", "title", "base"
    );

    private Visibility() {
    }

    /**
     * @return true when the element itself hides its subtree
     */
    static boolean hides(Element e) {
        if (NEVER_RENDERED.contains(e.normalName())) {
            return true;
        }
        if (e.hasAttr("hidden")) {
            return true;
        }
        if ("true".equalsIgnoreCase(e.attr("aria-hidden").trim())) {
            return true;
        }
        if ("input".equals(e.normalName()) && "hidden".equalsIgnoreCase(e.attr("type").trim())) {
            return true;
        }
        String style = e.attr("style");
        if (style.isEmpty()) {
            return false;
        }
        String s = style.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        return s.contains("display:none") || s.contains("visibility:hidden") || s.contains("visibility:collapse");
    }
}
