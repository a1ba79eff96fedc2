package io.hearthwarrio.pagelens.core.relevance;

import java.util.Locale;

/**
 * Structural role of a content block; drives the salience part of the relevance score.
 */
public enum BlockKind {
    HEADING(0.2),
    TABLE(0.15),
    LIST(0.1),
    TEXT(0.0);

    private final double salience;

    BlockKind(double salience) {
        this.salience = salience;
    }

    public double salience() {
        return salience;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BlockKind forTag(String tag) {
        switch (tag) {
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                return HEADING;
            case "table":
                return TABLE;
            case "li":
            case "ul":
            case "ol":
            case "dl":
                return LIST;
            default:
                return TEXT;
        }
    }
}
