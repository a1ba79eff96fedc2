package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Tokens;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Value shapes recognizable without any markup hints.
 */
public enum FieldArchetype {

    /**
     * Currency symbol or code adjacent to a number: {@code $19.99}, {@code 12,50 €}, {@code USD 40}.
     */
    PRICE(Pattern.compile(
            "(?:[$€£¥₹]\\s?\\d[\\d.,\\s]*)|(?:\\d[\\d.,]*\\s?[$€£¥₹])|(?:\\b(?:USD|EUR|GBP|JPY|INR|CAD|AUD)\\s?\\d)|(?:\\d[\\d.,]*\\s?(?:USD|EUR|GBP|JPY|INR|CAD|AUD)\\b)",
            Pattern.CASE_INSENSITIVE),
            List.of("price", "cost", "amount", "pricing", "fee", "total")),

    /**
     * Bounded score ({@code 4.5/5}, {@code 4 out of 5}, {@code 8.1 / 10}) or star glyphs.
     */
    RATING(Pattern.compile(
            "(?:\\b\\d(?:[.,]\\d)?\\s?(?:/|out of|of)\\s?(?:5|10)\\b)|(?:[★☆]{2,})|(?:\\b\\d(?:[.,]\\d)?\\s?stars?\\b)",
            Pattern.CASE_INSENSITIVE),
            List.of("rating", "stars", "score", "rate", "review")),

    NONE(null, List.of());

    private final Pattern valuePattern;
    private final List<String> keywords;

    FieldArchetype(Pattern valuePattern, List<String> keywords) {
        this.valuePattern = valuePattern;
        this.keywords = keywords;
    }

    /**
     * @return true when {@code text} contains a value of this shape
     */
    public boolean matches(String text) {
        return valuePattern != null && text != null && !text.isEmpty() && valuePattern.matcher(text).find();
    }

    /**
     * Picks the archetype from the semantic hint first, then from the logical name.
     */
    public static FieldArchetype of(LogicalTarget target) {
        FieldArchetype fromHint = fromTokens(Tokens.tokenize(target.getSemanticHint()));
        if (fromHint != NONE) {
            return fromHint;
        }
        return fromTokens(Tokens.tokenize(target.getLogicalName()));
    }

    private static FieldArchetype fromTokens(List<String> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            String t = tokens.get(i);
            for (FieldArchetype a : values()) {
                for (String k : a.keywords) {
                    if (Tokens.matchesToken(t, k)) {
                        return a;
                    }
                }
            }
        }
        return NONE;
    }
}
