package io.hearthwarrio.pagelens.core.nlq;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Tokens;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns free-form field requests ({@code "customer_rating"}, {@code "the product price"}) into
 * {@link LogicalTarget}s.
 * <p>
 * Steps: lower-case, split on non-alphanumerics, drop stop words, then map the last word that belongs to a synonym
 * cluster to that cluster's canonical name. Without a cluster hit the remaining words joined by {@code _} become the
 * logical name. The original text is kept as the text hint. The parser is pure and deterministic.
 */
public class FieldQueryParser {

    private static final List<String> TABLE_HINTS = List.of("table", "rows", "columns");
    private static final List<String> LIST_HINTS = List.of("list", "items", "results");
    private static final List<String> NUMBER_HINTS = List.of("price", "cost", "amount", "total", "score", "rating", "count", "number", "quantity", "qty");
    private static final List<String> BOOLEAN_HINTS = List.of("enabled", "available", "active", "checked", "availability", "instock");
    private static final List<String> LINK_HINTS = List.of("link", "url", "href");
    private static final List<String> BUTTON_HINTS = List.of("button", "cta", "submit", "buy");

    private final SynonymClusters synonyms;

    public FieldQueryParser() {
        this(SynonymClusters.defaults());
    }

    public FieldQueryParser(SynonymClusters synonyms) {
        this.synonyms = Objects.requireNonNull(synonyms, "synonyms must not be null");
    }

    public LogicalTarget parse(String fieldQuery) {
        return parse(fieldQuery, FieldSpec.empty());
    }

    /**
     * @param fieldQuery free text naming the field
     * @param spec       explicit overrides, {@link FieldSpec#empty()} for none
     * @throws IllegalArgumentException when the query contains no usable word
     */
    public LogicalTarget parse(String fieldQuery, FieldSpec spec) {
        Objects.requireNonNull(fieldQuery, "fieldQuery must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        List<String> tokens = Tokens.tokenize(fieldQuery);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Field query has no usable words: '" + fieldQuery + "'");
        }

        String logicalName = canonicalName(tokens);
        FieldType type = spec.getType() != null ? spec.getType() : inferType(tokens);

        String attribute = spec.getAttribute();
        if (attribute == null && type == FieldType.LINK) {
            attribute = "href";
        }

        return LogicalTarget.named(logicalName)
                .selectorHint(spec.getSelector())
                .textHint(spec.getTextHint() != null ? spec.getTextHint() : Tokens.normalizeWhitespace(fieldQuery.replace('_', ' ')))
                .semanticHint(spec.getSemanticHint() != null ? spec.getSemanticHint() : semanticHint(logicalName, type))
                .fieldType(type)
                .attribute(attribute)
                .mandatory(spec.isMandatory())
                .build();
    }

    /**
     * Parses several fields, keeping the caller's keys and order.
     */
    public Map<String, LogicalTarget> parseAll(Map<String, FieldSpec> fields) {
        Map<String, LogicalTarget> out = new LinkedHashMap<>();
        for (Map.Entry<String, FieldSpec> e : fields.entrySet()) {
            out.put(e.getKey(), parse(e.getKey(), e.getValue() == null ? FieldSpec.empty() : e.getValue()));
        }
        return out;
    }

    String canonicalName(List<String> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            Optional<String> canonical = synonyms.canonical(tokens.get(i));
            if (canonical.isPresent()) {
                return canonical.get();
            }
        }
        return String.join("_", tokens);
    }

    FieldType inferType(List<String> tokens) {
        if (containsAny(tokens, TABLE_HINTS)) {
            return FieldType.TABLE;
        }
        if (containsAny(tokens, LIST_HINTS)) {
            return FieldType.LIST;
        }
        if (containsAny(tokens, NUMBER_HINTS)) {
            return FieldType.NUMBER;
        }
        if (containsAny(tokens, BOOLEAN_HINTS)) {
            return FieldType.BOOLEAN;
        }
        if (containsAny(tokens, LINK_HINTS)) {
            return FieldType.LINK;
        }
        if (containsAny(tokens, BUTTON_HINTS) || tokens.contains("cart") && tokens.contains("add")) {
            return FieldType.BUTTON;
        }
        return FieldType.TEXT;
    }

    private static String semanticHint(String logicalName, FieldType type) {
        switch (type) {
            case BUTTON:
                return "button";
            case LINK:
                return "link";
            case TABLE:
                return "table";
            case LIST:
                return "list";
            default:
                return logicalName.replace('_', ' ');
        }
    }

    /**
     * Selectors that commonly hold values of the given type. Used to collect list and table fields when no
     * selector hint is given.
     */
    public static List<String> defaultSelectors(String logicalName, FieldType type) {
        Set<String> out = new LinkedHashSet<>();
        String n = logicalName.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        out.add("[data-field='" + n + "']");
        out.add("[data-testid*='" + n + "']");
        out.add("[name*='" + n + "']");
        if (n.matches("[a-z_][a-z0-9_-]*")) {
            out.add("#" + n);
            out.add("." + n);
        }
        switch (type) {
            case NUMBER:
                out.addAll(List.of("[data-price]", ".price", "[itemprop='price']", ".amount"));
                break;
            case BUTTON:
                out.addAll(List.of("button", "[role='button']", "input[type='submit']"));
                break;
            case LINK:
                out.add("a[href]");
                break;
            case TABLE:
                out.addAll(List.of("table", "[role='table']"));
                break;
            case LIST:
                out.addAll(List.of("ul li", "ol li", "[role='listitem']"));
                break;
            default:
                out.addAll(List.of("h1", "h2", "h3", ".title", ".name", ".label", "p"));
                break;
        }
        return new ArrayList<>(out);
    }

    private static boolean containsAny(List<String> tokens, List<String> hints) {
        for (String t : tokens) {
            for (String h : hints) {
                if (Tokens.matchesToken(t, h)) {
                    return true;
                }
            }
        }
        return false;
    }
}
