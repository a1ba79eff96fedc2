package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionContext;
import io.hearthwarrio.pagelens.core.ResolutionStrategy;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches the target's name and text hint against the visible text of the page.
 * <p>
 * A node whose text is nothing but the matched words is treated as a <i>label</i>: the value is taken from the
 * nearest following sibling with text (e.g. {@code <h2>Price</h2><span>$19.99</span>}). Confidence scales with the
 * share of target tokens found.
 */
public final class TextMatchStrategy implements ResolutionStrategy {

    /**
     * Highest confidence this tier can report.
     */
    public static final double CONFIDENCE_CEILING = 0.85;

    /**
     * Penalty factor for nodes that carry extra text besides the matched words.
     */
    static final double MIXED_TEXT_FACTOR = 0.9;

    private static final Set<String> INTERACTIVE_TAGS = Set.of("a", "button", "input", "select", "textarea", "option", "label", "summary");
    private static final Set<String> SKIPPED_TAGS = Set.of("body", "html", "script", "style", "noscript", "template", "head");
    private static final String[] LABEL_ATTRIBUTES = {"aria-label", "title", "placeholder", "alt", "value"};

    @Override
    public StrategyTag tag() {
        return StrategyTag.TEXT;
    }

    @Override
    public Optional<Resolution> attempt(ResolutionContext context) {
        LogicalTarget target = context.target();
        List<String> tokens = Tokens.tokenize(join(target.getLogicalName(), target.getTextHint()));
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        DomTree tree = context.tree();
        List<ScoredNode> scored = new ArrayList<>();
        for (PageNode node : tree.nodes()) {
            if (!node.isVisible() || SKIPPED_TAGS.contains(node.getTagName())) {
                continue;
            }
            List<String> words = Tokens.words(labelText(node));
            if (words.isEmpty()) {
                continue;
            }
            int matched = 0;
            for (String token : tokens) {
                if (containsToken(words, token)) {
                    matched++;
                }
            }
            if (matched == 0) {
                continue;
            }
            double overlap = (double) matched / tokens.size();
            double confidence = CONFIDENCE_CEILING * overlap;

            boolean pureLabel = residualWords(words, tokens).isEmpty();
            if (isSelfTarget(target, node) || !pureLabel) {
                double factor = pureLabel || isSelfTarget(target, node) ? 1.0 : MIXED_TEXT_FACTOR;
                if (acceptsValue(target, node)) {
                    scored.add(new ScoredNode(node, confidence * factor));
                }
                continue;
            }

            valueNodeFor(tree, node, tokens)
                    .filter(v -> acceptsValue(target, v))
                    .ifPresent(v -> scored.add(new ScoredNode(v, confidence)));
        }
        return CandidateRanking.resolveBest(context, scored, StrategyTag.TEXT);
    }

    /**
     * Nearest following sibling (or following sibling's first text-bearing descendant) that is not itself a label.
     */
    private Optional<PageNode> valueNodeFor(DomTree tree, PageNode label, List<String> tokens) {
        for (PageNode sibling : tree.followingSiblings(label)) {
            if (!sibling.isVisible()) {
                continue;
            }
            if (!sibling.getOwnText().isEmpty()) {
                if (residualWords(Tokens.words(sibling.getOwnText()), tokens).isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(sibling);
            }
            for (PageNode d : tree.descendants(sibling)) {
                if (d.isVisible() && !d.getOwnText().isEmpty()) {
                    return Optional.of(d);
                }
            }
        }
        return Optional.empty();
    }

    private boolean isSelfTarget(LogicalTarget target, PageNode node) {
        FieldType type = target.getFieldType();
        return type == FieldType.BUTTON
                || type == FieldType.LINK
                || INTERACTIVE_TAGS.contains(node.getTagName());
    }

    /**
     * Numeric targets only accept nodes that actually show a digit.
     */
    private boolean acceptsValue(LogicalTarget target, PageNode node) {
        if (target.getFieldType() != FieldType.NUMBER) {
            return true;
        }
        String text = node.getOwnText().isEmpty() ? node.getText() : node.getOwnText();
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static List<String> residualWords(List<String> words, List<String> tokens) {
        List<String> out = new ArrayList<>();
        for (String w : words) {
            if (Tokens.STOP_WORDS.contains(w)) {
                continue;
            }
            boolean isToken = false;
            for (String t : tokens) {
                if (Tokens.matchesToken(w, t)) {
                    isToken = true;
                    break;
                }
            }
            if (!isToken) {
                out.add(w);
            }
        }
        return out;
    }

    private static boolean containsToken(List<String> words, String token) {
        for (String w : words) {
            if (Tokens.matchesToken(w, token)) {
                return true;
            }
        }
        return false;
    }

    private static String labelText(PageNode node) {
        StringBuilder sb = new StringBuilder(node.getOwnText());
        for (String attr : LABEL_ATTRIBUTES) {
            String v = node.attribute(attr);
            if (!v.isEmpty()) {
                sb.append(' ').append(v);
            }
        }
        return sb.toString();
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p != null && !p.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(p);
            }
        }
        return sb.toString();
    }
}
