package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionContext;
import io.hearthwarrio.pagelens.core.ResolutionStrategy;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Last tier: scores nodes by attribute tokens, ARIA roles and landmarks, and value archetypes (price, rating).
 * <p>
 * Raw scores below the configured similarity threshold are discarded. The raw score {@code s} is mapped to a
 * confidence of {@code CEILING * s / (s + threshold)}, so this tier never outranks a text match of full overlap.
 */
public final class SemanticMatchStrategy implements ResolutionStrategy {

    public static final double CONFIDENCE_CEILING = 0.6;

    static final double ID_WEIGHT = 3.5;
    static final double CLASS_WEIGHT = 2.2;
    static final double ITEMPROP_WEIGHT = 2.0;
    static final double TEST_ATTRIBUTE_WEIGHT = 2.0;
    static final double NAME_WEIGHT = 1.5;
    static final double ARIA_LABEL_WEIGHT = 1.5;
    static final double ROLE_TOKEN_WEIGHT = 1.0;
    static final double TAG_WEIGHT = 1.2;
    static final double ROLE_HINT_WEIGHT = 2.5;
    static final double TEXT_HINT_WEIGHT = 3.0;
    static final double ARCHETYPE_WEIGHT = 3.0;
    static final double VISIBLE_WEIGHT = 0.8;

    private static final int MAX_TEXT_HINT_LENGTH = 140;
    private static final int MAX_ARCHETYPE_TEXT_LENGTH = 60;

    private static final Set<String> SKIPPED_TAGS = Set.of("body", "html", "script", "style", "noscript", "template", "head", "svg", "path");
    private static final List<String> TEST_ATTRIBUTES = List.of("data-testid", "data-test-id", "data-test", "data-qa", "data-cy", "data-field");

    /**
     * Landmark and widget hints mapped to the tags that implement them natively.
     */
    private static final Map<String, Set<String>> ROLE_TAGS = Map.ofEntries(
            Map.entry("button", Set.of("button")),
            Map.entry("link", Set.of("a")),
            Map.entry("heading", Set.of("h1", "h2", "h3", "h4", "h5", "h6")),
            Map.entry("main", Set.of("main")),
            Map.entry("navigation", Set.of("nav")),
            Map.entry("banner", Set.of("header")),
            Map.entry("contentinfo", Set.of("footer")),
            Map.entry("complementary", Set.of("aside")),
            Map.entry("article", Set.of("article")),
            Map.entry("list", Set.of("ul", "ol")),
            Map.entry("listitem", Set.of("li")),
            Map.entry("table", Set.of("table")),
            Map.entry("textbox", Set.of("input", "textarea")),
            Map.entry("img", Set.of("img")),
            Map.entry("form", Set.of("form"))
    );

    @Override
    public StrategyTag tag() {
        return StrategyTag.SEMANTIC;
    }

    @Override
    public Optional<Resolution> attempt(ResolutionContext context) {
        LogicalTarget target = context.target();
        List<String> tokens = Tokens.tokenize(target.getLogicalName() + " " + target.getSemanticHint());
        FieldArchetype archetype = FieldArchetype.of(target);
        String roleHint = lower(target.getSemanticHint()).trim();
        String textHint = lower(target.getTextHint()).trim();
        double threshold = context.settings().getSimilarityThreshold();

        List<ScoredNode> scored = new ArrayList<>();
        for (PageNode node : context.tree().nodes()) {
            if (!node.isVisible() || SKIPPED_TAGS.contains(node.getTagName())) {
                continue;
            }
            double score = score(node, tokens, archetype, roleHint, textHint);
            if (score >= threshold && score > 0.0) {
                scored.add(new ScoredNode(node, CONFIDENCE_CEILING * score / (score + threshold)));
            }
        }
        return CandidateRanking.resolveBest(context, scored, StrategyTag.SEMANTIC);
    }

    double score(PageNode node, List<String> tokens, FieldArchetype archetype, String roleHint, String textHint) {
        double score = 0.0;

        String id = lower(node.getId());
        String classes = lower(node.getCssClasses());
        String name = lower(node.getName());
        String role = node.getRole();
        String itemprop = lower(node.attribute("itemprop"));
        String ariaLabel = lower(node.getAriaLabel());
        String testValue = testAttributeValue(node);

        for (String token : tokens) {
            if (id.contains(token)) {
                score += ID_WEIGHT;
            }
            if (classes.contains(token)) {
                score += CLASS_WEIGHT;
            }
            if (itemprop.contains(token)) {
                score += ITEMPROP_WEIGHT;
            }
            if (testValue.contains(token)) {
                score += TEST_ATTRIBUTE_WEIGHT;
            }
            if (name.contains(token)) {
                score += NAME_WEIGHT;
            }
            if (ariaLabel.contains(token)) {
                score += ARIA_LABEL_WEIGHT;
            }
            if (role.contains(token)) {
                score += ROLE_TOKEN_WEIGHT;
            }
            if (node.getTagName().equals(token)) {
                score += TAG_WEIGHT;
            }
        }

        if (!roleHint.isEmpty()) {
            Set<String> nativeTags = ROLE_TAGS.getOrDefault(roleHint, Set.of());
            if (role.equals(roleHint) || nativeTags.contains(node.getTagName())) {
                score += ROLE_HINT_WEIGHT;
            }
        }

        String text = lower(node.getText());
        if (!textHint.isEmpty() && text.length() <= MAX_TEXT_HINT_LENGTH && text.contains(textHint)) {
            score += TEXT_HINT_WEIGHT;
        }

        if (archetype != FieldArchetype.NONE) {
            String own = node.getOwnText();
            String candidateText = !own.isEmpty() ? own : (node.getText().length() <= MAX_ARCHETYPE_TEXT_LENGTH ? node.getText() : "");
            if (archetype.matches(candidateText) || archetype.matches(node.getAriaLabel())) {
                score += ARCHETYPE_WEIGHT;
            }
        }

        if (score > 0.0 && node.isVisible()) {
            score += VISIBLE_WEIGHT;
        }
        return score;
    }

    private static String testAttributeValue(PageNode node) {
        for (String attr : TEST_ATTRIBUTES) {
            String v = node.attribute(attr);
            if (!v.isEmpty()) {
                return lower(v);
            }
        }
        return "";
    }

    private static String lower(String v) {
        return v == null ? "" : v.toLowerCase(Locale.ROOT);
    }
}
