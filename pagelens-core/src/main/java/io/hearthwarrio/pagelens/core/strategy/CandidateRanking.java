package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionContext;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Orders scored nodes and turns the best verifiable one into a {@link Resolution}.
 * <p>
 * Order: higher confidence first, then the smallest depth distance to the previously cached node, then document
 * order.
 */
public final class CandidateRanking {

    /**
     * How many of the top-ranked nodes are checked against the live page before giving up.
     */
    static final int MAX_VERIFIED = 5;

    private CandidateRanking() {
    }

    public static Comparator<ScoredNode> comparator(int previousDepth) {
        return Comparator.comparingDouble(ScoredNode::getConfidence).reversed()
                .thenComparingInt(s -> previousDepth < 0 ? 0 : Math.abs(s.getNode().getDepth() - previousDepth))
                .thenComparingInt(s -> s.getNode().getIndex());
    }

    public static List<ScoredNode> rank(List<ScoredNode> scored, int previousDepth) {
        List<ScoredNode> sorted = new ArrayList<>(scored);
        sorted.sort(comparator(previousDepth));
        return sorted;
    }

    /**
     * Ranks {@code scored} and returns the first node whose generated locator resolves back to that same node.
     */
    static Optional<Resolution> resolveBest(ResolutionContext context, List<ScoredNode> scored, StrategyTag tag) {
        if (scored.isEmpty()) {
            return Optional.empty();
        }
        DomTree tree = context.tree();
        List<ScoredNode> ranked = rank(scored, context.previousDepth());
        int checked = 0;
        for (ScoredNode candidate : ranked) {
            if (checked++ == MAX_VERIFIED) {
                break;
            }
            PageNode node = candidate.getNode();
            for (Locator locator : List.of(Locator.css(tree.cssPath(node)), Locator.xpath(tree.xPath(node)))) {
                Optional<PageNode> verified = context.verify(locator);
                if (verified.isPresent() && verified.get().getIndex() == node.getIndex()) {
                    PageNode live = verified.get();
                    LocatorCandidate c = new LocatorCandidate(locator, tag, candidate.getConfidence(), live.getDepth());
                    return Optional.of(new Resolution(context.target(), c, live));
                }
            }
        }
        return Optional.empty();
    }
}
