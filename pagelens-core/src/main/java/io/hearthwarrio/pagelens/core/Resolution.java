package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.Objects;

/**
 * Result of a successful resolution: the winning candidate and the first visible node it matched.
 */
public final class Resolution {

    private final LogicalTarget target;
    private final LocatorCandidate candidate;
    private final PageNode node;

    public Resolution(LogicalTarget target, LocatorCandidate candidate, PageNode node) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.candidate = Objects.requireNonNull(candidate, "candidate must not be null");
        this.node = Objects.requireNonNull(node, "node must not be null");
    }

    public LogicalTarget getTarget() {
        return target;
    }

    public LocatorCandidate getCandidate() {
        return candidate;
    }

    public PageNode getNode() {
        return node;
    }

    /**
     * @return true when the locator did not come from the caller's own selector hint
     */
    public boolean isHealed() {
        return candidate.getStrategy() != StrategyTag.DIRECT;
    }

    @Override
    public String toString() {
        return "Resolution{" +
                "target=" + target.getLogicalName() +
                ", candidate=" + candidate +
                ", node=" + node +
                '}';
    }
}
