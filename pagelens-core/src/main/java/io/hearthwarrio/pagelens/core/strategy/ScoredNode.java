package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.Objects;

/**
 * A snapshot node paired with the confidence a strategy assigned to it.
 */
public final class ScoredNode {

    private final PageNode node;
    private final double confidence;

    public ScoredNode(PageNode node, double confidence) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.confidence = Math.max(0.0, Math.min(1.0, Math.round(confidence * 1000.0) / 1000.0));
    }

    public PageNode getNode() {
        return node;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "ScoredNode{" + node + ", confidence=" + confidence + '}';
    }
}
