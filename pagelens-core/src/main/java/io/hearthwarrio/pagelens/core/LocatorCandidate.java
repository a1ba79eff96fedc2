package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.page.Locator;

import java.util.Objects;

/**
 * A concrete locator produced by one resolution tier.
 */
public final class LocatorCandidate {

    private final Locator locator;
    private final StrategyTag strategy;
    private final double confidence;
    private final int nodeDepth;

    /**
     * @param locator    engine-executable locator
     * @param strategy   tier that produced it
     * @param confidence value in [0, 1]
     * @param nodeDepth  DOM depth of the matched node, -1 when unknown
     */
    public LocatorCandidate(Locator locator, StrategyTag strategy, double confidence, int nodeDepth) {
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.confidence = confidence;
        this.nodeDepth = nodeDepth;
    }

    public Locator getLocator() {
        return locator;
    }

    public StrategyTag getStrategy() {
        return strategy;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getNodeDepth() {
        return nodeDepth;
    }

    /**
     * Same locator and confidence re-labelled with another tier.
     */
    public LocatorCandidate withStrategy(StrategyTag strategy) {
        return new LocatorCandidate(locator, strategy, confidence, nodeDepth);
    }

    public LocatorCandidate withNodeDepth(int nodeDepth) {
        return new LocatorCandidate(locator, strategy, confidence, nodeDepth);
    }

    @Override
    public String toString() {
        return "LocatorCandidate{" +
                "locator=" + locator +
                ", strategy=" + strategy.wireName() +
                ", confidence=" + confidence +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocatorCandidate)) {
            return false;
        }
        LocatorCandidate that = (LocatorCandidate) o;
        return Double.compare(that.confidence, confidence) == 0
                && nodeDepth == that.nodeDepth
                && locator.equals(that.locator)
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(locator, strategy, confidence, nodeDepth);
    }
}
