package io.hearthwarrio.pagelens.core;

import java.util.List;
import java.util.Objects;

/**
 * Per-call tunables of the {@link SelectorResolver}.
 */
public final class ResolverSettings {

    public static final List<StrategyTag> DEFAULT_ORDER =
            List.of(StrategyTag.DIRECT, StrategyTag.CACHED, StrategyTag.TEXT, StrategyTag.SEMANTIC);

    private final List<StrategyTag> strategies;
    private final double similarityThreshold;
    private final int maxCandidates;
    private final boolean verifyCached;

    /**
     * @param strategies          enabled strategies; they always run in the canonical tier order
     * @param similarityThreshold minimum raw score of a semantic match
     * @param maxCandidates       snapshot bound for text and semantic matching
     * @param verifyCached        when false a cached locator only needs to match, visible or not
     */
    public ResolverSettings(List<StrategyTag> strategies, double similarityThreshold, int maxCandidates, boolean verifyCached) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        this.strategies = DEFAULT_ORDER.stream().filter(strategies::contains).toList();
        this.similarityThreshold = similarityThreshold;
        this.maxCandidates = Math.max(1, maxCandidates);
        this.verifyCached = verifyCached;
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(DEFAULT_ORDER, 3.5, 1800, true);
    }

    public List<StrategyTag> getStrategies() {
        return strategies;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public boolean isVerifyCached() {
        return verifyCached;
    }

    @Override
    public String toString() {
        return "ResolverSettings{" +
                "strategies=" + strategies +
                ", similarityThreshold=" + similarityThreshold +
                ", maxCandidates=" + maxCandidates +
                ", verifyCached=" + verifyCached +
                '}';
    }
}
