package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.strategy.CachedSelectorStrategy;
import io.hearthwarrio.pagelens.core.strategy.DirectSelectorStrategy;
import io.hearthwarrio.pagelens.core.strategy.SemanticMatchStrategy;
import io.hearthwarrio.pagelens.core.strategy.TextMatchStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Utility methods for building and normalizing {@link ResolutionStrategy} chains.
 */
public final class ResolutionStrategies {

    private ResolutionStrategies() {
    }

    /**
     * The four built-in tiers in canonical order.
     */
    public static List<ResolutionStrategy> defaults() {
        return List.of(
                new DirectSelectorStrategy(),
                new CachedSelectorStrategy(),
                new TextMatchStrategy(),
                new SemanticMatchStrategy()
        );
    }

    /**
     * Normalizes a strategy list:
     * <ul>
     *   <li>removes null entries</li>
     *   <li>orders by tier ({@link StrategyTag} ordinal)</li>
     *   <li>keeps one strategy per tier (first one wins)</li>
     * </ul>
     *
     * @param strategies input list (may be null)
     * @return normalized immutable list
     */
    public static List<ResolutionStrategy> normalize(List<? extends ResolutionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            return List.of();
        }
        Map<StrategyTag, ResolutionStrategy> byTag = new EnumMap<>(StrategyTag.class);
        for (ResolutionStrategy s : strategies) {
            if (s != null && !byTag.containsKey(s.tag())) {
                byTag.put(s.tag(), s);
            }
        }
        List<ResolutionStrategy> ordered = new ArrayList<>(byTag.values());
        ordered.sort(Comparator.comparingInt(s -> s.tag().ordinal()));
        return List.copyOf(ordered);
    }
}
