package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionContext;
import io.hearthwarrio.pagelens.core.ResolutionStrategy;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.page.Locator;

import java.util.Optional;

/**
 * Uses the caller's raw selector hint as-is.
 */
public final class DirectSelectorStrategy implements ResolutionStrategy {

    @Override
    public StrategyTag tag() {
        return StrategyTag.DIRECT;
    }

    @Override
    public Optional<Resolution> attempt(ResolutionContext context) {
        if (!context.target().hasSelectorHint()) {
            return Optional.empty();
        }
        Locator locator = Locator.parse(context.target().getSelectorHint());
        return context.verify(locator)
                .map(node -> new Resolution(
                        context.target(),
                        new LocatorCandidate(locator, StrategyTag.DIRECT, 1.0, node.getDepth()),
                        node
                ));
    }
}
