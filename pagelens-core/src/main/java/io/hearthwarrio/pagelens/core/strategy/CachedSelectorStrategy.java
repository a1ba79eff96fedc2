package io.hearthwarrio.pagelens.core.strategy;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionContext;
import io.hearthwarrio.pagelens.core.ResolutionStrategy;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.cache.SelectorCacheEntry;
import io.hearthwarrio.pagelens.core.page.PageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Replays the locator that last resolved this target on this site.
 * <p>
 * With {@code verify_cached} enabled (default) the locator must still match a visible node; otherwise any match is
 * accepted. An entry that no longer matches is invalidated so it is not replayed again.
 */
public final class CachedSelectorStrategy implements ResolutionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(CachedSelectorStrategy.class);

    @Override
    public StrategyTag tag() {
        return StrategyTag.CACHED;
    }

    @Override
    public Optional<Resolution> attempt(ResolutionContext context) {
        Optional<SelectorCacheEntry> entry = context.cachedEntry();
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        LocatorCandidate cached = entry.get().getCandidate();
        Optional<PageNode> node = context.firstMatch(cached.getLocator(), context.settings().isVerifyCached());
        if (node.isEmpty()) {
            context.invalidateCachedEntry();
            logger.debug("Cached locator {} of '{}' no longer matches on {}, entry dropped",
                    cached.getLocator(), context.target().getLogicalName(), context.site());
            return Optional.empty();
        }
        return node.map(n -> new Resolution(
                context.target(),
                new LocatorCandidate(cached.getLocator(), StrategyTag.CACHED, cached.getConfidence(), n.getDepth()),
                n
        ));
    }
}
