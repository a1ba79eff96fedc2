package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.cache.SelectorCache;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Self-healing resolver: runs the enabled strategies in tier order (direct, cached, text, semantic) and returns the
 * first verified match.
 * <p>
 * On success the winning candidate is written back to the {@link SelectorCache}, unless the resolving thread was
 * interrupted in the meantime. A strategy that throws is logged and treated as "no match".
 */
public class SelectorResolver {

    private static final Logger logger = LoggerFactory.getLogger(SelectorResolver.class);

    private final PageProvider provider;
    private final SelectorCache cache;
    private final List<ResolutionStrategy> strategies;
    private final ResolutionListener listener;

    public SelectorResolver(PageProvider provider, SelectorCache cache) {
        this(provider, cache, ResolutionStrategies.defaults(), new Slf4jResolutionListener());
    }

    public SelectorResolver(
            PageProvider provider,
            SelectorCache cache,
            List<? extends ResolutionStrategy> strategies,
            ResolutionListener listener
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.strategies = ResolutionStrategies.normalize(Objects.requireNonNull(strategies, "strategies must not be null"));
        this.listener = listener == null ? ResolutionListener.none() : listener;
    }

    public SelectorCache cache() {
        return cache;
    }

    /**
     * Resolves with {@link ResolverSettings#defaults()}.
     */
    public Resolution resolve(PageHandle page, String site, LogicalTarget target) {
        return resolve(page, site, target, ResolverSettings.defaults());
    }

    /**
     * Resolves a logical target on a live page.
     *
     * @param page     page to search
     * @param site     cache scope, usually the host name
     * @param target   what to find
     * @param settings enabled strategies and thresholds
     * @return verified resolution
     * @throws SelectorResolutionException when every enabled strategy failed
     * @throws TaskTimeoutException        when the resolving thread was interrupted
     */
    public Resolution resolve(PageHandle page, String site, LogicalTarget target, ResolverSettings settings) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        ResolutionContext context = new ResolutionContext(provider, page, site, target, settings, cache);
        List<StrategyTag> attempted = new ArrayList<>();

        for (ResolutionStrategy strategy : strategies) {
            if (!settings.getStrategies().contains(strategy.tag())) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new TaskTimeoutException("Resolution of '" + target.getLogicalName() + "' was interrupted");
            }
            attempted.add(strategy.tag());

            Optional<Resolution> result;
            try {
                result = strategy.attempt(context);
            } catch (RuntimeException e) {
                logger.debug("Strategy {} failed for '{}': {}", strategy.id(), target.getLogicalName(), e.toString());
                continue;
            }

            if (result.isPresent()) {
                Resolution resolution = result.get();
                writeBack(site, target, resolution);
                listener.onResolved(site, resolution);
                return resolution;
            }
            logger.debug("Strategy {} found nothing for '{}'", strategy.id(), target.getLogicalName());
        }

        listener.onFailure(site, target, attempted);
        throw new SelectorResolutionException(target.getLogicalName(), attempted);
    }

    private void writeBack(String site, LogicalTarget target, Resolution resolution) {
        if (Thread.currentThread().isInterrupted()) {
            logger.debug("Discarding cache write for '{}': resolution was interrupted", target.getLogicalName());
            return;
        }
        try {
            cache.put(site, target.getLogicalName(), resolution.getCandidate());
        } catch (RuntimeException e) {
            logger.warn("Could not cache locator for '{}': {}", target.getLogicalName(), e.getMessage());
        }
    }
}
