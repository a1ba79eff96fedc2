package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.cache.SelectorCache;
import io.hearthwarrio.pagelens.core.cache.SelectorCacheEntry;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a {@link ResolutionStrategy} may look at while resolving one target on one page.
 * <p>
 * The cache entry and the DOM snapshot are loaded lazily and at most once. Instances are confined to the resolving
 * thread.
 */
public final class ResolutionContext {

    private final PageProvider provider;
    private final PageHandle page;
    private final String site;
    private final LogicalTarget target;
    private final ResolverSettings settings;
    private final SelectorCache cache;

    private Optional<SelectorCacheEntry> cachedEntry;
    private DomTree tree;

    public ResolutionContext(
            PageProvider provider,
            PageHandle page,
            String site,
            LogicalTarget target,
            ResolverSettings settings,
            SelectorCache cache
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.site = Objects.requireNonNull(site, "site must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public PageProvider provider() {
        return provider;
    }

    public PageHandle page() {
        return page;
    }

    public String site() {
        return site;
    }

    public LogicalTarget target() {
        return target;
    }

    public ResolverSettings settings() {
        return settings;
    }

    /**
     * @return unexpired cache entry for this target, looked up once
     */
    public Optional<SelectorCacheEntry> cachedEntry() {
        if (cachedEntry == null) {
            cachedEntry = cache.entry(site, target.getLogicalName());
        }
        return cachedEntry;
    }

    /**
     * Drops the cache entry of this target. The entry read by {@link #cachedEntry()} stays visible to the
     * remaining tiers of this resolution.
     *
     * @return true when an entry was removed
     */
    public boolean invalidateCachedEntry() {
        return cache.invalidate(site, target.getLogicalName());
    }

    /**
     * DOM depth of the node the cache last pointed at, used to break ties between equally confident candidates.
     *
     * @return depth, or -1 when there is no usable cache entry
     */
    public int previousDepth() {
        return cachedEntry().map(e -> e.getCandidate().getNodeDepth()).orElse(-1);
    }

    /**
     * Snapshot of the page bounded by {@link ResolverSettings#getMaxCandidates()}.
     */
    public DomTree tree() {
        if (tree == null) {
            tree = new DomTree(provider.snapshot(page, settings.getMaxCandidates()));
        }
        return tree;
    }

    /**
     * @return first visible node matched by the locator
     */
    public Optional<PageNode> verify(Locator locator) {
        return firstMatch(locator, true);
    }

    /**
     * @param requireVisible whether invisible matches are skipped
     * @return first node matched by the locator
     */
    public Optional<PageNode> firstMatch(Locator locator, boolean requireVisible) {
        List<PageNode> matches = provider.evaluate(page, locator);
        for (PageNode n : matches) {
            if (!requireVisible || n.isVisible()) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }
}
