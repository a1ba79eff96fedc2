package io.hearthwarrio.pagelens.core.cache;

import io.hearthwarrio.pagelens.core.LocatorCandidate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link SelectorCache} backed by a {@link ConcurrentHashMap}, with TTL checked on read.
 * <p>
 * There is no background eviction: expired entries stay in memory until {@link #purgeExpired()} runs or the key is
 * written again.
 */
public class InMemorySelectorCache implements SelectorCache {

    private static final String KEY_SEPARATOR = "::";

    private final ConcurrentMap<String, SelectorCacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySelectorCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
    }

    static String key(String site, String logicalName) {
        return site + KEY_SEPARATOR + logicalName;
    }

    @Override
    public Optional<SelectorCacheEntry> entry(String site, String logicalName) {
        if (site == null || logicalName == null) {
            return Optional.empty();
        }
        SelectorCacheEntry entry = entries.get(key(site, logicalName));
        if (entry == null || entry.isExpired(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(String site, String logicalName, LocatorCandidate candidate) {
        Objects.requireNonNull(site, "site must not be null");
        Objects.requireNonNull(logicalName, "logicalName must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");

        Instant now = clock.instant();
        entries.compute(key(site, logicalName), (k, previous) -> {
            long hits = 0;
            if (previous != null
                    && !previous.isExpired(now, ttl)
                    && previous.getCandidate().getLocator().equals(candidate.getLocator())) {
                hits = previous.getHitCount() + 1;
            }
            return new SelectorCacheEntry(site, logicalName, candidate, hits, now);
        });
        onChange();
    }

    @Override
    public boolean invalidate(String site, String logicalName) {
        if (site == null || logicalName == null) {
            return false;
        }
        boolean removed = entries.remove(key(site, logicalName)) != null;
        if (removed) {
            onChange();
        }
        return removed;
    }

    /**
     * Drops every expired entry.
     *
     * @return number of removed entries
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now, ttl));
        int removed = before - entries.size();
        if (removed > 0) {
            onChange();
        }
        return Math.max(0, removed);
    }

    /**
     * @return snapshot of all entries, including expired ones, ordered by key
     */
    public List<SelectorCacheEntry> entries() {
        List<SelectorCacheEntry> out = new ArrayList<>(entries.values());
        out.sort(Comparator.comparing((SelectorCacheEntry e) -> e.getSite()).thenComparing(SelectorCacheEntry::getLogicalName));
        return out;
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    protected Clock clock() {
        return clock;
    }

    /**
     * Loads entries without touching their timestamps. Existing keys are replaced.
     */
    protected void restore(Collection<SelectorCacheEntry> restored) {
        for (SelectorCacheEntry e : restored) {
            entries.put(key(e.getSite(), e.getLogicalName()), e);
        }
    }

    /**
     * Hook invoked after every mutation.
     */
    protected void onChange() {
    }
}
