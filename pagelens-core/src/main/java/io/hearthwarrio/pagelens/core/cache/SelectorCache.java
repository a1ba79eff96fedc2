package io.hearthwarrio.pagelens.core.cache;

import io.hearthwarrio.pagelens.core.LocatorCandidate;

import java.util.Optional;

/**
 * Per-site memory of the locators that last resolved each logical name.
 * <p>
 * Contract:
 * <ul>
 *   <li>{@link #get} never throws for missing or expired entries.</li>
 *   <li>{@link #put} replaces the entry as a whole; concurrent writers resolve last-write-wins.</li>
 *   <li>Expiry is evaluated lazily at read time.</li>
 * </ul>
 */
public interface SelectorCache {

    /**
     * @return the cached candidate when present and not expired
     */
    default Optional<LocatorCandidate> get(String site, String logicalName) {
        return entry(site, logicalName).map(SelectorCacheEntry::getCandidate);
    }

    /**
     * @return the full entry when present and not expired
     */
    Optional<SelectorCacheEntry> entry(String site, String logicalName);

    /**
     * Stores {@code candidate} as the latest verified locator, stamping it with the current time.
     */
    void put(String site, String logicalName, LocatorCandidate candidate);

    /**
     * @return true when an entry was removed
     */
    boolean invalidate(String site, String logicalName);

    /**
     * Cache that remembers nothing.
     */
    static SelectorCache disabled() {
        return new SelectorCache() {
            @Override
            public Optional<SelectorCacheEntry> entry(String site, String logicalName) {
                return Optional.empty();
            }

            @Override
            public void put(String site, String logicalName, LocatorCandidate candidate) {
            }

            @Override
            public boolean invalidate(String site, String logicalName) {
                return false;
            }
        };
    }
}
