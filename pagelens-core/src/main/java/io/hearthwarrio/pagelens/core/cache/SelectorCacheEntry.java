package io.hearthwarrio.pagelens.core.cache;

import io.hearthwarrio.pagelens.core.LocatorCandidate;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Last successful locator for a {@code (site, logical name)} pair.
 * <p>
 * Entries are immutable; the cache replaces them as a whole.
 */
public final class SelectorCacheEntry {

    private final String site;
    private final String logicalName;
    private final LocatorCandidate candidate;
    private final long hitCount;
    private final Instant lastVerifiedAt;

    public SelectorCacheEntry(
            String site,
            String logicalName,
            LocatorCandidate candidate,
            long hitCount,
            Instant lastVerifiedAt
    ) {
        this.site = Objects.requireNonNull(site, "site must not be null");
        this.logicalName = Objects.requireNonNull(logicalName, "logicalName must not be null");
        this.candidate = Objects.requireNonNull(candidate, "candidate must not be null");
        this.hitCount = Math.max(0, hitCount);
        this.lastVerifiedAt = Objects.requireNonNull(lastVerifiedAt, "lastVerifiedAt must not be null");
    }

    public String getSite() {
        return site;
    }

    public String getLogicalName() {
        return logicalName;
    }

    public LocatorCandidate getCandidate() {
        return candidate;
    }

    /**
     * Number of times the same locator was confirmed again after it was first stored.
     */
    public long getHitCount() {
        return hitCount;
    }

    public Instant getLastVerifiedAt() {
        return lastVerifiedAt;
    }

    /**
     * An entry is expired once strictly more than {@code ttl} has elapsed since its last verification.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(lastVerifiedAt, now).compareTo(ttl) > 0;
    }

    @Override
    public String toString() {
        return "SelectorCacheEntry{" +
                "site='" + site + '\'' +
                ", logicalName='" + logicalName + '\'' +
                ", candidate=" + candidate +
                ", hitCount=" + hitCount +
                ", lastVerifiedAt=" + lastVerifiedAt +
                '}';
    }
}
