package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.page.PageHandle;

import java.time.Instant;

/**
 * A page owned by the {@link PagePool}, addressed by its tab id.
 * <p>
 * State changes happen only under the pool lock; readers outside the pool see a consistent but possibly stale view.
 */
public final class PooledPage {

    private final String tabId;
    private volatile PageHandle handle;
    private volatile PageState state;
    private volatile Instant lastUsedAt;
    private volatile long lastUsedSequence;

    PooledPage(String tabId, PageState state, Instant lastUsedAt, long lastUsedSequence) {
        this.tabId = tabId;
        this.state = state;
        this.lastUsedAt = lastUsedAt;
        this.lastUsedSequence = lastUsedSequence;
    }

    public String getTabId() {
        return tabId;
    }

    /**
     * @return the provider handle; {@code null} only while the page is still being opened
     */
    public PageHandle getHandle() {
        return handle;
    }

    public PageState getState() {
        return state;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    long getLastUsedSequence() {
        return lastUsedSequence;
    }

    void setHandle(PageHandle handle) {
        this.handle = handle;
    }

    void setState(PageState state) {
        this.state = state;
    }

    void touch(Instant at, long sequence) {
        this.lastUsedAt = at;
        this.lastUsedSequence = sequence;
    }

    @Override
    public String toString() {
        return "PooledPage{" +
                "tabId='" + tabId + '\'' +
                ", state=" + state +
                ", lastUsedAt=" + lastUsedAt +
                '}';
    }
}
