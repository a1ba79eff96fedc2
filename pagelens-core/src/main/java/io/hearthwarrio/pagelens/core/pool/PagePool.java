package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.PoolExhaustedException;
import io.hearthwarrio.pagelens.core.TaskTimeoutException;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded set of pages addressed by tab id.
 * <p>
 * Invariants:
 * <ul>
 *   <li>at most {@code maxTabs} pages are idle or active at any time;</li>
 *   <li>an active page belongs to exactly one caller until it is released;</li>
 *   <li>only idle pages are evicted, least recently used first.</li>
 * </ul>
 * When the pool is full and every page is active, {@link #acquire(String)} waits until a page is released or the
 * acquire timeout elapses, then fails with {@link PoolExhaustedException}.
 */
public class PagePool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PagePool.class);

    private final PageProvider provider;
    private final int maxTabs;
    private final Duration acquireTimeout;
    private final Clock clock;
    private final Consumer<PageHandle> onOpen;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, PooledPage> pages = new LinkedHashMap<>();
    private long sequence;
    private boolean closed;

    public PagePool(PageProvider provider, int maxTabs, Duration acquireTimeout) {
        this(provider, maxTabs, acquireTimeout, Clock.systemUTC(), handle -> {
        });
    }

    /**
     * @param provider       opens and closes the underlying pages
     * @param maxTabs        capacity, at least 1
     * @param acquireTimeout default wait for {@link #acquire(String)}
     * @param clock          source of {@link PooledPage#getLastUsedAt()}
     * @param onOpen         invoked once for every newly opened page (stealth, network observation)
     */
    public PagePool(PageProvider provider, int maxTabs, Duration acquireTimeout, Clock clock, Consumer<PageHandle> onOpen) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        if (maxTabs < 1) {
            throw new IllegalArgumentException("maxTabs must be at least 1: " + maxTabs);
        }
        this.maxTabs = maxTabs;
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.onOpen = Objects.requireNonNull(onOpen, "onOpen must not be null");
    }

    public int maxTabs() {
        return maxTabs;
    }

    public PageProvider provider() {
        return provider;
    }

    public PooledPage acquire(String tabId) {
        return acquire(tabId, acquireTimeout);
    }

    /**
     * Returns the page for {@code tabId} in state {@link PageState#ACTIVE}, opening it if needed.
     *
     * @throws PoolExhaustedException when no page becomes available within {@code timeout}
     * @throws TaskTimeoutException   when the calling thread is interrupted while waiting
     */
    public PooledPage acquire(String tabId, Duration timeout) {
        Objects.requireNonNull(tabId, "tabId must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        PooledPage reserved;
        PooledPage evicted = null;
        long nanos = timeout.toNanos();

        lock.lock();
        try {
            while (true) {
                if (closed) {
                    throw new IllegalStateException("page pool is closed");
                }
                PooledPage existing = pages.get(tabId);
                if (existing != null) {
                    if (existing.getState() == PageState.IDLE) {
                        existing.setState(PageState.ACTIVE);
                        existing.touch(clock.instant(), ++sequence);
                        return existing;
                    }
                } else if (pages.size() < maxTabs) {
                    reserved = reserve(tabId);
                    break;
                } else {
                    PooledPage victim = leastRecentlyUsedIdle();
                    if (victim != null) {
                        victim.setState(PageState.CLOSING);
                        pages.remove(victim.getTabId());
                        evicted = victim;
                        reserved = reserve(tabId);
                        break;
                    }
                }

                if (nanos <= 0L) {
                    throw new PoolExhaustedException("No page available for tab '" + tabId + "' within "
                            + timeout.toMillis() + "ms (max_tabs=" + maxTabs + ")");
                }
                try {
                    nanos = changed.awaitNanos(nanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TaskTimeoutException("Interrupted while waiting for tab '" + tabId + "'");
                }
            }
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            logger.debug("Evicting idle tab '{}' to make room for '{}'", evicted.getTabId(), tabId);
            closeQuietly(evicted);
        }
        return open(reserved);
    }

    /**
     * Acquires {@code tabId} and wraps it in a lease that releases on close.
     */
    public PageLease lease(String tabId) {
        return new PageLease(this, acquire(tabId));
    }

    public PageLease lease(String tabId, Duration timeout) {
        return new PageLease(this, acquire(tabId, timeout));
    }

    /**
     * Returns an active page to idle. Unknown or already idle tabs are ignored.
     */
    public void release(String tabId) {
        lock.lock();
        try {
            PooledPage page = pages.get(tabId);
            if (page == null || page.getState() != PageState.ACTIVE) {
                logger.debug("Ignoring release of tab '{}' (not active)", tabId);
                return;
            }
            page.setState(PageState.IDLE);
            page.touch(clock.instant(), ++sequence);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes an idle tab.
     *
     * @return false when the tab is unknown or currently active
     */
    public boolean closeTab(String tabId) {
        PooledPage page;
        lock.lock();
        try {
            page = pages.get(tabId);
            if (page == null || page.getState() != PageState.IDLE) {
                return false;
            }
            page.setState(PageState.CLOSING);
            pages.remove(tabId);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        closeQuietly(page);
        return true;
    }

    /**
     * @return snapshot of the pool's pages in insertion order
     */
    public List<PooledPage> pages() {
        lock.lock();
        try {
            return List.copyOf(pages.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pages.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every page, active ones included, and rejects further acquires.
     */
    @Override
    public void close() {
        List<PooledPage> toClose;
        lock.lock();
        try {
            closed = true;
            toClose = new ArrayList<>(pages.values());
            for (PooledPage p : toClose) {
                p.setState(PageState.CLOSING);
            }
            pages.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        for (PooledPage p : toClose) {
            closeQuietly(p);
        }
    }

    private PooledPage reserve(String tabId) {
        PooledPage page = new PooledPage(tabId, PageState.ACTIVE, clock.instant(), ++sequence);
        pages.put(tabId, page);
        return page;
    }

    private PooledPage open(PooledPage reserved) {
        PageHandle handle = null;
        try {
            handle = provider.open(PageProvider.BLANK_URL);
            onOpen.accept(handle);
            reserved.setHandle(handle);
            logger.debug("Opened tab '{}' ({})", reserved.getTabId(), handle.id());
            return reserved;
        } catch (RuntimeException e) {
            if (handle != null) {
                try {
                    provider.close(handle);
                } catch (RuntimeException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            lock.lock();
            try {
                if (pages.get(reserved.getTabId()) == reserved) {
                    pages.remove(reserved.getTabId());
                }
                changed.signalAll();
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }

    private PooledPage leastRecentlyUsedIdle() {
        PooledPage lru = null;
        for (PooledPage p : pages.values()) {
            if (p.getState() == PageState.IDLE && (lru == null || p.getLastUsedSequence() < lru.getLastUsedSequence())) {
                lru = p;
            }
        }
        return lru;
    }

    private void closeQuietly(PooledPage page) {
        PageHandle handle = page.getHandle();
        if (handle == null) {
            return;
        }
        try {
            provider.close(handle);
        } catch (RuntimeException e) {
            logger.warn("Failed to close tab '{}': {}", page.getTabId(), e.getMessage());
        }
    }
}
