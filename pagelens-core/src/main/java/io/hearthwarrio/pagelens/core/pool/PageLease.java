package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.page.PageHandle;

/**
 * Exclusive use of one pooled page; closing the lease releases the page back to idle.
 */
public final class PageLease implements AutoCloseable {

    private final PagePool pool;
    private final PooledPage page;
    private boolean released;

    PageLease(PagePool pool, PooledPage page) {
        this.pool = pool;
        this.page = page;
    }

    public String tabId() {
        return page.getTabId();
    }

    public PageHandle handle() {
        return page.getHandle();
    }

    public PooledPage page() {
        return page;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            pool.release(page.getTabId());
        }
    }
}
