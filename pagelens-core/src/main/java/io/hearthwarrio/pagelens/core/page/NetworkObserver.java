package io.hearthwarrio.pagelens.core.page;

/**
 * Records request/response metadata for a page.
 */
public interface NetworkObserver {

    /**
     * Returns the log attached to the page, creating it on first call and bringing it up to date with traffic
     * observed since the previous call.
     */
    NetworkLog record(PageHandle page);

    /**
     * Stops observing the page and drops its log.
     */
    default void detach(PageHandle page) {
    }

    static NetworkObserver none() {
        return page -> new NetworkLog();
    }
}
