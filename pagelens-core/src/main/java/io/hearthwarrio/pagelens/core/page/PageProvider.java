package io.hearthwarrio.pagelens.core.page;

import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.UnsupportedCapabilityException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Page engine abstraction (browser or static HTML).
 * <p>
 * Implementations must be safe to call concurrently for <b>different</b> handles. A single handle is never used
 * by two threads at once (the page pool guarantees that).
 */
public interface PageProvider {

    /**
     * URL opened for freshly created pool pages.
     */
    String BLANK_URL = "about:blank";

    /**
     * Opens a new page and navigates it to {@code url}.
     *
     * @param url target URL, {@link #BLANK_URL} for an empty page
     * @return handle of the new page
     * @throws NavigationException when the page cannot be opened or loaded
     */
    PageHandle open(String url);

    /**
     * Navigates an existing page.
     *
     * @throws NavigationException when loading fails or times out
     */
    void navigate(PageHandle page, String url);

    String currentUrl(PageHandle page);

    /**
     * @return document title or empty string
     */
    String title(PageHandle page);

    /**
     * Evaluates a locator and returns all matching elements in document order.
     *
     * @return matching nodes; empty when nothing matches or the locator is invalid for this engine
     */
    List<PageNode> evaluate(PageHandle page, Locator locator);

    /**
     * Snapshots the elements of {@code body} in document order.
     *
     * @param maxNodes upper bound on returned nodes, the tail of the document is dropped first
     */
    List<PageNode> snapshot(PageHandle page, int maxNodes);

    /**
     * Opens a text cursor over the first element matched by {@code scope}.
     *
     * @param scope region to read; {@code null} means the whole body
     * @return cursor, exhausted immediately when the scope matches nothing
     */
    TextCursor openText(PageHandle page, Locator scope);

    void close(PageHandle page);

    /**
     * Cookies visible to the page's current URL, name to value. Used to authenticate downloads made outside the page.
     *
     * @return cookies, empty when the engine keeps none
     */
    default Map<String, String> cookies(PageHandle page) {
        return Collections.emptyMap();
    }

    /**
     * Exports cookies and storage of the page as an opaque blob.
     */
    default byte[] exportState(PageHandle page) {
        throw new UnsupportedCapabilityException(getClass().getSimpleName() + " does not support session export");
    }

    /**
     * Restores a blob produced by {@link #exportState(PageHandle)}.
     */
    default void importState(PageHandle page, byte[] state) {
        throw new UnsupportedCapabilityException(getClass().getSimpleName() + " does not support session import");
    }
}
