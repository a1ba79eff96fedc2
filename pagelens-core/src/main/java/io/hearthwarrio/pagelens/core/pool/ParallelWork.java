package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.page.PageHandle;

/**
 * Unit of work run against one already navigated page.
 */
@FunctionalInterface
public interface ParallelWork<T> {

    T apply(PageHandle page, String url) throws Exception;
}
