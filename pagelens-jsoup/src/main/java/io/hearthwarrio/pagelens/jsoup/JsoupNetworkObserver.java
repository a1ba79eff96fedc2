package io.hearthwarrio.pagelens.jsoup;

import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.NetworkObserver;
import io.hearthwarrio.pagelens.core.page.PageHandle;

/**
 * Exposes the document requests {@link JsoupPageProvider} records while fetching. Sub-resources are never loaded,
 * so only {@code document} events appear.
 */
public class JsoupNetworkObserver implements NetworkObserver {

    @Override
    public NetworkLog record(PageHandle page) {
        return JsoupPage.of(page).getNetworkLog();
    }
}
