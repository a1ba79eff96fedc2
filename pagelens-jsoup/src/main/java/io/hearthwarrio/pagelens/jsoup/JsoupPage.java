package io.hearthwarrio.pagelens.jsoup;

import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.jsoup.nodes.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Page handle of {@link JsoupPageProvider}: the last fetched document, its cookies and its request log.
 */
public final class JsoupPage implements PageHandle {

    private final String id;
    private final NetworkLog networkLog = new NetworkLog();
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private volatile String url;
    private volatile Document document;

    JsoupPage(String id, String url, Document document) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.url = url;
        this.document = document;
    }

    static JsoupPage of(PageHandle handle) {
        if (handle instanceof JsoupPage) {
            return (JsoupPage) handle;
        }
        throw new IllegalArgumentException("not a jsoup page: " + handle);
    }

    @Override
    public String id() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public Document getDocument() {
        return document;
    }

    void load(String url, Document document) {
        this.url = url;
        this.document = document;
    }

    NetworkLog getNetworkLog() {
        return networkLog;
    }

    Map<String, String> getCookies() {
        return cookies;
    }

    @Override
    public String toString() {
        return id;
    }
}
