package io.hearthwarrio.pagelens.core.pool;

import java.util.Objects;

/**
 * Result of one unit of a parallel run: either a value or the failure that ended it.
 */
public final class UrlOutcome<T> {

    private final String url;
    private final String tabId;
    private final T value;
    private final Throwable error;

    private UrlOutcome(String url, String tabId, T value, Throwable error) {
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.tabId = tabId;
        this.value = value;
        this.error = error;
    }

    public static <T> UrlOutcome<T> success(String url, String tabId, T value) {
        return new UrlOutcome<>(url, tabId, value, null);
    }

    public static <T> UrlOutcome<T> failure(String url, String tabId, Throwable error) {
        return new UrlOutcome<>(url, tabId, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public String getUrl() {
        return url;
    }

    public String getTabId() {
        return tabId;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "UrlOutcome{" +
                "url='" + url + '\'' +
                ", tabId='" + tabId + '\'' +
                (error == null ? ", value=" + value : ", error=" + error) +
                '}';
    }
}
