package io.hearthwarrio.pagelens.core.task;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Derives selector cache scopes from page URLs.
 */
public final class SiteKeys {

    public static final String HOST_SCOPE = "host";
    public static final String PAGE_SCOPE = "page";
    public static final String UNKNOWN = "unknown";

    private SiteKeys() {
    }

    /**
     * @param url   current page URL
     * @param scope {@value #HOST_SCOPE} (host name only) or {@value #PAGE_SCOPE} (host plus path)
     * @return cache scope; URLs without a host (e.g. {@code about:blank}) are used without query and fragment
     */
    public static String of(String url, String scope) {
        if (url == null || url.isBlank()) {
            return UNKNOWN;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return stripQuery(url.trim());
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            return stripQuery(url.trim());
        }
        host = host.toLowerCase(Locale.ROOT);
        if (!PAGE_SCOPE.equals(scope)) {
            return host;
        }
        String path = uri.getPath();
        return host + (path == null || path.isEmpty() ? "/" : path);
    }

    private static String stripQuery(String url) {
        int cut = url.length();
        int q = url.indexOf('?');
        int f = url.indexOf('#');
        if (q >= 0) {
            cut = Math.min(cut, q);
        }
        if (f >= 0) {
            cut = Math.min(cut, f);
        }
        return url.substring(0, cut);
    }
}
