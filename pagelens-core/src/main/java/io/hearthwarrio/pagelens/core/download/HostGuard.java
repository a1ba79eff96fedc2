package io.hearthwarrio.pagelens.core.download;

import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.NavigationException;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects download URLs that are not plain http(s) or that resolve to loopback, private, link-local or otherwise
 * non-public addresses.
 */
public class HostGuard {

    static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final boolean allowPrivateHosts;

    public HostGuard(boolean allowPrivateHosts) {
        this.allowPrivateHosts = allowPrivateHosts;
    }

    /**
     * @throws InvalidTaskException for a disallowed scheme, a missing host or a non-public address
     * @throws NavigationException  when the host cannot be resolved
     */
    public void check(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidTaskException("download URL is malformed: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            throw new InvalidTaskException("URL scheme '" + scheme + "' is not allowed for downloads; use http or https");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new InvalidTaskException("download URL has no host: " + url);
        }
        if (allowPrivateHosts) {
            return;
        }
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new NavigationException(url, "unknown host '" + host + "'", e);
        }
        for (InetAddress address : addresses) {
            if (!isPublic(address)) {
                throw new InvalidTaskException("download URL resolves to a non-public address: " + address.getHostAddress());
            }
        }
    }

    static boolean isPublic(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isAnyLocalAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return false;
        }
        byte[] raw = address.getAddress();
        if (raw.length == 4) {
            int first = raw[0] & 0xff;
            int second = raw[1] & 0xff;
            // 0.0.0.0/8, 100.64.0.0/10 (carrier-grade NAT), 240.0.0.0/4
            return first != 0 && !(first == 100 && (second & 0xc0) == 64) && first < 240;
        }
        // fc00::/7 unique local
        return (raw[0] & 0xfe) != 0xfc;
    }
}
