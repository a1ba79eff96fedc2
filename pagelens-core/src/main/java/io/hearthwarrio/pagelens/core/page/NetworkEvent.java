package io.hearthwarrio.pagelens.core.page;

import java.util.Objects;

/**
 * One observed request/response pair.
 */
public final class NetworkEvent {

    private final String url;
    private final String method;
    private final String resourceType;
    private final int status;
    private final long durationMillis;

    public NetworkEvent(String url, String method, String resourceType, int status, long durationMillis) {
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.method = method == null || method.isBlank() ? "GET" : method;
        this.resourceType = resourceType == null ? "" : resourceType;
        this.status = status;
        this.durationMillis = Math.max(0, durationMillis);
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public String getResourceType() {
        return resourceType;
    }

    /**
     * @return HTTP status, 0 when the engine does not expose it
     */
    public int getStatus() {
        return status;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return method + " " + url + " -> " + status + " (" + durationMillis + "ms)";
    }
}
