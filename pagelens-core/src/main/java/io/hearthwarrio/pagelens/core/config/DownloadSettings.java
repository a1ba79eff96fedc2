package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DownloadSettings {

    @JsonProperty("directory")
    private String directory = "./downloads";
    @JsonProperty("timeout_ms")
    private int timeoutMs = 120000;
    @JsonProperty("max_bytes")
    private long maxBytes = 100L * 1024 * 1024;
    /**
     * Lets downloads reach loopback and private network addresses. Off unless the agent runs against a local host.
     */
    @JsonProperty("allow_private_hosts")
    private boolean allowPrivateHosts = false;

    void validate() {
        directory = directory == null || directory.isBlank() ? "./downloads" : directory.trim();
        timeoutMs = Math.max(1000, timeoutMs);
        maxBytes = Math.max(1024, maxBytes);
    }

    public String getDirectory() {
        return directory;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public boolean isAllowPrivateHosts() {
        return allowPrivateHosts;
    }
}
