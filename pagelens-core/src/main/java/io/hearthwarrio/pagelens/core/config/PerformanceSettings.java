package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class PerformanceSettings {

    @JsonProperty("enable_request_blocking")
    private boolean enableRequestBlocking = true;
    @JsonProperty("block_resource_types")
    private List<String> blockResourceTypes = new ArrayList<>(List.of("image", "media", "font"));
    @JsonProperty("block_ad_domains")
    private List<String> blockAdDomains = new ArrayList<>();
    @JsonProperty("wait_after_navigation_ms")
    private int waitAfterNavigationMs = 250;

    void validate() {
        blockResourceTypes = blockResourceTypes == null ? new ArrayList<>() : blockResourceTypes;
        blockAdDomains = blockAdDomains == null ? new ArrayList<>() : blockAdDomains;
        waitAfterNavigationMs = Math.max(0, waitAfterNavigationMs);
    }

    public boolean isEnableRequestBlocking() {
        return enableRequestBlocking;
    }

    public List<String> getBlockResourceTypes() {
        return blockResourceTypes;
    }

    public List<String> getBlockAdDomains() {
        return blockAdDomains;
    }

    public int getWaitAfterNavigationMs() {
        return waitAfterNavigationMs;
    }
}
