package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class BrowserSettings {

    @JsonProperty("engine")
    private String engine = "chrome";
    @JsonProperty("headless")
    private boolean headless = true;
    @JsonProperty("executable_path")
    private String executablePath = "";
    @JsonProperty("remote_url")
    private String remoteUrl = "";
    @JsonProperty("user_agent")
    private String userAgent = "";
    @JsonProperty("max_tabs")
    private int maxTabs = 2;
    @JsonProperty("navigation_timeout_ms")
    private int navigationTimeoutMs = 45000;
    @JsonProperty("acquire_timeout_ms")
    private int acquireTimeoutMs = 30000;
    @JsonProperty("launch_args")
    private List<String> launchArgs = new ArrayList<>();

    void validate() {
        engine = engine == null || engine.isBlank() ? "chrome" : engine.trim().toLowerCase(Locale.ROOT);
        maxTabs = Math.max(1, maxTabs);
        navigationTimeoutMs = Math.max(5000, navigationTimeoutMs);
        acquireTimeoutMs = Math.max(100, acquireTimeoutMs);
        executablePath = executablePath == null ? "" : executablePath.trim();
        remoteUrl = remoteUrl == null ? "" : remoteUrl.trim();
        userAgent = userAgent == null ? "" : userAgent.trim();
        launchArgs = launchArgs == null ? new ArrayList<>() : launchArgs;
    }

    /**
     * @return {@code chrome} for a real browser or {@code static} for the jsoup engine
     */
    public String getEngine() {
        return engine;
    }

    public boolean isHeadless() {
        return headless;
    }

    public String getExecutablePath() {
        return executablePath;
    }

    /**
     * @return Selenium Grid URL; empty for a local browser
     */
    public String getRemoteUrl() {
        return remoteUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getMaxTabs() {
        return maxTabs;
    }

    public int getNavigationTimeoutMs() {
        return navigationTimeoutMs;
    }

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public List<String> getLaunchArgs() {
        return launchArgs;
    }
}
