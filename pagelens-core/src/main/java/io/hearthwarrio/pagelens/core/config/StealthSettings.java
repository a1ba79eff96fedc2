package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public class StealthSettings {

    @JsonProperty("enabled")
    private boolean enabled = true;
    @JsonProperty("delay_range_ms")
    private DelayRange delayRangeMs = new DelayRange();
    @JsonProperty("navigator_overrides")
    private Map<String, Object> navigatorOverrides = new LinkedHashMap<>();

    void validate() {
        if (delayRangeMs == null) {
            delayRangeMs = new DelayRange();
        }
        delayRangeMs.validate();
        navigatorOverrides = navigatorOverrides == null ? new LinkedHashMap<>() : navigatorOverrides;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public DelayRange getDelayRangeMs() {
        return delayRangeMs;
    }

    /**
     * Values injected into {@code navigator} (e.g. {@code hardware_concurrency}, {@code platform}).
     */
    public Map<String, Object> getNavigatorOverrides() {
        return navigatorOverrides;
    }

    public static class DelayRange {
        @JsonProperty("min")
        private int min = 35;
        @JsonProperty("max")
        private int max = 150;

        void validate() {
            min = Math.max(0, min);
            max = Math.max(0, max);
            if (max < min) {
                int t = min;
                min = max;
                max = t;
            }
        }

        public int getMin() {
            return min;
        }

        public int getMax() {
            return max;
        }
    }
}
