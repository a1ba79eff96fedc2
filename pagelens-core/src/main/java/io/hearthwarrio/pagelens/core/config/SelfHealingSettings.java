package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.hearthwarrio.pagelens.core.ResolverSettings;
import io.hearthwarrio.pagelens.core.StrategyTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class SelfHealingSettings {

    @JsonProperty("enabled")
    private boolean enabled = true;
    @JsonProperty("cache_file")
    private String cacheFile = "./cache/selectors.json";
    @JsonProperty("cache_ttl_hours")
    private int cacheTtlHours = 168;
    @JsonProperty("max_candidates")
    private int maxCandidates = 1800;
    @JsonProperty("similarity_threshold")
    private double similarityThreshold = 3.5;
    @JsonProperty("verify_cached")
    private boolean verifyCached = true;
    @JsonProperty("cache_scope")
    private String cacheScope = "host";
    @JsonProperty("strategies")
    private List<String> strategies = new ArrayList<>(List.of("direct", "cached", "text", "semantic"));

    void validate() {
        cacheTtlHours = Math.max(1, cacheTtlHours);
        maxCandidates = Math.max(50, maxCandidates);
        similarityThreshold = Math.max(0.5, Math.min(20.0, similarityThreshold));
        cacheScope = cacheScope == null ? "host" : cacheScope.trim().toLowerCase(Locale.ROOT);
        if (!"host".equals(cacheScope) && !"page".equals(cacheScope)) {
            throw new IllegalArgumentException("self_healing.cache_scope must be 'host' or 'page': " + cacheScope);
        }
        if (strategies == null || strategies.isEmpty()) {
            strategies = new ArrayList<>(List.of("direct"));
        }
        for (String s : strategies) {
            StrategyTag.fromWireName(s);
        }
    }

    /**
     * Resolver settings derived from this section. With self-healing disabled only the direct tier runs.
     */
    public ResolverSettings toResolverSettings() {
        List<StrategyTag> tags = new ArrayList<>();
        if (enabled) {
            for (String s : strategies) {
                tags.add(StrategyTag.fromWireName(s));
            }
        } else {
            tags.add(StrategyTag.DIRECT);
        }
        return new ResolverSettings(tags, similarityThreshold, maxCandidates, verifyCached);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getCacheFile() {
        return cacheFile;
    }

    public int getCacheTtlHours() {
        return cacheTtlHours;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public boolean isVerifyCached() {
        return verifyCached;
    }

    /**
     * @return {@code host} (cache per host name) or {@code page} (per host and path)
     */
    public String getCacheScope() {
        return cacheScope;
    }

    public List<String> getStrategies() {
        return strategies;
    }
}
